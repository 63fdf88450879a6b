package ca.gc.cra.haplotree.infrastructure.parse;

import ca.gc.cra.haplotree.application.port.TreeFormatParser;
import ca.gc.cra.haplotree.application.port.TreeParseException;
import ca.gc.cra.haplotree.domain.tree.MarkerCoordinate;
import ca.gc.cra.haplotree.domain.tree.MarkerDefinition;
import ca.gc.cra.haplotree.domain.tree.NodeDefinition;
import ca.gc.cra.haplotree.domain.tree.TreeDefinition;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Parses the FamilyTreeDNA haplotree export.
 * <p>The document is {@code {"allNodes": {"<id>": node, ...}}}. Each node carries {@code name},
 * {@code isRoot}, {@code variants} and the ordered {@code children} id list. Variant positions are native-build
 * coordinates; variants without a usable position are skipped. Only nodes reachable from a root through
 * {@code children} are emitted, in pre-order. Unknown fields are ignored.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @since 0.1.0
 */
public final class FtdnaTreeParser implements TreeFormatParser {
  private static final Logger log = LoggerFactory.getLogger(FtdnaTreeParser.class);

  private final JsonFactory factory = new JsonFactory();

  @Override
  public TreeDefinition parse(byte[] payload, String nativeBuild) throws TreeParseException {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(nativeBuild, "nativeBuild");
    Map<String, RawNode> nodes;
    try (JsonParser parser = factory.createParser(payload)) {
      nodes = readDocument(parser, nativeBuild);
    } catch (IOException ex) {
      throw new TreeParseException("Invalid FTDNA tree JSON: " + ex.getMessage(), ex);
    }
    return link(nodes);
  }

  private Map<String, RawNode> readDocument(JsonParser parser, String nativeBuild)
      throws IOException, TreeParseException {
    JsonTokens.expect(parser, parser.nextToken(), JsonToken.START_OBJECT, "document");
    Map<String, RawNode> nodes = null;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken value = parser.nextToken();
      if ("allNodes".equals(field)) {
        JsonTokens.expect(parser, value, JsonToken.START_OBJECT, "allNodes");
        nodes = readAllNodes(parser, nativeBuild);
      } else {
        parser.skipChildren();
      }
    }
    if (nodes == null) {
      throw new TreeParseException("FTDNA tree document has no allNodes object");
    }
    return nodes;
  }

  private Map<String, RawNode> readAllNodes(JsonParser parser, String nativeBuild)
      throws IOException, TreeParseException {
    Map<String, RawNode> nodes = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String id = parser.currentName();
      JsonTokens.expect(parser, parser.nextToken(), JsonToken.START_OBJECT, "node " + id);
      nodes.put(id, readNode(parser, id, nativeBuild));
    }
    return nodes;
  }

  private RawNode readNode(JsonParser parser, String id, String nativeBuild) throws IOException, TreeParseException {
    String name = null;
    boolean root = false;
    List<MarkerDefinition> markers = new ArrayList<>();
    List<String> children = new ArrayList<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "name" -> name = JsonTokens.text(parser);
        case "isRoot" -> root = value == JsonToken.VALUE_TRUE;
        case "variants" -> {
          if (value == JsonToken.START_ARRAY) {
            JsonToken item;
            while ((item = parser.nextToken()) != JsonToken.END_ARRAY) {
              if (item != JsonToken.START_OBJECT) {
                parser.skipChildren();
                continue;
              }
              MarkerDefinition marker = readVariant(parser, nativeBuild);
              if (marker != null) {
                markers.add(marker);
              }
            }
          } else {
            parser.skipChildren();
          }
        }
        case "children" -> {
          if (value == JsonToken.START_ARRAY) {
            while (parser.nextToken() != JsonToken.END_ARRAY) {
              String child = JsonTokens.text(parser);
              if (child != null) {
                children.add(child);
              }
            }
          } else {
            parser.skipChildren();
          }
        }
        default -> parser.skipChildren();
      }
    }
    if (name == null || name.isBlank()) {
      throw new TreeParseException("FTDNA node " + id + " has no name");
    }
    return new RawNode(name, root, markers, children);
  }

  private MarkerDefinition readVariant(JsonParser parser, String nativeBuild) throws IOException {
    String name = null;
    Long position = null;
    String ancestral = null;
    String derived = null;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      parser.nextToken();
      switch (field) {
        case "variant" -> name = JsonTokens.text(parser);
        case "position" -> position = JsonTokens.number(parser);
        case "ancestral" -> ancestral = JsonTokens.text(parser);
        case "derived" -> derived = JsonTokens.text(parser);
        default -> parser.skipChildren();
      }
    }
    if (position == null || position <= 0) {
      return null;
    }
    String label = name == null || name.isBlank() ? Long.toString(position) : name;
    return MarkerDefinition.single(label, nativeBuild, new MarkerCoordinate(
        position, ancestral == null ? "" : ancestral, derived == null ? "" : derived));
  }

  private TreeDefinition link(Map<String, RawNode> nodes) throws TreeParseException {
    List<String> roots = new ArrayList<>();
    for (Map.Entry<String, RawNode> entry : nodes.entrySet()) {
      if (entry.getValue().root()) {
        roots.add(entry.getKey());
      }
    }
    if (roots.isEmpty() && !nodes.isEmpty()) {
      throw new TreeParseException("FTDNA tree has no node flagged isRoot");
    }

    List<NodeDefinition> ordered = new ArrayList<>(nodes.size());
    Set<String> visited = new HashSet<>();
    Deque<Pending> stack = new ArrayDeque<>();
    for (int i = roots.size() - 1; i >= 0; i--) {
      stack.push(new Pending(roots.get(i), null));
    }
    while (!stack.isEmpty()) {
      Pending pending = stack.pop();
      RawNode node = nodes.get(pending.id());
      if (node == null) {
        throw new TreeParseException("FTDNA node " + pending.parent() + " lists unknown child id " + pending.id());
      }
      if (!visited.add(pending.id())) {
        throw new TreeParseException("FTDNA node " + node.name() + " is reachable more than once");
      }
      ordered.add(new NodeDefinition(node.name(), pending.parent(), node.markers()));
      List<String> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new Pending(children.get(i), node.name()));
      }
    }
    int unreachable = nodes.size() - visited.size();
    if (unreachable > 0) {
      log.debug("Ignored {} FTDNA nodes not reachable from a root", unreachable);
    }
    return new TreeDefinition(ordered);
  }

  private record RawNode(String name, boolean root, List<MarkerDefinition> markers, List<String> children) {}

  private record Pending(String id, String parent) {}
}
