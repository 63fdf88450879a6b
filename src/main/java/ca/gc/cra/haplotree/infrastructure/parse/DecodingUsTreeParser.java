package ca.gc.cra.haplotree.infrastructure.parse;

import ca.gc.cra.haplotree.application.port.TreeFormatParser;
import ca.gc.cra.haplotree.application.port.TreeParseException;
import ca.gc.cra.haplotree.domain.tree.MarkerCoordinate;
import ca.gc.cra.haplotree.domain.tree.MarkerDefinition;
import ca.gc.cra.haplotree.domain.tree.NodeDefinition;
import ca.gc.cra.haplotree.domain.tree.ReferenceBuilds;
import ca.gc.cra.haplotree.domain.tree.TreeDefinition;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the Decoding-Us tree API response: a flat JSON array of nodes, each naming its parent and listing
 * variants with coordinates per assembly or accession.
 * <p>The first node without a {@code parentName} is the root. Nodes whose parent is missing from the document
 * are attached to the root. Child order follows document order.</p>
 *
 * @since 0.1.0
 */
public final class DecodingUsTreeParser implements TreeFormatParser {
  private static final Logger log = LoggerFactory.getLogger(DecodingUsTreeParser.class);

  private final JsonFactory factory = new JsonFactory();

  @Override
  public TreeDefinition parse(byte[] payload, String nativeBuild) throws TreeParseException {
    Objects.requireNonNull(payload, "payload");
    List<RawNode> nodes = new ArrayList<>();
    try (JsonParser parser = factory.createParser(payload)) {
      JsonTokens.expect(parser, parser.nextToken(), JsonToken.START_ARRAY, "document");
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        JsonTokens.expect(parser, token, JsonToken.START_OBJECT, "node");
        nodes.add(readNode(parser));
      }
    } catch (IOException ex) {
      throw new TreeParseException("Invalid Decoding-Us tree JSON: " + ex.getMessage(), ex);
    }
    return link(nodes);
  }

  private RawNode readNode(JsonParser parser) throws IOException, TreeParseException {
    String name = null;
    String parent = null;
    List<MarkerDefinition> markers = new ArrayList<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "name" -> name = JsonTokens.text(parser);
        case "parentName" -> parent = JsonTokens.text(parser);
        case "variants" -> {
          if (value == JsonToken.START_ARRAY) {
            JsonToken item;
            while ((item = parser.nextToken()) != JsonToken.END_ARRAY) {
              if (item != JsonToken.START_OBJECT) {
                parser.skipChildren();
                continue;
              }
              MarkerDefinition marker = readVariant(parser);
              if (marker != null) {
                markers.add(marker);
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
      throw new TreeParseException("Decoding-Us node without a name at " + JsonTokens.location(parser));
    }
    return new RawNode(name, parent == null || parent.isBlank() ? null : parent, markers);
  }

  private MarkerDefinition readVariant(JsonParser parser) throws IOException {
    String name = null;
    Map<String, MarkerCoordinate> coordinates = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken value = parser.nextToken();
      if ("name".equals(field)) {
        name = JsonTokens.text(parser);
      } else if ("coordinates".equals(field) && value == JsonToken.START_OBJECT) {
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          String assembly = parser.currentName();
          JsonToken coordinateToken = parser.nextToken();
          if (coordinateToken != JsonToken.START_OBJECT) {
            parser.skipChildren();
            continue;
          }
          MarkerCoordinate coordinate = readCoordinate(parser);
          if (coordinate != null && !assembly.isBlank()) {
            coordinates.putIfAbsent(ReferenceBuilds.canonical(assembly), coordinate);
          }
        }
      } else {
        parser.skipChildren();
      }
    }
    if (name == null || name.isBlank() || coordinates.isEmpty()) {
      return null;
    }
    return new MarkerDefinition(name, coordinates);
  }

  private MarkerCoordinate readCoordinate(JsonParser parser) throws IOException {
    Long start = null;
    String ancestral = null;
    String derived = null;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      parser.nextToken();
      switch (field) {
        case "start" -> start = JsonTokens.number(parser);
        case "anc" -> ancestral = JsonTokens.text(parser);
        case "der" -> derived = JsonTokens.text(parser);
        default -> parser.skipChildren();
      }
    }
    if (start == null || start <= 0) {
      return null;
    }
    return new MarkerCoordinate(start, ancestral == null ? "" : ancestral, derived == null ? "" : derived);
  }

  private TreeDefinition link(List<RawNode> nodes) {
    if (nodes.isEmpty()) {
      return new TreeDefinition(List.of());
    }
    RawNode root = nodes.get(0);
    for (RawNode node : nodes) {
      if (node.parent() == null) {
        root = node;
        break;
      }
    }
    Set<String> names = new HashSet<>();
    for (RawNode node : nodes) {
      names.add(node.name());
    }

    List<NodeDefinition> definitions = new ArrayList<>(nodes.size());
    int reattached = 0;
    for (RawNode node : nodes) {
      if (node == root) {
        definitions.add(new NodeDefinition(node.name(), null, node.markers()));
        continue;
      }
      String parent = node.parent();
      if (parent == null || !names.contains(parent)) {
        parent = root.name();
        reattached++;
      }
      definitions.add(new NodeDefinition(node.name(), parent, node.markers()));
    }
    if (reattached > 0) {
      log.warn("Attached {} Decoding-Us nodes with a missing parent to root {}", reattached, root.name());
    }
    return new TreeDefinition(definitions);
  }

  private record RawNode(String name, String parent, List<MarkerDefinition> markers) {}
}
