package ca.gc.cra.haplotree.infrastructure.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.haplotree.application.port.TreeParseException;
import ca.gc.cra.haplotree.domain.tree.MarkerCoordinate;
import ca.gc.cra.haplotree.domain.tree.NodeDefinition;
import ca.gc.cra.haplotree.domain.tree.TreeDefinition;
import ca.gc.cra.haplotree.testutil.TreeFixtures;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class FtdnaTreeParserTest {
  private final FtdnaTreeParser parser = new FtdnaTreeParser();

  @Test
  void parsesNodesInPreOrderFollowingDeclaredChildren() throws Exception {
    TreeDefinition definition = parse(TreeFixtures.resource("ftdna-ytree.json"));

    assertEquals(
        List.of("A0-T", "CT", "R", "R-M269", "E", "B"),
        definition.nodes().stream().map(NodeDefinition::name).toList());
    Map<String, NodeDefinition> byName = index(definition);
    assertNull(byName.get("A0-T").parent());
    assertEquals("CT", byName.get("E").parent());
    assertEquals("A0-T", byName.get("B").parent());
  }

  @Test
  void variantsWithoutPositionAreSkipped() throws Exception {
    NodeDefinition e = index(parse(TreeFixtures.resource("ftdna-ytree.json"))).get("E");

    assertEquals(1, e.markers().size());
    assertEquals("M96", e.markers().get(0).name());
    MarkerCoordinate coordinate = e.markers().get(0).coordinate("GRCh38").orElseThrow();
    assertEquals(new MarkerCoordinate(20577481, "G", "C"), coordinate);
  }

  @Test
  void unnamedVariantFallsBackToPosition() throws Exception {
    String json = """
        {"allNodes": {"1": {"name": "A", "isRoot": true,
          "variants": [{"position": "123", "ancestral": "A", "derived": "G"}]}}}
        """;

    TreeDefinition definition = parse(json);

    assertEquals("123", definition.nodes().get(0).markers().get(0).name());
  }

  @Test
  void missingChildIdIsParseFailure() {
    String json = """
        {"allNodes": {"1": {"name": "A", "isRoot": true, "children": [7]}}}
        """;

    TreeParseException ex = assertThrows(TreeParseException.class, () -> parse(json));
    assertTrue(ex.getMessage().contains("unknown child id 7"));
  }

  @Test
  void nodeReachableTwiceIsParseFailure() {
    String json = """
        {"allNodes": {
          "1": {"name": "A", "isRoot": true, "children": [2, 3]},
          "2": {"name": "B", "children": [3]},
          "3": {"name": "C"}}}
        """;

    assertThrows(TreeParseException.class, () -> parse(json));
  }

  @Test
  void documentWithoutRootIsParseFailure() {
    assertThrows(TreeParseException.class, () -> parse("{\"allNodes\": {\"1\": {\"name\": \"A\"}}}"));
  }

  @Test
  void malformedJsonIsParseFailure() {
    assertThrows(TreeParseException.class, () -> parse("{\"allNodes\": {"));
    assertThrows(TreeParseException.class, () -> parse("[]"));
  }

  @Test
  void emptyNodeMapYieldsEmptyDefinition() throws Exception {
    assertTrue(parse("{\"allNodes\": {}}").nodes().isEmpty());
  }

  private TreeDefinition parse(String json) throws TreeParseException {
    return parser.parse(json.getBytes(StandardCharsets.UTF_8), "GRCh38");
  }

  private static Map<String, NodeDefinition> index(TreeDefinition definition) {
    return definition.nodes().stream().collect(Collectors.toMap(NodeDefinition::name, Function.identity()));
  }
}
