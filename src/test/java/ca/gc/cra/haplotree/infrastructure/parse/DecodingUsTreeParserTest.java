package ca.gc.cra.haplotree.infrastructure.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.haplotree.application.port.TreeParseException;
import ca.gc.cra.haplotree.domain.tree.MarkerDefinition;
import ca.gc.cra.haplotree.domain.tree.NodeDefinition;
import ca.gc.cra.haplotree.domain.tree.ReferenceBuilds;
import ca.gc.cra.haplotree.domain.tree.TreeDefinition;
import ca.gc.cra.haplotree.testutil.TreeFixtures;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DecodingUsTreeParserTest {
  private final DecodingUsTreeParser parser = new DecodingUsTreeParser();

  @Test
  void accessionKeysAreMappedToBuilds() throws Exception {
    Map<String, NodeDefinition> byName = index(parse(TreeFixtures.resource("decodingus-ytree.json")));

    MarkerDefinition m168 = byName.get("CT").markers().get(0);
    assertEquals(Set.of(ReferenceBuilds.GRCH38, ReferenceBuilds.T2T_CHM13), m168.coordinates().keySet());
    assertEquals(2754120, m168.coordinate(ReferenceBuilds.T2T_CHM13).orElseThrow().position());
    MarkerDefinition m207 = byName.get("R").markers().get(0);
    assertEquals(17693863, m207.coordinate(ReferenceBuilds.GRCH37).orElseThrow().position());
    assertEquals("A", m207.coordinate(ReferenceBuilds.GRCH37).orElseThrow().ancestral());
    assertEquals("G", m207.coordinate(ReferenceBuilds.GRCH37).orElseThrow().derived());
  }

  @Test
  void variantsWithoutCoordinatesAreSkipped() throws Exception {
    NodeDefinition m269 = index(parse(TreeFixtures.resource("decodingus-ytree.json"))).get("R-M269");

    assertEquals(List.of("M269"), m269.markers().stream().map(MarkerDefinition::name).toList());
  }

  @Test
  void orphanAttachesToRootAndDocumentOrderIsKept() throws Exception {
    TreeDefinition definition = parse(TreeFixtures.resource("decodingus-ytree.json"));

    assertEquals(
        List.of("A0-T", "CT", "R", "R-M269", "Stray"),
        definition.nodes().stream().map(NodeDefinition::name).toList());
    Map<String, NodeDefinition> byName = index(definition);
    assertNull(byName.get("A0-T").parent());
    assertEquals("A0-T", byName.get("Stray").parent());
  }

  @Test
  void firstNodeBecomesRootWhenEveryNodeHasParent() throws Exception {
    String json = """
        [{"name": "X", "parentName": "Gone"}, {"name": "Y", "parentName": "X"}]
        """;

    TreeDefinition definition = parse(json);

    assertNull(definition.nodes().get(0).parent());
    assertEquals("X", definition.nodes().get(1).parent());
  }

  @Test
  void emptyArrayYieldsEmptyDefinition() throws Exception {
    assertTrue(parse("[]").nodes().isEmpty());
  }

  @Test
  void nonArrayDocumentIsParseFailure() {
    assertThrows(TreeParseException.class, () -> parse("{\"name\": \"A\"}"));
    assertThrows(TreeParseException.class, () -> parse("[{\"parentName\": \"A\"}]"));
    assertThrows(TreeParseException.class, () -> parse("[{\"name\": \"A\""));
  }

  private TreeDefinition parse(String json) throws TreeParseException {
    return parser.parse(json.getBytes(StandardCharsets.UTF_8), ReferenceBuilds.GRCH38);
  }

  private static Map<String, NodeDefinition> index(TreeDefinition definition) {
    return definition.nodes().stream().collect(Collectors.toMap(NodeDefinition::name, Function.identity()));
  }
}
