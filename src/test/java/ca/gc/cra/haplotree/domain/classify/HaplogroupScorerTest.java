package ca.gc.cra.haplotree.domain.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import ca.gc.cra.haplotree.testutil.TreeFixtures;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class HaplogroupScorerTest {
  private final HaplogroupScorer scorer = new HaplogroupScorer();

  @Test
  void derivedAtDeeperNodeWinsDepthTieBreak() {
    List<HaplogroupResult> ranked = scorer.classify(TreeFixtures.chain(), ObservedCalls.of(Map.of(1000L, "T")));

    Map<String, HaplogroupResult> byName = index(ranked);
    assertCounts(byName.get("A1"), 1, 0, 0);
    assertCounts(byName.get("A1a"), 1, 0, 1);
    assertEquals(1.0, byName.get("A1").score());
    assertEquals(1.0, byName.get("A1a").score());
    assertEquals(List.of("A1a", "A1", "A"), ranked.stream().map(HaplogroupResult::name).toList());
    assertEquals(List.of("A", "A1", "A1a"), ranked.get(0).lineage());
  }

  @Test
  void cumulativeCountsEqualOwnPlusParent() {
    HaplogroupTree tree = TreeFixtures.branching();
    ObservedCalls calls = ObservedCalls.of(Map.of(100L, "A", 200L, "T", 300L, "G", 400L, "N"));

    Map<String, HaplogroupResult> byName = index(scorer.classify(tree, calls));

    HaplogroupResult root = byName.get("R");
    assertEquals(root.ownLoci(), root.matchingSnps() + root.ancestralMatches() + root.noCalls());
    HaplogroupResult r1 = byName.get("R1");
    assertCounts(r1, 2, 1, 0);
    assertEquals(3, r1.cumulativeLoci());
    HaplogroupResult r1a = byName.get("R1a");
    assertCounts(r1a, 2, 1, 1);
    assertEquals(r1.score(), r1a.score());
    HaplogroupResult r2 = byName.get("R2");
    assertEquals(1, r2.unknownCalls());
    assertEquals(1.0, r2.score());
  }

  @Test
  void rankingIsScoreThenDepthThenName() {
    HaplogroupTree tree = TreeFixtures.branching();
    ObservedCalls calls = ObservedCalls.of(Map.of(100L, "A", 200L, "T", 300L, "C", 400L, "A"));

    List<String> order = scorer.classify(tree, calls).stream().map(HaplogroupResult::name).toList();

    assertEquals(List.of("R1a", "R1", "R2", "R"), order);
  }

  @Test
  void everyRootOfAForestIsScoredAtDepthZero() {
    ObservedCalls calls = ObservedCalls.of(Map.of(20L, "T", 10L, "A"));

    List<HaplogroupResult> ranked = scorer.classify(TreeFixtures.multiRoot(), calls);

    assertEquals(List.of("Y1", "W", "Y", "X"), ranked.stream().map(HaplogroupResult::name).toList());
    Map<String, HaplogroupResult> byName = index(ranked);
    for (String root : List.of("X", "Y", "W")) {
      assertEquals(0, byName.get(root).depth(), root);
      assertEquals(List.of(root), byName.get(root).lineage());
    }
    assertCounts(byName.get("X"), 0, 1, 0);
    assertEquals(-1.0, byName.get("X").score());
    assertCounts(byName.get("W"), 0, 0, 1);
    assertCounts(byName.get("Y"), 0, 0, 0);
    assertCounts(byName.get("Y1"), 1, 0, 0);
    assertEquals(1, byName.get("Y1").depth());
    assertEquals(List.of("Y", "Y1"), byName.get("Y1").lineage());
  }

  @Test
  void childLineageSharesItsParentsLineage() {
    Map<String, HaplogroupResult> byName =
        index(scorer.classify(TreeFixtures.branching(), ObservedCalls.empty()));

    List<String> r1 = byName.get("R1").lineage();
    List<String> r1a = byName.get("R1a").lineage();
    assertSame(r1, r1a.subList(0, 2));
    assertEquals(List.of("R", "R1", "R1a"), r1a);
    assertEquals(List.of("R1", "R1a"), r1a.subList(1, 3));
    assertEquals("R1", r1a.get(1));
    assertThrows(UnsupportedOperationException.class, () -> r1a.add("R1a1"));
  }

  @Test
  void classifyIsIdempotent() {
    HaplogroupTree tree = TreeFixtures.branching();
    ObservedCalls calls = ObservedCalls.of(Map.of(100L, "A", 400L, "A"));

    assertEquals(scorer.classify(tree, calls), scorer.classify(tree, calls));
  }

  @Test
  void weightsChangeAncestralPenalty() {
    HaplogroupScorer lenient = new HaplogroupScorer(new ScoringWeights(1.0, 0.0));
    ObservedCalls calls = ObservedCalls.of(Map.of(100L, "A", 200L, "C", 300L, "C"));

    Map<String, HaplogroupResult> byName = index(lenient.classify(TreeFixtures.branching(), calls));

    assertEquals(2.0, byName.get("R1").score());
  }

  @Test
  void callsMatchAllelesCaseInsensitively() {
    Map<String, HaplogroupResult> byName =
        index(scorer.classify(TreeFixtures.chain(), ObservedCalls.of(Map.of(1000L, "t", 2000L, "a"))));

    assertCounts(byName.get("A1a"), 1, 1, 0);
  }

  @Test
  void emptyTreeYieldsNoResults() {
    assertTrue(scorer.classify(HaplogroupTree.builder("GRCh38").build(), ObservedCalls.empty()).isEmpty());
  }

  private static void assertCounts(HaplogroupResult result, int derived, int ancestral, int noCalls) {
    assertEquals(derived, result.matchingSnps(), "derived for " + result.name());
    assertEquals(ancestral, result.ancestralMatches(), "ancestral for " + result.name());
    assertEquals(noCalls, result.noCalls(), "no-calls for " + result.name());
  }

  private static Map<String, HaplogroupResult> index(List<HaplogroupResult> ranked) {
    return ranked.stream().collect(Collectors.toMap(HaplogroupResult::name, Function.identity()));
  }
}
