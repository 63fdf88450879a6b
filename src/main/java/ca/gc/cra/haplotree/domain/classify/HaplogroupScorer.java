package ca.gc.cra.haplotree.domain.classify;

import ca.gc.cra.haplotree.domain.tree.Haplogroup;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import ca.gc.cra.haplotree.domain.tree.Locus;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Ranks every node of a haplogroup tree against a sample's observed calls.
 * <p><strong>How:</strong> A single pre-order pass classifies each node's own markers (see {@link CallState}) and
 * adds them to the cumulative counts carried down from its parent. The node's score is its parent's score plus
 * {@link ScoringWeights#branchScore(int, int)} for its own markers. Every node is a candidate; the list is
 * sorted with {@link HaplogroupResult#RANKING}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable weights; safe for concurrent use over a
 * shared tree.</p>
 * <p><strong>Performance:</strong> O(total markers) plus the final sort. Each result's lineage extends its
 * parent's by one shared link, so memory stays proportional to the node count. Iterative, so deep trees do not
 * grow the call stack.</p>
 *
 * @since 0.1.0
 */
public final class HaplogroupScorer {
  private final ScoringWeights weights;

  /**
   * Creates a scorer with {@link ScoringWeights#DEFAULT}.
   */
  public HaplogroupScorer() {
    this(ScoringWeights.DEFAULT);
  }

  /**
   * Creates a scorer with explicit weights.
   *
   * @param weights evidence weights
   */
  public HaplogroupScorer(ScoringWeights weights) {
    this.weights = Objects.requireNonNull(weights, "weights");
  }

  /**
   * Scores every node of {@code tree}.
   *
   * @param tree immutable tree
   * @param calls observed calls in the tree's assembly coordinates
   * @return all candidates, best first
   */
  public List<HaplogroupResult> classify(HaplogroupTree tree, ObservedCalls calls) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(calls, "calls");
    List<HaplogroupResult> results = new ArrayList<>(tree.size());
    Deque<Frame> stack = new ArrayDeque<>();
    List<Haplogroup> roots = tree.roots();
    for (int i = roots.size() - 1; i >= 0; i--) {
      stack.push(new Frame(roots.get(i), null));
    }
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      HaplogroupResult result = score(frame.node(), frame.parent(), calls);
      results.add(result);
      List<Haplogroup> children = tree.children(frame.node());
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new Frame(children.get(i), result));
      }
    }
    results.sort(HaplogroupResult.RANKING);
    return List.copyOf(results);
  }

  private HaplogroupResult score(Haplogroup node, HaplogroupResult parent, ObservedCalls calls) {
    int derived = 0;
    int ancestral = 0;
    int noCalls = 0;
    int unknown = 0;
    for (Locus locus : node.loci()) {
      switch (CallState.of(locus, calls)) {
        case DERIVED -> derived++;
        case ANCESTRAL -> ancestral++;
        case NO_CALL -> noCalls++;
        case UNKNOWN -> unknown++;
      }
    }
    double branchScore = weights.branchScore(derived, ancestral);
    int ownLoci = node.loci().size();
    if (parent == null) {
      return new HaplogroupResult(
          node.name(), branchScore, derived, ancestral, noCalls, unknown, ownLoci, ownLoci, 0,
          Lineage.root(node.name()));
    }
    return new HaplogroupResult(
        node.name(),
        parent.score() + branchScore,
        parent.matchingSnps() + derived,
        parent.ancestralMatches() + ancestral,
        parent.noCalls() + noCalls,
        parent.unknownCalls() + unknown,
        ownLoci,
        parent.cumulativeLoci() + ownLoci,
        parent.depth() + 1,
        ((Lineage) parent.lineage()).child(node.name()));
  }

  private record Frame(Haplogroup node, HaplogroupResult parent) {}
}
