package ca.gc.cra.haplotree.application.analysis;

import ca.gc.cra.haplotree.application.tree.TreeSource;
import ca.gc.cra.haplotree.domain.classify.HaplogroupResult;
import ca.gc.cra.haplotree.domain.classify.ObservedCalls;
import ca.gc.cra.haplotree.domain.classify.PathStep;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of classifying one sample against one tree.
 *
 * @param source tree source the tree came from
 * @param tree tree the sample was scored against
 * @param calls observed calls
 * @param ranked every candidate, best first
 * @param path root-to-prediction path, empty when nothing was ranked
 * @param confidence confidence of the top result in {@code [0, cap]}
 * @since 0.1.0
 */
public record HaplogroupAnalysis(
    TreeSource source,
    HaplogroupTree tree,
    ObservedCalls calls,
    List<HaplogroupResult> ranked,
    List<PathStep> path,
    double confidence) {

  /**
   * Validates and freezes the analysis.
   */
  public HaplogroupAnalysis {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(calls, "calls");
    ranked = List.copyOf(Objects.requireNonNull(ranked, "ranked"));
    path = List.copyOf(Objects.requireNonNull(path, "path"));
  }

  /**
   * Returns the best candidate.
   *
   * @return top result, empty for an empty tree
   */
  public Optional<HaplogroupResult> top() {
    return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
  }

  /**
   * Indicates whether the sample supports any prediction, i.e. the top result carries derived evidence.
   *
   * @return {@code true} when a haplogroup could be determined
   */
  public boolean determined() {
    return top().map(r -> r.matchingSnps() > 0).orElse(false);
  }
}
