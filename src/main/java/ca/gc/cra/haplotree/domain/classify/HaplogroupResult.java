package ca.gc.cra.haplotree.domain.classify;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Scored candidate haplogroup.
 * <p>Counts are cumulative along the lineage from the root to this node.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param name haplogroup name
 * @param score accumulated evidence score
 * @param matchingSnps cumulative derived markers
 * @param ancestralMatches cumulative ancestral markers
 * @param noCalls cumulative markers without a call
 * @param unknownCalls cumulative markers whose call matched neither allele
 * @param ownLoci markers defined on this node itself
 * @param cumulativeLoci markers defined along the whole lineage
 * @param depth distance from the tree root (root is 0)
 * @param lineage node names from the root to this node, inclusive
 * @since 0.1.0
 */
public record HaplogroupResult(
    String name,
    double score,
    int matchingSnps,
    int ancestralMatches,
    int noCalls,
    int unknownCalls,
    int ownLoci,
    int cumulativeLoci,
    int depth,
    List<String> lineage) {

  /**
   * Ranking order: score descending, then depth descending, then name ascending.
   */
  public static final Comparator<HaplogroupResult> RANKING =
      Comparator.comparingDouble(HaplogroupResult::score).reversed()
          .thenComparing(Comparator.comparingInt(HaplogroupResult::depth).reversed())
          .thenComparing(HaplogroupResult::name);

  /**
   * Copies the lineage unless it is already an immutable shared chain.
   */
  public HaplogroupResult {
    Objects.requireNonNull(name, "name");
    if (!(lineage instanceof Lineage)) {
      lineage = lineage == null ? List.of() : List.copyOf(lineage);
    }
  }

  /**
   * Returns the markers with a usable call (derived or ancestral).
   *
   * @return callable marker count
   */
  public int callable() {
    return matchingSnps + ancestralMatches;
  }
}
