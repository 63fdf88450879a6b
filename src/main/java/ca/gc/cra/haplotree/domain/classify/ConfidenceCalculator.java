package ca.gc.cra.haplotree.domain.classify;

import java.util.List;
import java.util.Objects;

/**
 * Confidence of a haplogroup assignment in {@code [0, cap]}.
 * <p>Match quality is the share of callable markers on the top lineage that are derived. It is reduced by up to
 * 10% when the closest non-ancestor competitor scores within 20% of the top score. Missing tree coverage is not
 * penalized.</p>
 *
 * @since 0.1.0
 */
public final class ConfidenceCalculator {
  private static final double AMBIGUITY_WINDOW = 0.2;
  private static final double AMBIGUITY_SCALE = 0.5;

  private ConfidenceCalculator() {}

  /**
   * Calculates confidence for {@code top} among {@code ranked}.
   *
   * @param top top-ranked result
   * @param ranked all results, best first
   * @param cap maximum confidence, e.g. lower for sparse array data
   * @return confidence between 0 and {@code cap}
   */
  public static double calculate(HaplogroupResult top, List<HaplogroupResult> ranked, double cap) {
    Objects.requireNonNull(top, "top");
    Objects.requireNonNull(ranked, "ranked");
    int callable = top.callable();
    double matchQuality = callable > 0 ? (double) top.matchingSnps() / callable : 0.0;
    double confidence = matchQuality * (1.0 - ambiguityPenalty(top, ranked));
    return Math.min(cap, Math.max(0.0, confidence));
  }

  private static double ambiguityPenalty(HaplogroupResult top, List<HaplogroupResult> ranked) {
    if (ranked.size() <= 1 || top.score() <= 0) {
      return 0.0;
    }
    for (HaplogroupResult candidate : ranked) {
      if (candidate == top || isAncestorOrSelf(candidate, top)) {
        continue;
      }
      if (candidate.score() <= 0) {
        return 0.0;
      }
      double gap = (top.score() - candidate.score()) / top.score();
      return gap < AMBIGUITY_WINDOW ? (AMBIGUITY_WINDOW - gap) * AMBIGUITY_SCALE : 0.0;
    }
    return 0.0;
  }

  private static boolean isAncestorOrSelf(HaplogroupResult candidate, HaplogroupResult top) {
    List<String> topLineage = top.lineage();
    List<String> candidateLineage = candidate.lineage();
    return candidateLineage.size() <= topLineage.size()
        && topLineage.subList(0, candidateLineage.size()).equals(candidateLineage);
  }
}
