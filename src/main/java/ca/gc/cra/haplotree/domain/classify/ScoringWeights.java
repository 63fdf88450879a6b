package ca.gc.cra.haplotree.domain.classify;

/**
 * Weights applied to accumulated evidence: {@code branchScore = derivedWeight * derived - ancestralWeight *
 * ancestral}. No-calls and unknown calls carry no weight.
 *
 * @param derivedWeight reward per derived marker; finite and non-negative
 * @param ancestralWeight penalty per ancestral marker; finite and non-negative
 * @since 0.1.0
 */
public record ScoringWeights(double derivedWeight, double ancestralWeight) {
  /** Equal reward and penalty, so a branch scores {@code (2 * matchRate - 1) * callable}. */
  public static final ScoringWeights DEFAULT = new ScoringWeights(1.0, 1.0);

  /**
   * Validates the weights.
   *
   * @throws IllegalArgumentException if a weight is negative, NaN or infinite
   */
  public ScoringWeights {
    requireWeight("derivedWeight", derivedWeight);
    requireWeight("ancestralWeight", ancestralWeight);
  }

  /**
   * Scores one branch.
   *
   * @param derived derived markers on the branch
   * @param ancestral ancestral markers on the branch
   * @return branch score
   */
  public double branchScore(int derived, int ancestral) {
    return derivedWeight * derived - ancestralWeight * ancestral;
  }

  private static void requireWeight(String name, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0) {
      throw new IllegalArgumentException(name + " must be a finite, non-negative number");
    }
  }
}
