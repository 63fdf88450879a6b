package ca.gc.cra.haplotree.domain.classify;

import ca.gc.cra.haplotree.domain.tree.Locus;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one marker given the observed call at its position. Allele comparison ignores case.
 *
 * @since 0.1.0
 */
public enum CallState {
  /** Observed allele equals the derived allele. */
  DERIVED("Derived"),
  /** Observed allele equals the ancestral allele. */
  ANCESTRAL("Ancestral"),
  /** A call exists but matches neither allele. */
  UNKNOWN("Unknown"),
  /** No call at the marker position. */
  NO_CALL("No Call");

  private final String label;

  CallState(String label) {
    this.label = label;
  }

  /**
   * Returns the label printed in reports.
   *
   * @return human-readable state
   */
  public String label() {
    return label;
  }

  /**
   * Classifies the call observed for {@code locus}.
   *
   * @param locus marker under evaluation
   * @param calls observed calls
   * @return marker state
   */
  public static CallState of(Locus locus, ObservedCalls calls) {
    Objects.requireNonNull(locus, "locus");
    Objects.requireNonNull(calls, "calls");
    Optional<String> called = calls.at(locus.position());
    if (called.isEmpty()) {
      return NO_CALL;
    }
    String allele = called.get();
    if (allele.equalsIgnoreCase(locus.alt())) {
      return DERIVED;
    }
    if (allele.equalsIgnoreCase(locus.ref())) {
      return ANCESTRAL;
    }
    return UNKNOWN;
  }
}
