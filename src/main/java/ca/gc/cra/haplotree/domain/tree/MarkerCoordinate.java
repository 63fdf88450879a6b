package ca.gc.cra.haplotree.domain.tree;

import java.util.Objects;

/**
 * Position and alleles of a marker in one reference assembly.
 *
 * @param position 1-based coordinate
 * @param ancestral ancestral allele
 * @param derived derived allele
 * @since 0.1.0
 */
public record MarkerCoordinate(long position, String ancestral, String derived) {

  /**
   * Validates the coordinate.
   *
   * @throws IllegalArgumentException if the position is not positive
   */
  public MarkerCoordinate {
    Objects.requireNonNull(ancestral, "ancestral");
    Objects.requireNonNull(derived, "derived");
    if (position <= 0) {
      throw new IllegalArgumentException("position must be positive");
    }
  }
}
