package ca.gc.cra.haplotree.domain.tree;

import java.util.Objects;

/**
 * <strong>What:</strong> A single haplogroup-defining marker resolved for one reference assembly.
 * <p><strong>Why:</strong> Scoring compares the observed allele at {@link #position()} with the ancestral and
 * derived alleles carried here.</p>
 * <p><strong>Role:</strong> Domain value owned by a {@link Haplogroup}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @param name marker label (for example {@code M269}); never blank
 * @param position 1-based coordinate in the assembly the owning tree was built for
 * @param ref ancestral allele
 * @param alt derived allele
 * @since 0.1.0
 */
public record Locus(String name, long position, String ref, String alt) {

  /**
   * Validates marker fields.
   *
   * @throws NullPointerException if any allele or the name is {@code null}
   * @throws IllegalArgumentException if the position is not positive
   */
  public Locus {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(alt, "alt");
    if (position <= 0) {
      throw new IllegalArgumentException("position must be positive for locus " + name);
    }
  }
}
