package ca.gc.cra.haplotree.domain.tree;

import java.util.Locale;
import java.util.Map;

/**
 * Reference assembly names and the sequence accessions that tree sources use in their place.
 *
 * @since 0.1.0
 */
public final class ReferenceBuilds {
  /** GRCh37 / hg19. */
  public static final String GRCH37 = "GRCh37";
  /** GRCh38 / hg38. */
  public static final String GRCH38 = "GRCh38";
  /** Telomere-to-telomere CHM13 v2.0. */
  public static final String T2T_CHM13 = "T2T-CHM13v2.0";
  /** Revised Cambridge Reference Sequence for chrM. */
  public static final String RCRS = "rCRS";

  private static final Map<String, String> ACCESSIONS = Map.of(
      "CM000686.2", GRCH38,
      "NC_000024.10", GRCH38,
      "NC_060948.1", T2T_CHM13,
      "CP086569.2", T2T_CHM13,
      "CM000686.1", GRCH37,
      "NC_000024.9", GRCH37);

  private static final Map<String, String> ALIASES = Map.of(
      "grch37", GRCH37,
      "hg19", GRCH37,
      "grch38", GRCH38,
      "hg38", GRCH38,
      "t2t-chm13v2.0", T2T_CHM13,
      "chm13v2.0", T2T_CHM13,
      "hs1", T2T_CHM13,
      "rcrs", RCRS);

  private ReferenceBuilds() {
    // Utility
  }

  /**
   * Maps an accession or alias onto a canonical build name.
   * Unrecognized values are returned trimmed but otherwise unchanged.
   *
   * @param raw build name, alias or sequence accession
   * @return canonical build name
   * @throws IllegalArgumentException if {@code raw} is {@code null} or blank
   */
  public static String canonical(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("reference build must not be blank");
    }
    String trimmed = raw.trim();
    String accession = ACCESSIONS.get(trimmed);
    if (accession != null) {
      return accession;
    }
    return ALIASES.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
  }
}
