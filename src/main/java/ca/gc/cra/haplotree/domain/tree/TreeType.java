package ca.gc.cra.haplotree.domain.tree;

/**
 * Kind of phylogenetic tree, which fixes the contig its markers live on.
 *
 * @since 0.1.0
 */
public enum TreeType {
  /** Y-chromosome tree. */
  Y_DNA("chrY", "Y-DNA", "ydna"),
  /** Mitochondrial tree. */
  MT_DNA("chrM", "MT-DNA", "mtdna");

  private final String contig;
  private final String displayName;
  private final String filePrefix;

  TreeType(String contig, String displayName, String filePrefix) {
    this.contig = contig;
    this.displayName = displayName;
    this.filePrefix = filePrefix;
  }

  /**
   * Returns the contig name used for this tree's markers.
   *
   * @return contig such as {@code chrY}
   */
  public String contig() {
    return contig;
  }

  /**
   * Returns the human-readable label used in reports.
   *
   * @return display name such as {@code Y-DNA}
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Returns the prefix used for generated file names.
   *
   * @return lowercase prefix such as {@code ydna}
   */
  public String filePrefix() {
    return filePrefix;
  }
}
