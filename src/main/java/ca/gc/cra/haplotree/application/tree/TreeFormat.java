package ca.gc.cra.haplotree.application.tree;

/**
 * Wire format of a tree source payload; selects the parser used by {@link TreeProvider}.
 *
 * @since 0.1.0
 */
public enum TreeFormat {
  /** FamilyTreeDNA haplotree export keyed by node id. */
  FTDNA,
  /** Decoding-Us flat node list with per-assembly marker coordinates. */
  DECODINGUS
}
