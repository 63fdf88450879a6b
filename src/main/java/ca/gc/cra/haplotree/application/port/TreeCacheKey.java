package ca.gc.cra.haplotree.application.port;

import java.util.Objects;

/**
 * Key of a parsed tree: the tree source and the assembly its loci were reconciled to.
 *
 * @param sourceId tree source identifier
 * @param build canonical reference build
 * @since 0.1.0
 */
public record TreeCacheKey(String sourceId, String build) {

  /**
   * Validates the key parts.
   */
  public TreeCacheKey {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(build, "build");
  }
}
