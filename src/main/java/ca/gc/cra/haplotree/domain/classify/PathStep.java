package ca.gc.cra.haplotree.domain.classify;

import ca.gc.cra.haplotree.domain.tree.Haplogroup;
import java.util.Objects;

/**
 * One node on a root-to-target path.
 *
 * @param node haplogroup on the path
 * @param depth distance from the root (root is 0)
 * @since 0.1.0
 */
public record PathStep(Haplogroup node, int depth) {

  /**
   * Validates the step.
   */
  public PathStep {
    Objects.requireNonNull(node, "node");
    if (depth < 0) {
      throw new IllegalArgumentException("depth must not be negative");
    }
  }

  /**
   * Convenience accessor for the node name.
   *
   * @return haplogroup name
   */
  public String name() {
    return node.name();
  }
}
