package ca.gc.cra.haplotree.domain.tree;

import java.util.List;
import java.util.Objects;

/**
 * Parsed, not yet reconciled haplogroup node.
 *
 * @param name haplogroup name
 * @param parent parent name, {@code null} for roots
 * @param markers defining markers in declared order
 * @since 0.1.0
 */
public record NodeDefinition(String name, String parent, List<MarkerDefinition> markers) {

  /**
   * Copies the marker list.
   */
  public NodeDefinition {
    Objects.requireNonNull(name, "name");
    markers = markers == null ? List.of() : List.copyOf(markers);
  }
}
