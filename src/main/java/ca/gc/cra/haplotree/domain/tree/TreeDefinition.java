package ca.gc.cra.haplotree.domain.tree;

import java.util.List;

/**
 * Build-independent tree as parsed from a source payload.
 * <p>Sibling order in the assembled tree follows the order of {@link #nodes()}.</p>
 *
 * @param nodes node definitions
 * @since 0.1.0
 */
public record TreeDefinition(List<NodeDefinition> nodes) {

  /**
   * Copies the node list.
   */
  public TreeDefinition {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
  }

  /**
   * Counts markers across all nodes.
   *
   * @return total number of marker definitions
   */
  public int markerCount() {
    int count = 0;
    for (NodeDefinition node : nodes) {
      count += node.markers().size();
    }
    return count;
  }
}
