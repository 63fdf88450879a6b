package ca.gc.cra.haplotree.domain.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds an immutable {@link HaplogroupTree} for one assembly from a parsed {@link TreeDefinition}.
 * <p>Markers without a coordinate in the requested assembly are dropped from their node and counted in
 * {@link Assembly#droppedMarkers()}; the tree is still built.</p>
 *
 * @since 0.1.0
 */
public final class TreeAssembler {
  private final CoordinateReconciler reconciler;

  /**
   * Creates an assembler bound to a source's reconciliation rules.
   *
   * @param reconciler coordinate reconciler for the source
   */
  public TreeAssembler(CoordinateReconciler reconciler) {
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
  }

  /**
   * Reconciles every marker and freezes the tree.
   *
   * @param definition parsed tree
   * @param targetBuild canonical requested build
   * @return assembled tree plus the number of dropped markers
   * @throws IllegalArgumentException when the definition violates tree invariants (duplicate names,
   *     unknown parents, cycles)
   */
  public Assembly assemble(TreeDefinition definition, String targetBuild) {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(targetBuild, "targetBuild");
    HaplogroupTree.Builder builder = HaplogroupTree.builder(targetBuild);
    int dropped = 0;
    for (NodeDefinition node : definition.nodes()) {
      List<Locus> loci = new ArrayList<>(node.markers().size());
      for (MarkerDefinition marker : node.markers()) {
        Optional<Locus> locus = reconciler.reconcile(marker, targetBuild);
        if (locus.isPresent()) {
          loci.add(locus.get());
        } else {
          dropped++;
        }
      }
      builder.add(node.name(), node.parent(), loci);
    }
    return new Assembly(builder.build(), dropped);
  }

  /**
   * Result of assembling a tree for one build.
   *
   * @param tree immutable tree
   * @param droppedMarkers markers that had no coordinate in the requested build
   */
  public record Assembly(HaplogroupTree tree, int droppedMarkers) {}
}
