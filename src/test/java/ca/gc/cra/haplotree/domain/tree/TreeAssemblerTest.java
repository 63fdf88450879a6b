package ca.gc.cra.haplotree.domain.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TreeAssemblerTest {
  private static final MarkerDefinition MULTI = new MarkerDefinition("M207", Map.of(
      ReferenceBuilds.GRCH38, new MarkerCoordinate(15581983, "A", "G"),
      ReferenceBuilds.GRCH37, new MarkerCoordinate(17693863, "A", "G")));
  private static final MarkerDefinition NATIVE_ONLY = MarkerDefinition.single(
      "M269", ReferenceBuilds.GRCH38, new MarkerCoordinate(22739367, "T", "C"));

  private final TreeDefinition definition = new TreeDefinition(List.of(
      new NodeDefinition("R", null, List.of(MULTI)),
      new NodeDefinition("R-M269", "R", List.of(NATIVE_ONLY))));

  @Test
  void nativeBuildKeepsEveryMarker() {
    TreeAssembler assembler = new TreeAssembler(new CoordinateReconciler(ReferenceBuilds.GRCH38, Set.of()));

    TreeAssembler.Assembly assembly = assembler.assemble(definition, ReferenceBuilds.GRCH38);

    assertEquals(0, assembly.droppedMarkers());
    assertEquals(15581983, assembly.tree().node("R").orElseThrow().loci().get(0).position());
    assertEquals(1, assembly.tree().node("R-M269").orElseThrow().loci().size());
  }

  @Test
  void markerWithoutCoordinateForTargetIsDroppedButNodeRemains() {
    TreeAssembler assembler = new TreeAssembler(new CoordinateReconciler(ReferenceBuilds.GRCH38, Set.of()));

    TreeAssembler.Assembly assembly = assembler.assemble(definition, ReferenceBuilds.GRCH37);

    assertEquals(1, assembly.droppedMarkers());
    assertEquals(17693863, assembly.tree().node("R").orElseThrow().loci().get(0).position());
    assertTrue(assembly.tree().node("R-M269").orElseThrow().loci().isEmpty());
    assertEquals(ReferenceBuilds.GRCH37, assembly.tree().build());
  }

  @Test
  void nativeEquivalentReusesNativeCoordinates() {
    CoordinateReconciler reconciler = new CoordinateReconciler(ReferenceBuilds.GRCH38, Set.of(ReferenceBuilds.RCRS));

    Locus locus = reconciler.reconcile(NATIVE_ONLY, ReferenceBuilds.RCRS).orElseThrow();

    assertEquals(22739367, locus.position());
    assertEquals("T", locus.ref());
    assertEquals("C", locus.alt());
    assertTrue(reconciler.reconcile(NATIVE_ONLY, ReferenceBuilds.T2T_CHM13).isEmpty());
  }

  @Test
  void definitionCountsMarkers() {
    assertEquals(2, definition.markerCount());
  }
}
