package ca.gc.cra.haplotree.domain.tree;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Resolves a build-independent marker onto a requested reference assembly.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>A coordinate published for the requested build is used as is.</li>
 *   <li>When the requested build is the source's native build, or shares its coordinate system (for example
 *   {@code rCRS} and GRCh38 {@code chrM}), the native coordinate passes through.</li>
 *   <li>Otherwise the marker has no coordinate in the requested build and is reported as a gap.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class CoordinateReconciler {
  private final String nativeBuild;
  private final Set<String> nativeEquivalents;

  /**
   * Creates a reconciler for a source published in {@code nativeBuild}.
   *
   * @param nativeBuild canonical build of the source's own coordinates
   * @param nativeEquivalents canonical builds that share the native coordinate system
   */
  public CoordinateReconciler(String nativeBuild, Set<String> nativeEquivalents) {
    this.nativeBuild = Objects.requireNonNull(nativeBuild, "nativeBuild");
    this.nativeEquivalents = Set.copyOf(Objects.requireNonNull(nativeEquivalents, "nativeEquivalents"));
  }

  /**
   * Returns the source's native build.
   *
   * @return canonical build name
   */
  public String nativeBuild() {
    return nativeBuild;
  }

  /**
   * Resolves {@code marker} for {@code targetBuild}.
   *
   * @param marker marker as published by the source
   * @param targetBuild canonical requested build
   * @return locus in {@code targetBuild} coordinates, or empty when the marker cannot be placed
   */
  public Optional<Locus> reconcile(MarkerDefinition marker, String targetBuild) {
    Objects.requireNonNull(marker, "marker");
    Objects.requireNonNull(targetBuild, "targetBuild");
    Optional<MarkerCoordinate> coordinate = marker.coordinate(targetBuild);
    if (coordinate.isEmpty() && sharesNativeCoordinates(targetBuild)) {
      coordinate = marker.coordinate(nativeBuild);
    }
    return coordinate.map(c -> new Locus(marker.name(), c.position(), c.ancestral(), c.derived()));
  }

  private boolean sharesNativeCoordinates(String targetBuild) {
    return nativeBuild.equals(targetBuild) || nativeEquivalents.contains(targetBuild);
  }
}
