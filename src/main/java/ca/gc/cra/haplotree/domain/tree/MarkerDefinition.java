package ca.gc.cra.haplotree.domain.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Build-independent marker as published by a tree source: a name plus one coordinate per known assembly.
 *
 * @param name marker label
 * @param coordinates coordinates keyed by canonical build name
 * @since 0.1.0
 */
public record MarkerDefinition(String name, Map<String, MarkerCoordinate> coordinates) {

  /**
   * Copies the coordinate map, keeping insertion order.
   */
  public MarkerDefinition {
    Objects.requireNonNull(name, "name");
    coordinates = coordinates == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(coordinates));
  }

  /**
   * Creates a marker known in a single assembly.
   *
   * @param name marker label
   * @param build canonical build name
   * @param coordinate coordinate in {@code build}
   * @return marker definition
   */
  public static MarkerDefinition single(String name, String build, MarkerCoordinate coordinate) {
    return new MarkerDefinition(name, Map.of(build, coordinate));
  }

  /**
   * Returns the coordinate for {@code build} if the source published one.
   *
   * @param build canonical build name
   * @return coordinate when present
   */
  public Optional<MarkerCoordinate> coordinate(String build) {
    return Optional.ofNullable(coordinates.get(build));
  }
}
