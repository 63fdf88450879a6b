package ca.gc.cra.haplotree.domain.classify;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Observed alleles keyed by assembly coordinate.
 * <p><strong>Role:</strong> Domain input to the scorer; produced by a variant-calling collaborator.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @since 0.1.0
 */
public final class ObservedCalls {
  private static final ObservedCalls EMPTY = new ObservedCalls(Map.of());

  private final Map<Long, String> calls;

  private ObservedCalls(Map<Long, String> calls) {
    this.calls = calls;
  }

  /**
   * Copies {@code calls}; {@code null} keys or values are rejected.
   *
   * @param calls position to allele map
   * @return immutable call map
   * @throws NullPointerException if the map or any entry is {@code null}
   */
  public static ObservedCalls of(Map<Long, String> calls) {
    Objects.requireNonNull(calls, "calls");
    Map<Long, String> copy = new HashMap<>(calls.size() * 2);
    for (Map.Entry<Long, String> entry : calls.entrySet()) {
      copy.put(
          Objects.requireNonNull(entry.getKey(), "position"),
          Objects.requireNonNull(entry.getValue(), "allele"));
    }
    return new ObservedCalls(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns a call map with no observations.
   *
   * @return empty call map
   */
  public static ObservedCalls empty() {
    return EMPTY;
  }

  /**
   * Returns the allele observed at {@code position}.
   *
   * @param position assembly coordinate
   * @return observed allele when called
   */
  public Optional<String> at(long position) {
    return Optional.ofNullable(calls.get(position));
  }

  /**
   * Returns the number of called positions.
   *
   * @return call count
   */
  public int size() {
    return calls.size();
  }

  /**
   * Returns the underlying read-only map.
   *
   * @return unmodifiable position to allele map
   */
  public Map<Long, String> asMap() {
    return calls;
  }
}
