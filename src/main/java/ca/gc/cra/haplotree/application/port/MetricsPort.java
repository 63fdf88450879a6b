package ca.gc.cra.haplotree.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for tree loading and classification.
 * <p><strong>Why:</strong> Lets the tree provider and analysis use case record cache hits, fetch outcomes and
 * latencies without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates; classification requests
 * may run in parallel.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code tree.cache.memory.hit}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code tree.fetch.failure}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
