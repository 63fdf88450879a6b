/**
 * <strong>Purpose:</strong> Ports between the classification core and its collaborators: network fetch, durable
 * payload store, parsed-tree cache, source format parsers, report rendering and metrics.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.haplotree.application.port;
