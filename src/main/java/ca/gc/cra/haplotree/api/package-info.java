/**
 * CLI entry points for the {@code classify} and {@code sources} commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes
 * the classification use case.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and URLs before any download or file write.</p>
 */
package ca.gc.cra.haplotree.api;
