/**
 * Configuration loading and composition root wiring for the HAPLOTREE CLI.
 * <p><strong>Role:</strong> Merges defaults, YAML and CLI settings, validates them into
 * {@link ca.gc.cra.haplotree.config.HaplotreeConfig} and builds the adapter graph.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates paths and URLs through {@code ca.gc.cra.haplotree.validation}.</p>
 */
package ca.gc.cra.haplotree.config;
