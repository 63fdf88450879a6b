/**
 * Network fetch adapter for tree payloads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.haplotree.infrastructure.fetch;
