/**
 * Readers producing observed call maps from variant files.
 *
 * @since 0.1.0
 */
package ca.gc.cra.haplotree.infrastructure.calls;
