/**
 * Streaming jackson-core parsers for the supported tree source formats.
 *
 * @since 0.1.0
 */
package ca.gc.cra.haplotree.infrastructure.parse;
