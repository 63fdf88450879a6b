/**
 * Report rendering adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.haplotree.infrastructure.report;
