/**
 * Sample classification use case combining tree loading, scoring, path resolution and reporting.
 *
 * @since 0.1.0
 */
package ca.gc.cra.haplotree.application.analysis;
