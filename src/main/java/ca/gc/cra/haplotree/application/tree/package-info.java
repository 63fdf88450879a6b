/**
 * Tree source configuration and the tiered tree provider: parsed-tree cache, durable payload store, then
 * network fetch, followed by parsing and coordinate reconciliation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.haplotree.application.tree;
