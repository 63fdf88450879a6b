/**
 * Cache tier adapters: in-memory parsed trees and on-disk raw payloads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.haplotree.infrastructure.cache;
