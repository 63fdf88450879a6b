package ca.gc.cra.haplotree.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Durable cache of downloaded tree payloads keyed by source id.
 * <p><strong>Contract:</strong> {@link #get(String)} after {@link #put(String, byte[])} with the same key returns
 * the same bytes, including after a process restart. A concurrent reader never observes a partially written
 * payload. No eviction or expiry.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface RawTreeStore {
  /**
   * Reads the payload stored under {@code key}.
   *
   * @param key source identifier
   * @return stored bytes, empty when absent
   * @throws IOException when the store exists but cannot be read
   */
  Optional<byte[]> get(String key) throws IOException;

  /**
   * Stores {@code payload} under {@code key}, replacing any previous value.
   *
   * @param key source identifier
   * @param payload raw bytes
   * @throws IOException when the payload cannot be persisted
   */
  void put(String key, byte[] payload) throws IOException;
}
