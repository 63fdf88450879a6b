package ca.gc.cra.haplotree.testutil;

import ca.gc.cra.haplotree.application.port.RawTreeStore;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed raw payload store with switchable read/write failures.
 */
public final class InMemoryRawTreeStore implements RawTreeStore {
  private final Map<String, byte[]> payloads = new ConcurrentHashMap<>();
  private volatile boolean failReads;
  private volatile boolean failWrites;

  @Override
  public Optional<byte[]> get(String key) throws IOException {
    if (failReads) {
      throw new IOException("simulated read failure for " + key);
    }
    byte[] payload = payloads.get(key);
    return payload == null ? Optional.empty() : Optional.of(payload.clone());
  }

  @Override
  public void put(String key, byte[] payload) throws IOException {
    if (failWrites) {
      throw new IOException("simulated write failure for " + key);
    }
    payloads.put(key, payload.clone());
  }

  public boolean contains(String key) {
    return payloads.containsKey(key);
  }

  public void failReads(boolean fail) {
    this.failReads = fail;
  }

  public void failWrites(boolean fail) {
    this.failWrites = fail;
  }
}
