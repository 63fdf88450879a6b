package ca.gc.cra.haplotree.infrastructure.cache;

import ca.gc.cra.haplotree.application.port.RawTreeStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.zip.CRC32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Durable {@link RawTreeStore} keeping one file per tree source under a cache directory.
 * <p><strong>Why:</strong> Tree payloads are large and slow to download; keeping the bytes as downloaded lets a
 * restarted process skip the network entirely.</p>
 * <p><strong>Role:</strong> Infrastructure adapter behind the provider's disk tier.</p>
 * <p><strong>Thread-safety:</strong> Writers stage into a unique temporary file in the cache directory and
 * publish it with an atomic move, so readers see either the previous payload or the complete new one.</p>
 * <p><strong>Observability:</strong> Logs writes at DEBUG; failures propagate as {@link IOException}.</p>
 *
 * @implNote Falls back to a plain replacing move on file systems without atomic move support.
 * @since 0.1.0
 */
public final class FileSystemRawTreeStore implements RawTreeStore {
  private static final Logger log = LoggerFactory.getLogger(FileSystemRawTreeStore.class);
  private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");
  private static final String SUFFIX = ".tree";

  private final Path directory;

  /**
   * Creates a store rooted at {@code directory}. The directory is created lazily on the first write.
   *
   * @param directory cache directory
   */
  public FileSystemRawTreeStore(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
  }

  /**
   * Returns the default cache directory {@code ~/.cache/haplotree/trees}.
   *
   * @return default location
   */
  public static Path defaultDirectory() {
    return Path.of(System.getProperty("user.home"), ".cache", "haplotree", "trees");
  }

  public Path directory() {
    return directory;
  }

  @Override
  public Optional<byte[]> get(String key) throws IOException {
    Path file = fileFor(key);
    try {
      return Optional.of(Files.readAllBytes(file));
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    }
  }

  @Override
  public void put(String key, byte[] payload) throws IOException {
    Objects.requireNonNull(payload, "payload");
    Path target = fileFor(key);
    Files.createDirectories(directory);
    Path staging = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
    try {
      Files.write(staging, payload);
      try {
        Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported in {}; using replacing move", directory);
        Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Cached {} bytes for tree source {} at {}", payload.length, key, target);
    } finally {
      Files.deleteIfExists(staging);
    }
  }

  /**
   * Maps a key to its file. Keys made only of {@code [A-Za-z0-9._-]} and not starting with {@code .} are used
   * as is. Any other key has the offending characters replaced by {@code _} and gains a {@code ~} plus a
   * checksum of the original key, so distinct keys never share a file.
   *
   * @param key tree source cache key
   * @return file inside the cache directory
   * @throws IllegalArgumentException if the key is blank
   */
  Path fileFor(String key) {
    Objects.requireNonNull(key, "key");
    if (key.isBlank()) {
      throw new IllegalArgumentException("cache key must not be blank");
    }
    String safe = UNSAFE.matcher(key).replaceAll("_");
    if (safe.startsWith(".")) {
      safe = "_" + safe.substring(1);
    }
    if (!safe.equals(key)) {
      CRC32 crc = new CRC32();
      crc.update(key.getBytes(StandardCharsets.UTF_8));
      safe = safe + "~" + String.format(Locale.ROOT, "%08x", crc.getValue());
    }
    return directory.resolve(safe + SUFFIX);
  }
}
