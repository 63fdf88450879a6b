package ca.gc.cra.haplotree.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for the report and cache directories.
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a user-supplied path, rejecting control characters.
   *
   * @param name setting key for diagnostics
   * @param raw textual path
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the text is blank or contains control characters
   */
  public static Path parse(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    if (text.startsWith("~/") || text.equals("~")) {
      text = System.getProperty("user.home") + text.substring(1);
    }
    try {
      return Path.of(text).toAbsolutePath().normalize();
    } catch (RuntimeException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + text, ex);
    }
  }

  /**
   * Ensures {@code path} is a readable regular file.
   *
   * @param name setting key for diagnostics
   * @param path candidate file
   * @return the path
   * @throws IllegalArgumentException if the file is missing or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new IllegalArgumentException(name + " is not a readable file: " + path);
    }
    return path;
  }

  /**
   * Ensures {@code path} is a writable directory, creating it and its parents when missing.
   *
   * @param name setting key for diagnostics
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException if the path is not a directory, is not writable or cannot be created
   */
  public static Path ensureWritableDir(String name, Path path) {
    try {
      Files.createDirectories(path);
      Path real = path.toRealPath();
      if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException(name + " is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException(name + " is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to prepare " + name + " directory " + path + ": " + ex.getMessage(), ex);
    }
  }
}
