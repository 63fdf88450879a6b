package ca.gc.cra.haplotree.api;

/**
 * <strong>What:</strong> Exit codes shared by HAPLOTREE commands.
 * <p><strong>Why:</strong> Scripts can tell bad input apart from download, configuration and internal
 * failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** I/O failure: unreadable calls, unwritable report, or a tree download that failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, including a tree payload that could not be parsed. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
