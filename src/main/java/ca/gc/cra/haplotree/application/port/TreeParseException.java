package ca.gc.cra.haplotree.application.port;

/**
 * Raised when a raw payload cannot be interpreted as a haplogroup tree.
 *
 * @since 0.1.0
 */
public final class TreeParseException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a parse failure.
   *
   * @param message diagnostic message
   */
  public TreeParseException(String message) {
    super(message);
  }

  /**
   * Creates a parse failure with a cause.
   *
   * @param message diagnostic message
   * @param cause underlying failure
   */
  public TreeParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
