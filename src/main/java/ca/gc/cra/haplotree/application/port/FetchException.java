package ca.gc.cra.haplotree.application.port;

import java.net.URI;
import java.util.Objects;

/**
 * Raised when a tree payload could not be downloaded.
 *
 * @since 0.1.0
 */
public final class FetchException extends Exception {
  private static final long serialVersionUID = 1L;

  private final URI url;

  /**
   * Creates an exception for a failed download.
   *
   * @param url source URL
   * @param message diagnostic message
   * @param cause underlying failure, may be {@code null}
   */
  public FetchException(URI url, String message, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates an exception for a failed download without an underlying cause.
   *
   * @param url source URL
   * @param message diagnostic message
   */
  public FetchException(URI url, String message) {
    this(url, message, null);
  }

  /**
   * Returns the URL that failed.
   *
   * @return source URL
   */
  public URI url() {
    return url;
  }
}
