package ca.gc.cra.haplotree.application.tree;

import java.net.URI;
import java.util.Objects;

/**
 * Failure outcome of {@link TreeProvider#loadTree(String, String)}.
 *
 * @param kind failure category
 * @param sourceId tree source identifier
 * @param url source URL
 * @param message diagnostic text
 * @param cause underlying exception, may be {@code null}
 * @since 0.1.0
 */
public record TreeLoadError(Kind kind, String sourceId, URI url, String message, Throwable cause) {

  /**
   * Validates required fields.
   */
  public TreeLoadError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(message, "message");
  }

  /**
   * Failure categories.
   */
  public enum Kind {
    /** The payload could not be downloaded; no cache tier was written. */
    FETCH_FAILURE,
    /** The payload was obtained but is not a valid tree; the raw payload stays cached. */
    PARSE_FAILURE
  }

  /**
   * Formats the error for logs and CLI output.
   *
   * @return one-line description
   */
  public String describe() {
    return kind + " for tree source " + sourceId + " (" + url + "): " + message;
  }
}
