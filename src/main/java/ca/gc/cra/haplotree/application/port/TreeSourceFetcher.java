package ca.gc.cra.haplotree.application.port;

import java.net.URI;

/**
 * <strong>What:</strong> Port downloading a raw tree payload.
 * <p>One GET per call and no retries; callers decide whether to try again.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent calls.</p>
 *
 * @since 0.1.0
 */
public interface TreeSourceFetcher {
  /**
   * Downloads the payload at {@code url}.
   *
   * @param url source URL
   * @return response body
   * @throws FetchException when the request fails, times out or returns a non-success status
   */
  byte[] fetch(URI url) throws FetchException;
}
