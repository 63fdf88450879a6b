package ca.gc.cra.haplotree.infrastructure.fetch;

import ca.gc.cra.haplotree.application.port.FetchException;
import ca.gc.cra.haplotree.application.port.TreeSourceFetcher;
import ca.gc.cra.haplotree.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TreeSourceFetcher} issuing one HTTP GET through Apache HttpClient.
 * <p><strong>Why:</strong> Tree downloads need bounded connect/read timeouts and must surface every failure
 * (transport error, timeout, non-2xx status) as a {@link FetchException}.</p>
 * <p><strong>Thread-safety:</strong> The pooled client is thread-safe; one instance may serve concurrent
 * fetches.</p>
 * <p><strong>Observability:</strong> Logs status and size at DEBUG, plus a truncated error body for non-2xx
 * responses.</p>
 *
 * @implNote Automatic retries are disabled; a failed request is reported to the caller immediately.
 * @since 0.1.0
 */
public final class HttpTreeSourceFetcher implements TreeSourceFetcher, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HttpTreeSourceFetcher.class);
  private static final int MAX_LOGGED_BODY_BYTES = 512;

  private final CloseableHttpClient client;
  private final RequestConfig requestConfig;

  /**
   * Creates a fetcher with the given timeouts.
   *
   * @param connectTimeoutMillis TCP connect timeout in milliseconds; must be positive
   * @param readTimeoutMillis socket read timeout in milliseconds; must be positive
   * @throws IllegalArgumentException if a timeout is not positive
   */
  public HttpTreeSourceFetcher(int connectTimeoutMillis, int readTimeoutMillis) {
    if (connectTimeoutMillis <= 0 || readTimeoutMillis <= 0) {
      throw new IllegalArgumentException("fetch timeouts must be positive");
    }
    this.requestConfig = RequestConfig.custom()
        .setConnectionRequestTimeout(connectTimeoutMillis)
        .setConnectTimeout(connectTimeoutMillis)
        .setSocketTimeout(readTimeoutMillis)
        .build();
    this.client = HttpClients.custom()
        .setDefaultRequestConfig(requestConfig)
        .disableAutomaticRetries()
        .setUserAgent("haplotree")
        .build();
  }

  @Override
  public byte[] fetch(URI url) throws FetchException {
    Objects.requireNonNull(url, "url");
    HttpGet get = new HttpGet(url);
    get.setConfig(requestConfig);
    try (CloseableHttpResponse response = client.execute(get)) {
      StatusLine status = response.getStatusLine();
      HttpEntity entity = response.getEntity();
      if (status.getStatusCode() < 200 || status.getStatusCode() >= 300) {
        String detail = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
        log.debug("GET {} returned {}: {}",
            url, status.getStatusCode(), Logs.truncate(detail, MAX_LOGGED_BODY_BYTES));
        throw new FetchException(url, "HTTP " + status.getStatusCode() + " " + status.getReasonPhrase());
      }
      byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
      log.debug("GET {} returned {} ({} bytes)", url, status.getStatusCode(), body.length);
      return body;
    } catch (IOException ex) {
      throw new FetchException(url, ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() throws IOException {
    client.close();
  }
}
