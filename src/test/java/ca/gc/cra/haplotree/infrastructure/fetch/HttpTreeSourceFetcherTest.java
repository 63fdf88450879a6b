package ca.gc.cra.haplotree.infrastructure.fetch;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.haplotree.application.port.FetchException;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpTreeSourceFetcherTest {
  private static final byte[] TREE = "{\"allNodes\":{}}".getBytes(StandardCharsets.UTF_8);

  private HttpServer server;
  private final AtomicInteger hits = new AtomicInteger();
  private final CountDownLatch release = new CountDownLatch(1);

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/tree", exchange -> {
      hits.incrementAndGet();
      exchange.sendResponseHeaders(200, TREE.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(TREE);
      }
    });
    server.createContext("/missing", exchange -> {
      hits.incrementAndGet();
      byte[] body = "not here".getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(404, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    server.createContext("/slow", exchange -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      exchange.sendResponseHeaders(200, TREE.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(TREE);
      }
    });
    server.start();
  }

  @AfterEach
  void stopServer() {
    release.countDown();
    server.stop(0);
  }

  @Test
  void successfulGetReturnsBody() throws Exception {
    try (HttpTreeSourceFetcher fetcher = new HttpTreeSourceFetcher(2_000, 2_000)) {
      assertArrayEquals(TREE, fetcher.fetch(url("/tree")));
    }
  }

  @Test
  void nonSuccessStatusIsFetchFailureWithoutRetry() throws Exception {
    try (HttpTreeSourceFetcher fetcher = new HttpTreeSourceFetcher(2_000, 2_000)) {
      URI url = url("/missing");

      FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(url));

      assertTrue(ex.getMessage().contains("404"));
      assertEquals(url, ex.url());
      assertEquals(1, hits.get());
    }
  }

  @Test
  void readTimeoutIsFetchFailure() throws Exception {
    try (HttpTreeSourceFetcher fetcher = new HttpTreeSourceFetcher(2_000, 200)) {
      FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(url("/slow")));

      assertNotNull(ex.getCause());
    }
  }

  @Test
  void unreachableHostIsFetchFailure() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    try (HttpTreeSourceFetcher fetcher = new HttpTreeSourceFetcher(500, 500)) {
      assertThrows(FetchException.class,
          () -> fetcher.fetch(URI.create("http://127.0.0.1:" + port + "/tree")));
    }
  }

  @Test
  void timeoutsMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new HttpTreeSourceFetcher(0, 1_000));
    assertThrows(IllegalArgumentException.class, () -> new HttpTreeSourceFetcher(1_000, -1));
  }

  private URI url(String path) {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
  }
}
