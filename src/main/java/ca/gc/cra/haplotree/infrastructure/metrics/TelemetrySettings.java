package ca.gc.cra.haplotree.infrastructure.metrics;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Metrics exporter settings resolved from configuration.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint, used when the exporter is {@code otlp}
 * @param resourceAttributes comma-separated {@code key=value} resource attributes, may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /**
   * Normalizes and validates the settings.
   *
   * @throws IllegalArgumentException for an unknown exporter or malformed endpoint
   */
  public TelemetrySettings {
    String normalized = exporter == null || exporter.isBlank() ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    exporter = normalized;
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    validateEndpoint(endpoint);
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings with metrics export disabled.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", null, null);
  }

  /**
   * Indicates whether metrics export is turned off.
   *
   * @return {@code true} for exporter {@code none}
   */
  public boolean isDisabled() {
    return "none".equals(exporter);
  }

  private static void validateEndpoint(String raw) {
    Objects.requireNonNull(raw, "endpoint");
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
