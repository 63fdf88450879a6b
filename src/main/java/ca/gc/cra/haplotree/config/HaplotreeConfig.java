package ca.gc.cra.haplotree.config;

import ca.gc.cra.haplotree.domain.classify.ScoringWeights;
import ca.gc.cra.haplotree.domain.tree.ReferenceBuilds;
import ca.gc.cra.haplotree.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.haplotree.validation.Numbers;
import ca.gc.cra.haplotree.validation.Paths;
import ca.gc.cra.haplotree.validation.Strings;
import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Typed, validated settings for the {@code classify} command.
 * <p><strong>Role:</strong> Built from the merged flat map ({@link ConfigMerger}) and handed to
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param source tree source id
 * @param build canonical reference build
 * @param calls VCF with the sample's calls
 * @param outputDirectory report directory
 * @param sampleName optional sample label
 * @param cacheDirectory raw tree payload cache directory
 * @param topN candidates listed in the report
 * @param weights scoring weights
 * @param confidenceCap upper bound of reported confidence
 * @param connectTimeoutMillis HTTP connect timeout
 * @param readTimeoutMillis HTTP read timeout
 * @param sourceUrls download URL overrides keyed by source id
 * @param telemetry metrics exporter settings
 * @since 0.1.0
 */
public record HaplotreeConfig(
    String source,
    String build,
    Path calls,
    Path outputDirectory,
    Optional<String> sampleName,
    Path cacheDirectory,
    int topN,
    ScoringWeights weights,
    double confidenceCap,
    int connectTimeoutMillis,
    int readTimeoutMillis,
    Map<String, URI> sourceUrls,
    TelemetrySettings telemetry) {
  private static final Pattern SOURCE_URL_KEY = Pattern.compile("^sources\\.([A-Za-z0-9._-]+)\\.url$");
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  /**
   * Validates the record.
   */
  public HaplotreeConfig {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(build, "build");
    Objects.requireNonNull(calls, "calls");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    sampleName = sampleName == null ? Optional.empty() : sampleName;
    Objects.requireNonNull(cacheDirectory, "cacheDirectory");
    Objects.requireNonNull(weights, "weights");
    sourceUrls = sourceUrls == null ? Map.of() : Map.copyOf(sourceUrls);
    telemetry = telemetry == null ? TelemetrySettings.disabled() : telemetry;
    if (topN <= 0) {
      throw new IllegalArgumentException("topN must be positive");
    }
    if (!(confidenceCap > 0.0 && confidenceCap <= 1.0)) {
      throw new IllegalArgumentException("confidenceCap must be in (0, 1]");
    }
  }

  /**
   * Creates a configuration from flat key/value settings.
   *
   * @param options merged settings such as {@code source}, {@code build}, {@code calls}, {@code out}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing, malformed or out of range
   */
  public static HaplotreeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> defaults = DefaultsForMode.asFlatMap("classify");

    String source = Strings.requireNonBlank("source", value(options, defaults, "source"));
    String build = ReferenceBuilds.canonical(Strings.requireNonBlank("build", value(options, defaults, "build")));
    Path calls = Paths.parse("calls", value(options, defaults, "calls"));
    Path out = Paths.parse("out", value(options, defaults, "out"));
    String sample = Strings.trimToEmpty(options.get("sample"));
    Path cacheDir = Paths.parse("cacheDir", value(options, defaults, "cacheDir"));
    int topN = Numbers.parseInt("topN", value(options, defaults, "topN"), 1, 10_000);
    ScoringWeights weights = new ScoringWeights(
        Numbers.parseDouble("scoring.derivedWeight", value(options, defaults, "scoring.derivedWeight"), 0, 1_000),
        Numbers.parseDouble("scoring.ancestralWeight", value(options, defaults, "scoring.ancestralWeight"), 0, 1_000));
    double confidenceCap = Numbers.parseDouble("confidenceCap", value(options, defaults, "confidenceCap"), 0.01, 1.0);
    int connectTimeout = Numbers.parseInt(
        "fetch.connectTimeoutMillis", value(options, defaults, "fetch.connectTimeoutMillis"), 1, 600_000);
    int readTimeout = Numbers.parseInt(
        "fetch.readTimeoutMillis", value(options, defaults, "fetch.readTimeoutMillis"), 1, 3_600_000);

    String attributes = Strings.trimToEmpty(options.get("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    TelemetrySettings telemetry = new TelemetrySettings(
        value(options, defaults, "metricsExporter"), options.get("otelEndpoint"), attributes);

    return new HaplotreeConfig(
        source,
        build,
        calls,
        out,
        sample.isEmpty() ? Optional.empty() : Optional.of(sample),
        cacheDir,
        topN,
        weights,
        confidenceCap,
        connectTimeout,
        readTimeout,
        sourceUrls(options),
        telemetry);
  }

  private static Map<String, URI> sourceUrls(Map<String, String> options) {
    Map<String, URI> urls = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      Matcher matcher = SOURCE_URL_KEY.matcher(entry.getKey());
      if (!matcher.matches() || entry.getValue() == null || entry.getValue().isBlank()) {
        continue;
      }
      String raw = entry.getValue().trim();
      URI uri;
      try {
        uri = URI.create(raw);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(entry.getKey() + " must be a valid URL (was '" + raw + "')", ex);
      }
      if (uri.getScheme() == null
          || !(uri.getScheme().equalsIgnoreCase("http") || uri.getScheme().equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(entry.getKey() + " must use http or https");
      }
      urls.put(matcher.group(1), uri);
    }
    return urls;
  }

  private static String value(Map<String, String> options, Map<String, String> defaults, String key) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? defaults.get(key) : raw;
  }
}
