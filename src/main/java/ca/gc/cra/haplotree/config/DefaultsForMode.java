package ca.gc.cra.haplotree.config;

import ca.gc.cra.haplotree.infrastructure.cache.FileSystemRawTreeStore;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each haplotree CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code classify})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unsupported mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "classify" -> buildClassifyDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("cacheDir", FileSystemRawTreeStore.defaultDirectory().toString());
    map.put("fetch.connectTimeoutMillis", "30000");
    map.put("fetch.readTimeoutMillis", "300000");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildClassifyDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("source", TreeSources.FTDNA_Y);
    map.put("build", "GRCh38");
    map.put("calls", "");
    map.put("out", "haplotree-report");
    map.put("sample", "");
    map.put("topN", "10");
    map.put("scoring.derivedWeight", "1.0");
    map.put("scoring.ancestralWeight", "1.0");
    map.put("confidenceCap", "1.0");
    return Map.copyOf(map);
  }
}
