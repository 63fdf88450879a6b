package ca.gc.cra.haplotree.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads haplotree settings from a YAML document with a {@code common} section and one section per CLI mode.
 * <p>Nested mappings flatten to dotted keys, so
 * <pre>{@code
 * classify:
 *   scoring:
 *     derivedWeight: 1.5
 *   sources:
 *     ftdna-ytree:
 *       url: https://mirror.example/ytree.json
 * }</pre>
 * yields {@code scoring.derivedWeight} and {@code sources.ftdna-ytree.url}. Mode keys override common keys.</p>
 */
public final class YamlConfigLoader {
  private static final int MAX_ALIASES = 50;

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges the {@code common} section with the {@code mode} section.
   *
   * @param path YAML file
   * @param mode CLI mode, matched case-insensitively
   * @return flattened settings, empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or uses unsupported structures
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    section(root, "common").ifPresent(common -> flatten(common, "", flattened));
    section(root, mode.trim().toLowerCase(Locale.ROOT)).ifPresent(modeSection -> flatten(modeSection, "", flattened));
    return Optional.of(Map.copyOf(flattened));
  }

  private static Yaml newYaml() {
    LoaderOptions options = new LoaderOptions();
    options.setMaxAliasesForCollections(MAX_ALIASES);
    options.setAllowDuplicateKeys(false);
    return new Yaml(new SafeConstructor(options));
  }

  private static Optional<Map<String, Object>> section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue() == null ? Optional.empty() : Optional.of(asMap(entry.getValue(), name));
      }
    }
    return Optional.empty();
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key.trim(), entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, key), key, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + key);
      } else {
        target.put(key, value == null ? "" : value.toString());
      }
    }
  }
}
