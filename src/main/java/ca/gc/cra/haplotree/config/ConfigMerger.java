package ca.gc.cra.haplotree.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for {@code mode}.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides, may be empty
   * @param defaults embedded defaults for the mode
   * @param warn receives a message whenever a CLI key overrides a YAML key
   * @return immutable merged configuration
   * @throws IllegalArgumentException when a required key is missing or blank
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("classify".equalsIgnoreCase(mode)) {
      for (String required : new String[] {"source", "build", "calls", "out"}) {
        String value = effective.get(required);
        if (value == null || value.isBlank()) {
          throw new IllegalArgumentException(required + " is required for " + mode);
        }
      }
    }
  }
}
