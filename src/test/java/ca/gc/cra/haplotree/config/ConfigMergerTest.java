package ca.gc.cra.haplotree.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "classify",
        Optional.of(Map.of("topN", "5", "calls", "yaml.vcf")),
        Map.of("calls", "cli.vcf"),
        DefaultsForMode.asFlatMap("classify"),
        warnings::add);

    assertEquals("cli.vcf", effective.get("calls"));
    assertEquals("5", effective.get("topN"));
    assertEquals("ftdna-ytree", effective.get("source"));
    assertEquals(List.of("CLI overrides YAML for key: calls"), warnings);
  }

  @Test
  void missingCallsIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "classify", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("classify"), null));

    assertTrue(ex.getMessage().contains("calls is required"));
  }

  @Test
  void noWarningWithoutYamlConflict() {
    List<String> warnings = new ArrayList<>();
    ConfigMerger.buildEffectiveConfig(
        "classify", Optional.empty(), Map.of("calls", "a.vcf"), DefaultsForMode.asFlatMap("classify"), warnings::add);

    assertTrue(warnings.isEmpty());
  }
}
