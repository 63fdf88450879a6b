package ca.gc.cra.haplotree.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.haplotree.domain.classify.ScoringWeights;
import ca.gc.cra.haplotree.infrastructure.cache.FileSystemRawTreeStore;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void classifyDefaultsMirrorTypedDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("Classify");

    assertEquals(TreeSources.FTDNA_Y, defaults.get("source"));
    assertEquals("GRCh38", defaults.get("build"));
    assertEquals("10", defaults.get("topN"));
    assertEquals(Double.toString(ScoringWeights.DEFAULT.derivedWeight()), defaults.get("scoring.derivedWeight"));
    assertEquals(Double.toString(ScoringWeights.DEFAULT.ancestralWeight()),
        defaults.get("scoring.ancestralWeight"));
    assertEquals(FileSystemRawTreeStore.defaultDirectory().toString(), defaults.get("cacheDir"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertTrue(defaults.get("calls").isEmpty());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
