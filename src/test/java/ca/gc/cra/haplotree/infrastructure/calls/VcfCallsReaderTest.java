package ca.gc.cra.haplotree.infrastructure.calls;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.haplotree.domain.classify.ObservedCalls;
import ca.gc.cra.haplotree.domain.tree.TreeType;
import ca.gc.cra.haplotree.testutil.TreeFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VcfCallsReaderTest {
  @TempDir Path tempDir;

  private final VcfCallsReader reader = new VcfCallsReader();
  private Path vcf;

  @BeforeEach
  void copyFixture() throws IOException {
    vcf = tempDir.resolve("sample.vcf");
    Files.writeString(vcf, TreeFixtures.resource("sample.vcf"), StandardCharsets.UTF_8);
  }

  @Test
  void keepsCalledYChromosomeRecords() throws Exception {
    ObservedCalls calls = reader.read(vcf, TreeType.Y_DNA);

    assertEquals(Map.of(
        2887824L, "T",
        15581983L, "G",
        20577481L, "G",
        22739367L, "C"), calls.asMap());
  }

  @Test
  void mitochondrialFilterSelectsChrM() throws Exception {
    assertEquals(Map.of(73L, "G"), reader.read(vcf, TreeType.MT_DNA).asMap());
  }

  @Test
  void withoutFilterKeepsEveryCalledRecord() throws Exception {
    assertEquals(5, reader.read(vcf).size());
  }

  @Test
  void missingFileIsIoError() {
    assertThrows(IOException.class, () -> reader.read(tempDir.resolve("absent.vcf"), TreeType.Y_DNA));
  }
}
