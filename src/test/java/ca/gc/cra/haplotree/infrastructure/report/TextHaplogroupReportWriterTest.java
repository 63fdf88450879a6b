package ca.gc.cra.haplotree.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.haplotree.domain.classify.HaplogroupResult;
import ca.gc.cra.haplotree.domain.classify.HaplogroupScorer;
import ca.gc.cra.haplotree.domain.classify.ObservedCalls;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import ca.gc.cra.haplotree.domain.tree.TreeType;
import ca.gc.cra.haplotree.testutil.TreeFixtures;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TextHaplogroupReportWriterTest {
  private static final Clock FIXED = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

  @TempDir Path tempDir;

  @Test
  void writesPredictionPathAndMarkerDetails() throws Exception {
    HaplogroupTree tree = TreeFixtures.chain();
    ObservedCalls calls = ObservedCalls.of(Map.of(1000L, "T", 2000L, "G"));
    List<HaplogroupResult> ranked = new HaplogroupScorer().classify(tree, calls);
    TextHaplogroupReportWriter writer = new TextHaplogroupReportWriter(tempDir.resolve("out"), 10, FIXED);

    Path file = writer.write(TreeType.Y_DNA, ranked, tree, calls, Optional.of("HG002"));

    assertEquals(tempDir.resolve("out").resolve("ydna_haplogroup_report.txt"), file);
    String report = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(report.contains("Y-DNA Haplogroup Analysis Report"));
    assertTrue(report.contains("Generated: 2026-01-02 03:04:05"));
    assertTrue(report.contains("Sample: HG002"));
    assertTrue(report.contains("  Predicted Haplogroup: A1a"));
    assertTrue(report.contains("  Score: 2.00"));
    assertTrue(report.contains("TOP 10 CANDIDATES"));
    assertTrue(report.contains("HAPLOGROUP PATH"));
    assertTrue(report.contains("A [+0 derived]"));
    assertTrue(report.contains("  A1 [+1 derived]"));
    assertTrue(report.contains("    A1a [+1 derived]"));
    assertTrue(report.contains("SNP DETAILS (along predicted path)"));
    assertTrue(report.contains("M1"));
    assertTrue(report.contains("Derived"));
    assertTrue(report.contains("  Total SNPs in tree: 2"));
    assertTrue(report.contains("  SNPs with calls: 2"));
    assertTrue(report.contains("  Haplogroups evaluated: 3"));
    assertTrue(report.contains("  SNPs on predicted path: 2"));
  }

  @Test
  void reportsUndeterminedWhenNoDerivedEvidence() throws Exception {
    HaplogroupTree tree = TreeFixtures.chain();
    ObservedCalls calls = ObservedCalls.of(Map.of(1000L, "C"));
    List<HaplogroupResult> ranked = new HaplogroupScorer().classify(tree, calls);
    TextHaplogroupReportWriter writer = new TextHaplogroupReportWriter(tempDir, 5, FIXED);

    Path file = writer.write(TreeType.MT_DNA, ranked, tree, calls, Optional.empty());

    assertEquals("mtdna_haplogroup_report.txt", file.getFileName().toString());
    String report = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(report.contains(TextHaplogroupReportWriter.NOT_DETERMINED));
    assertFalse(report.contains("Sample:"));
    assertFalse(report.contains("HAPLOGROUP PATH"));
    assertFalse(report.contains("SNPs on predicted path"));
    assertTrue(report.contains("  Haplogroups evaluated: 3"));
  }

  @Test
  void candidateListIsCappedAtTopN() throws Exception {
    HaplogroupTree tree = TreeFixtures.branching();
    ObservedCalls calls = ObservedCalls.of(Map.of(100L, "A", 200L, "T"));
    List<HaplogroupResult> ranked = new HaplogroupScorer().classify(tree, calls);
    TextHaplogroupReportWriter writer = new TextHaplogroupReportWriter(tempDir, 2, FIXED);

    String report = Files.readString(writer.write(TreeType.Y_DNA, ranked, tree, calls, Optional.empty()));

    assertTrue(report.contains("TOP 2 CANDIDATES"));
    assertTrue(report.contains("    1  "));
    assertTrue(report.contains("    2  "));
    assertFalse(report.contains("    3  "));
  }

  @Test
  void emptyRankingIsUndetermined() throws Exception {
    TextHaplogroupReportWriter writer = new TextHaplogroupReportWriter(tempDir, 3, FIXED);

    String report = Files.readString(writer.write(
        TreeType.Y_DNA, List.of(), TreeFixtures.chain(), ObservedCalls.empty(), Optional.empty()));

    assertTrue(report.contains(TextHaplogroupReportWriter.NOT_DETERMINED));
    assertTrue(report.contains("  Haplogroups evaluated: 0"));
  }

  @Test
  void rejectsNonPositiveTopN() {
    assertThrows(IllegalArgumentException.class, () -> new TextHaplogroupReportWriter(tempDir, 0, FIXED));
  }
}
