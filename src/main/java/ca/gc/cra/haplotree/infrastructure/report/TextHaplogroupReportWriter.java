package ca.gc.cra.haplotree.infrastructure.report;

import ca.gc.cra.haplotree.application.port.HaplogroupReportPort;
import ca.gc.cra.haplotree.domain.classify.CallState;
import ca.gc.cra.haplotree.domain.classify.HaplogroupResult;
import ca.gc.cra.haplotree.domain.classify.ObservedCalls;
import ca.gc.cra.haplotree.domain.classify.PathResolver;
import ca.gc.cra.haplotree.domain.classify.PathStep;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import ca.gc.cra.haplotree.domain.tree.Locus;
import ca.gc.cra.haplotree.domain.tree.TreeType;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Renders a plain-text haplogroup report.
 * <p>Sections: prediction, top-N candidates, path to the prediction with newly derived marker counts per step,
 * per-marker details along the path, and summary statistics. Numbers use {@link Locale#ROOT}.</p>
 * <p><strong>Output:</strong> {@code ydna_haplogroup_report.txt} or {@code mtdna_haplogroup_report.txt} inside
 * the configured directory, replaced on each run.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent writes for the same tree type race on the file.</p>
 *
 * @since 0.1.0
 */
public final class TextHaplogroupReportWriter implements HaplogroupReportPort {
  static final String NOT_DETERMINED = "No haplogroup could be determined.";

  private static final int WIDTH = 80;
  private static final String HEAVY_RULE = "=".repeat(WIDTH);
  private static final String LIGHT_RULE = "-".repeat(WIDTH);
  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

  private final Path outputDirectory;
  private final int topN;
  private final Clock clock;
  private final PathResolver pathResolver = new PathResolver();

  /**
   * Creates a writer using the system clock.
   *
   * @param outputDirectory directory receiving the report
   * @param topN number of ranked candidates to list; must be positive
   */
  public TextHaplogroupReportWriter(Path outputDirectory, int topN) {
    this(outputDirectory, topN, Clock.systemDefaultZone());
  }

  /**
   * Creates a writer with an explicit clock for the generation timestamp.
   *
   * @param outputDirectory directory receiving the report
   * @param topN number of ranked candidates to list; must be positive
   * @param clock timestamp source
   */
  public TextHaplogroupReportWriter(Path outputDirectory, int topN, Clock clock) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    if (topN <= 0) {
      throw new IllegalArgumentException("topN must be positive");
    }
    this.topN = topN;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Path write(
      TreeType treeType,
      List<HaplogroupResult> ranked,
      HaplogroupTree tree,
      ObservedCalls calls,
      Optional<String> sampleName) throws IOException {
    Objects.requireNonNull(treeType, "treeType");
    Objects.requireNonNull(ranked, "ranked");
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(calls, "calls");
    Files.createDirectories(outputDirectory);
    Path file = outputDirectory.resolve(treeType.filePrefix() + "_haplogroup_report.txt");
    try (BufferedWriter buffered = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
         PrintWriter out = new PrintWriter(buffered)) {
      render(out, treeType, ranked, tree, calls, sampleName == null ? Optional.empty() : sampleName);
      out.flush();
      if (out.checkError()) {
        throw new IOException("failed writing report " + file);
      }
    }
    return file;
  }

  private void render(
      PrintWriter out,
      TreeType treeType,
      List<HaplogroupResult> ranked,
      HaplogroupTree tree,
      ObservedCalls calls,
      Optional<String> sampleName) {
    out.println(HEAVY_RULE);
    out.println("  " + treeType.displayName() + " Haplogroup Analysis Report");
    out.println(HEAVY_RULE);
    out.println();
    out.println("Generated: " + LocalDateTime.now(clock).format(TIMESTAMP));
    sampleName.ifPresent(name -> out.println("Sample: " + name));
    out.println();

    Optional<HaplogroupResult> top = ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    boolean determined = top.map(r -> r.matchingSnps() > 0).orElse(false);
    List<PathStep> path = determined ? pathResolver.resolvePath(tree, top.get().name()) : List.of();

    section(out, "HAPLOGROUP PREDICTION");
    if (determined) {
      HaplogroupResult result = top.get();
      out.println("  Predicted Haplogroup: " + result.name());
      out.println(String.format(Locale.ROOT, "  Score: %.2f", result.score()));
      out.println("  Derived SNPs: " + result.matchingSnps());
      out.println("  Ancestral SNPs: " + result.ancestralMatches());
      out.println("  No Calls: " + result.noCalls());
      out.println("  Tree Depth: " + result.depth());
    } else {
      out.println("  " + NOT_DETERMINED);
    }
    out.println();

    section(out, "TOP " + topN + " CANDIDATES");
    out.println(String.format(Locale.ROOT, "%5s  %-25s  %8s  %8s  %10s  %6s",
        "Rank", "Haplogroup", "Score", "Derived", "Ancestral", "Depth"));
    out.println(LIGHT_RULE);
    int limit = Math.min(topN, ranked.size());
    for (int i = 0; i < limit; i++) {
      HaplogroupResult r = ranked.get(i);
      out.println(String.format(Locale.ROOT, "%5d  %-25s  %8.1f  %8d  %10d  %6d",
          i + 1, r.name(), r.score(), r.matchingSnps(), r.ancestralMatches(), r.depth()));
    }
    out.println();

    if (determined) {
      renderPath(out, path, ranked);
      renderMarkers(out, path, calls);
    }

    section(out, "SUMMARY STATISTICS");
    out.println("  Total SNPs in tree: " + tree.distinctLoci().size());
    out.println("  SNPs with calls: " + calls.size());
    out.println("  Haplogroups evaluated: " + ranked.size());
    if (determined) {
      out.println("  SNPs on predicted path: " + lociOnPath(path).size());
    }
    out.println();
    out.println(HEAVY_RULE);
  }

  private void renderPath(PrintWriter out, List<PathStep> path, List<HaplogroupResult> ranked) {
    Map<String, HaplogroupResult> byName = new HashMap<>(ranked.size() * 2);
    for (HaplogroupResult result : ranked) {
      byName.put(result.name(), result);
    }
    section(out, "HAPLOGROUP PATH");
    int previousDerived = 0;
    for (PathStep step : path) {
      HaplogroupResult result = byName.get(step.name());
      StringBuilder line = new StringBuilder("  ".repeat(step.depth())).append(step.name());
      if (result != null) {
        line.append(" [+").append(result.matchingSnps() - previousDerived).append(" derived]");
        previousDerived = result.matchingSnps();
      }
      out.println(line);
    }
    out.println();
  }

  private void renderMarkers(PrintWriter out, List<PathStep> path, ObservedCalls calls) {
    section(out, "SNP DETAILS (along predicted path)");
    out.println(String.format(Locale.ROOT, "%12s  %-20s  %10s  %10s  %10s  %10s",
        "Position", "SNP Name", "Ancestral", "Derived", "Called", "State"));
    out.println(LIGHT_RULE);
    List<Locus> loci = lociOnPath(path);
    loci.sort(Comparator.comparingLong(Locus::position));
    for (Locus locus : loci) {
      String called = calls.at(locus.position()).orElse("-");
      out.println(String.format(Locale.ROOT, "%12d  %-20s  %10s  %10s  %10s  %10s",
          locus.position(), locus.name(), locus.ref(), locus.alt(), called, CallState.of(locus, calls).label()));
    }
    out.println();
  }

  private static List<Locus> lociOnPath(List<PathStep> path) {
    List<Locus> loci = new ArrayList<>();
    for (PathStep step : path) {
      loci.addAll(step.node().loci());
    }
    return loci;
  }

  private static void section(PrintWriter out, String title) {
    out.println(LIGHT_RULE);
    out.println(title);
    out.println(LIGHT_RULE);
  }
}
