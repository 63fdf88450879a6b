package ca.gc.cra.haplotree.application.analysis;

import ca.gc.cra.haplotree.application.port.HaplogroupReportPort;
import ca.gc.cra.haplotree.application.port.MetricsPort;
import ca.gc.cra.haplotree.application.tree.TreeLoadException;
import ca.gc.cra.haplotree.application.tree.TreeProvider;
import ca.gc.cra.haplotree.application.tree.TreeSource;
import ca.gc.cra.haplotree.domain.classify.ConfidenceCalculator;
import ca.gc.cra.haplotree.domain.classify.HaplogroupResult;
import ca.gc.cra.haplotree.domain.classify.HaplogroupScorer;
import ca.gc.cra.haplotree.domain.classify.ObservedCalls;
import ca.gc.cra.haplotree.domain.classify.PathResolver;
import ca.gc.cra.haplotree.domain.classify.PathStep;
import ca.gc.cra.haplotree.domain.tree.HaplogroupTree;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Classifies a sample: load tree, score every node, resolve the path to the best
 * candidate and optionally render a report.
 * <p><strong>Role:</strong> Application use case invoked by the {@code classify} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Obtain the tree through {@link TreeProvider}.</li>
 *   <li>Rank candidates with {@link HaplogroupScorer} and attach {@link ConfidenceCalculator} output.</li>
 *   <li>Hand results to the {@link HaplogroupReportPort}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Emits {@code classify.latencyNanos} and {@code classify.candidates}.</p>
 *
 * @since 0.1.0
 */
public final class HaplogroupAnalysisUseCase {
  private static final Logger log = LoggerFactory.getLogger(HaplogroupAnalysisUseCase.class);

  private final TreeProvider treeProvider;
  private final HaplogroupScorer scorer;
  private final PathResolver pathResolver;
  private final HaplogroupReportPort reportWriter;
  private final MetricsPort metrics;
  private final double confidenceCap;

  /**
   * Creates the use case.
   *
   * @param treeProvider tree provider; must not be {@code null}
   * @param scorer scorer configured with the desired weights; must not be {@code null}
   * @param pathResolver path resolver; must not be {@code null}
   * @param reportWriter report sink; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param confidenceCap upper bound of the reported confidence, in {@code (0, 1]}
   * @throws IllegalArgumentException if the cap is outside {@code (0, 1]}
   */
  public HaplogroupAnalysisUseCase(
      TreeProvider treeProvider,
      HaplogroupScorer scorer,
      PathResolver pathResolver,
      HaplogroupReportPort reportWriter,
      MetricsPort metrics,
      double confidenceCap) {
    this.treeProvider = Objects.requireNonNull(treeProvider, "treeProvider");
    this.scorer = Objects.requireNonNull(scorer, "scorer");
    this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
    this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (!(confidenceCap > 0.0 && confidenceCap <= 1.0)) {
      throw new IllegalArgumentException("confidenceCap must be in (0, 1]");
    }
    this.confidenceCap = confidenceCap;
  }

  /**
   * Classifies {@code calls} against the tree of {@code sourceId} in {@code build} coordinates.
   *
   * @param sourceId configured tree source id
   * @param build reference build, accession or alias
   * @param calls observed calls in {@code build} coordinates
   * @return ranked candidates, path and confidence
   * @throws TreeLoadException when the tree cannot be fetched or parsed
   * @throws IllegalArgumentException if the source id is unknown
   */
  public HaplogroupAnalysis analyze(String sourceId, String build, ObservedCalls calls) throws TreeLoadException {
    Objects.requireNonNull(calls, "calls");
    HaplogroupTree tree = treeProvider.loadTree(sourceId, build).orElseThrow();
    TreeSource source = treeProvider.source(sourceId).orElseThrow();

    long start = System.nanoTime();
    List<HaplogroupResult> ranked = scorer.classify(tree, calls);
    List<PathStep> path = List.of();
    double confidence = 0.0;
    if (!ranked.isEmpty()) {
      HaplogroupResult top = ranked.get(0);
      path = pathResolver.resolvePath(tree, top.name());
      confidence = ConfidenceCalculator.calculate(top, ranked, confidenceCap);
    }
    metrics.observe("classify.latencyNanos", System.nanoTime() - start);
    metrics.observe("classify.candidates", ranked.size());

    HaplogroupAnalysis analysis = new HaplogroupAnalysis(source, tree, calls, ranked, path, confidence);
    if (analysis.determined()) {
      HaplogroupResult top = analysis.top().orElseThrow();
      log.info("Predicted {} haplogroup {} (score {}, {} derived, {} ancestral) from {} calls",
          source.type().displayName(), top.name(), top.score(), top.matchingSnps(), top.ancestralMatches(),
          calls.size());
    } else {
      log.info("No {} haplogroup could be determined from {} calls", source.type().displayName(), calls.size());
    }
    return analysis;
  }

  /**
   * Renders the report for a completed analysis.
   *
   * @param analysis classification outcome
   * @param sampleName optional sample label
   * @return path of the written report
   * @throws IOException when the report cannot be written
   */
  public Path report(HaplogroupAnalysis analysis, Optional<String> sampleName) throws IOException {
    Objects.requireNonNull(analysis, "analysis");
    Path written = reportWriter.write(
        analysis.source().type(), analysis.ranked(), analysis.tree(), analysis.calls(),
        sampleName == null ? Optional.empty() : sampleName);
    log.info("Wrote haplogroup report to {}", written);
    return written;
  }
}
