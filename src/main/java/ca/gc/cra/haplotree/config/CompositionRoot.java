package ca.gc.cra.haplotree.config;

import ca.gc.cra.haplotree.application.analysis.HaplogroupAnalysisUseCase;
import ca.gc.cra.haplotree.application.port.MetricsPort;
import ca.gc.cra.haplotree.application.port.TreeFormatParser;
import ca.gc.cra.haplotree.application.tree.TreeFormat;
import ca.gc.cra.haplotree.application.tree.TreeProvider;
import ca.gc.cra.haplotree.domain.classify.HaplogroupScorer;
import ca.gc.cra.haplotree.domain.classify.PathResolver;
import ca.gc.cra.haplotree.infrastructure.cache.FileSystemRawTreeStore;
import ca.gc.cra.haplotree.infrastructure.cache.InMemoryParsedTreeCache;
import ca.gc.cra.haplotree.infrastructure.calls.VcfCallsReader;
import ca.gc.cra.haplotree.infrastructure.fetch.HttpTreeSourceFetcher;
import ca.gc.cra.haplotree.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.haplotree.infrastructure.parse.DecodingUsTreeParser;
import ca.gc.cra.haplotree.infrastructure.parse.FtdnaTreeParser;
import ca.gc.cra.haplotree.infrastructure.report.TextHaplogroupReportWriter;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the classification use case to concrete adapters.
 * <p><strong>Role:</strong> Translates a {@link HaplotreeConfig} into a runnable graph: HTTP fetcher, disk and
 * memory caches, format parsers, tree provider, scorer and report writer.</p>
 * <p><strong>Thread-safety:</strong> Built once on the CLI thread; the exposed services are safe to share.</p>
 * <p><strong>Observability:</strong> Owns the OpenTelemetry metrics adapter and flushes it on {@link #close()}.</p>
 *
 * @since 0.1.0
 * @see HaplogroupAnalysisUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final HaplotreeConfig config;
  private final OpenTelemetryMetricsAdapter metrics;
  private final HttpTreeSourceFetcher fetcher;
  private final TreeProvider treeProvider;
  private final HaplogroupAnalysisUseCase useCase;
  private final VcfCallsReader callsReader;

  /**
   * Builds the adapter graph.
   *
   * @param config validated configuration
   */
  public CompositionRoot(HaplotreeConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = new OpenTelemetryMetricsAdapter(config.telemetry());
    this.fetcher = new HttpTreeSourceFetcher(config.connectTimeoutMillis(), config.readTimeoutMillis());

    Map<TreeFormat, TreeFormatParser> parsers = new EnumMap<>(TreeFormat.class);
    parsers.put(TreeFormat.FTDNA, new FtdnaTreeParser());
    parsers.put(TreeFormat.DECODINGUS, new DecodingUsTreeParser());

    this.treeProvider = new TreeProvider(
        TreeSources.withOverrides(config.sourceUrls()),
        parsers,
        new InMemoryParsedTreeCache(),
        new FileSystemRawTreeStore(config.cacheDirectory()),
        fetcher,
        metrics);
    this.useCase = new HaplogroupAnalysisUseCase(
        treeProvider,
        new HaplogroupScorer(config.weights()),
        new PathResolver(),
        new TextHaplogroupReportWriter(config.outputDirectory(), config.topN()),
        metrics,
        config.confidenceCap());
    this.callsReader = new VcfCallsReader();
    log.debug("Composition root ready: sources={}, cacheDir={}, metricsNoop={}",
        treeProvider.sourceIds(), config.cacheDirectory(), metrics.isNoop());
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return configuration
   */
  public HaplotreeConfig config() {
    return config;
  }

  /**
   * Returns the shared metrics sink.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the tree provider.
   *
   * @return tree provider
   */
  public TreeProvider treeProvider() {
    return treeProvider;
  }

  /**
   * Returns the classification use case.
   *
   * @return use case
   */
  public HaplogroupAnalysisUseCase analysisUseCase() {
    return useCase;
  }

  /**
   * Returns the VCF reader for observed calls.
   *
   * @return calls reader
   */
  public VcfCallsReader callsReader() {
    return callsReader;
  }

  /**
   * Closes the HTTP client and flushes metrics.
   *
   * @throws IOException if the HTTP client fails to close
   */
  @Override
  public void close() throws IOException {
    try {
      fetcher.close();
    } finally {
      metrics.close();
    }
  }
}
