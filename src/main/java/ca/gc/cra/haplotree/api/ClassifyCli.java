package ca.gc.cra.haplotree.api;

import ca.gc.cra.haplotree.application.analysis.HaplogroupAnalysis;
import ca.gc.cra.haplotree.application.analysis.HaplogroupAnalysisUseCase;
import ca.gc.cra.haplotree.application.tree.TreeLoadError;
import ca.gc.cra.haplotree.application.tree.TreeLoadException;
import ca.gc.cra.haplotree.application.tree.TreeSource;
import ca.gc.cra.haplotree.config.CompositionRoot;
import ca.gc.cra.haplotree.config.ConfigMerger;
import ca.gc.cra.haplotree.config.DefaultsForMode;
import ca.gc.cra.haplotree.config.HaplotreeConfig;
import ca.gc.cra.haplotree.config.YamlConfigLoader;
import ca.gc.cra.haplotree.domain.classify.HaplogroupResult;
import ca.gc.cra.haplotree.domain.classify.ObservedCalls;
import ca.gc.cra.haplotree.logging.LoggingConfigurator;
import ca.gc.cra.haplotree.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for classifying one sample against a haplogroup tree.
 *
 * @since 0.1.0
 */
public final class ClassifyCli {
  private static final Logger log = LoggerFactory.getLogger(ClassifyCli.class);
  private static final String MODE = "classify";
  private static final String SUMMARY_USAGE =
      "usage: classify source=ID build=BUILD calls=VCF out=DIR [sample=NAME] [config=FILE] "
          + "[topN=N] [cacheDir=DIR] [metricsExporter=otlp|none] [--verbose]";
  private static final String HELP_TEXT = """
      HAPLOTREE classify

      Usage:
        classify source=ftdna-ytree build=GRCh38 calls=sample.vcf out=./report [options]

      Required:
        source=ID                  Tree source (ftdna-ytree, ftdna-mttree, decodingus-ytree)
        build=BUILD                Reference build of the calls (GRCh38, GRCh37, T2T-CHM13v2.0, rCRS)
        calls=PATH                 Single-sample VCF with the observed calls
        out=DIR                    Report directory, created when missing

      Optional:
        sample=NAME                Sample label printed in the report
        config=FILE                YAML file with 'common' and 'classify' sections
        cacheDir=DIR               Raw tree cache directory (default ~/.cache/haplotree/trees)
        topN=N                     Candidates listed in the report (default 10)
        scoring.derivedWeight=W    Reward per derived marker (default 1.0)
        scoring.ancestralWeight=W  Penalty per ancestral marker (default 1.0)
        confidenceCap=C            Upper bound of the reported confidence, in (0, 1] (default 1.0)
        fetch.connectTimeoutMillis=MS  HTTP connect timeout (default 30000)
        fetch.readTimeoutMillis=MS     HTTP read timeout (default 300000)
        sources.ID.url=URL         Download URL override for a built-in source
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ClassifyCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs a classification and maps the outcome to an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for classify CLI");
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown flags: {}", input.unknownFlags());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = removeConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    HaplotreeConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      config = HaplotreeConfig.fromMap(effective);
      Paths.requireReadableFile("calls", config.calls());
      Paths.ensureWritableDir("out", config.outputDirectory());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid classify arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      return classify(root);
    } catch (TreeLoadException ex) {
      TreeLoadError error = ex.error();
      log.error("Unable to load tree: {}", error.describe(), error.cause());
      return error.kind() == TreeLoadError.Kind.FETCH_FAILURE ? ExitCode.IO_ERROR : ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Classify configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Classify I/O failure for calls {}", config.calls(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in classify", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode classify(CompositionRoot root) throws IOException, TreeLoadException {
    HaplotreeConfig config = root.config();
    TreeSource source = root.treeProvider().source(config.source())
        .orElseThrow(() -> new IllegalArgumentException(
            "unknown tree source '" + config.source() + "'; known sources: " + root.treeProvider().sourceIds()));
    log.info("Classifying {} against {} ({}), build {}",
        config.calls(), source.id(), source.type().displayName(), config.build());

    ObservedCalls calls = root.callsReader().read(config.calls(), source.type());
    HaplogroupAnalysisUseCase useCase = root.analysisUseCase();
    HaplogroupAnalysis analysis = useCase.analyze(source.id(), config.build(), calls);
    Path report = useCase.report(analysis, config.sampleName());

    if (analysis.determined()) {
      HaplogroupResult top = analysis.top().orElseThrow();
      CliPrinter.printf("%s haplogroup: %s", source.type().displayName(), top.name());
      CliPrinter.printf(" Score      : %.2f", top.score());
      CliPrinter.printf(" Derived    : %d", top.matchingSnps());
      CliPrinter.printf(" Ancestral  : %d", top.ancestralMatches());
      CliPrinter.printf(" Confidence : %.2f", analysis.confidence());
      CliPrinter.println(" Report     : " + report);
    } else {
      CliPrinter.printLines(
          "No " + source.type().displayName() + " haplogroup could be determined.",
          " Report     : " + report);
    }
    return ExitCode.SUCCESS;
  }

  private static String removeConfigPath(Map<String, String> kv) {
    String explicit = kv.remove("config");
    String dashed = kv.remove("--config");
    String chosen = explicit != null ? explicit : dashed;
    return chosen == null || chosen.isBlank() ? null : chosen.trim();
  }
}
