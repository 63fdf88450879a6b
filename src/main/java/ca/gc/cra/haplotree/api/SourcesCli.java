package ca.gc.cra.haplotree.api;

import ca.gc.cra.haplotree.application.tree.TreeSource;
import ca.gc.cra.haplotree.config.TreeSources;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Lists the built-in tree sources with their type, format and supported builds.
 *
 * @since 0.1.0
 */
public final class SourcesCli {
  private static final String ROW = "%-18s %-7s %-11s %-8s %s";
  private static final String HELP_TEXT = """
      HAPLOTREE sources

      Usage:
        sources

      Prints every built-in tree source id with its tree type, payload format, native build,
      supported builds and download URL. Use the id as 'source=ID' for classify.
      """;

  private SourcesCli() {}

  /**
   * Prints the source table.
   *
   * @param args raw CLI arguments
   * @return {@link ExitCode#SUCCESS}, or {@link ExitCode#INVALID_ARGS} for unexpected arguments
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (!input.settings().isEmpty() || !input.unknownFlags().isEmpty()) {
      CliPrinter.println("usage: sources");
      return ExitCode.INVALID_ARGS;
    }
    List<TreeSource> sources = TreeSources.builtIn();
    CliPrinter.printf(ROW, "ID", "TYPE", "FORMAT", "NATIVE", "SUPPORTED BUILDS");
    for (TreeSource source : sources) {
      CliPrinter.printf(ROW,
          source.id(),
          source.type().displayName(),
          source.format().name().toLowerCase(Locale.ROOT),
          source.nativeBuild(),
          String.join(", ", new TreeSet<>(source.supportedBuilds())));
      CliPrinter.println("  " + source.url());
    }
    return ExitCode.SUCCESS;
  }
}
