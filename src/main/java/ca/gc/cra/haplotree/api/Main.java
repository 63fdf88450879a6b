package ca.gc.cra.haplotree.api;

import ca.gc.cra.haplotree.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HAPLOTREE CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: haplotree <classify|sources> [options]";
  private static final String HELP_TEXT = """
      HAPLOTREE command dispatcher

      Usage:
        haplotree <command> [options]

      Commands:
        classify    Classify a sample's calls against a haplogroup tree (classify --help for details)
        sources     List the built-in tree sources

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the subcommand
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    if (safeArgs.length == 0 || safeArgs[0] == null || safeArgs[0].startsWith("-")) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled for dispatcher");
      }
      String[] remainder = Arrays.stream(safeArgs)
          .filter(arg -> arg != null && !arg.isBlank() && !CliInput.isVerboseFlag(arg))
          .toArray(String[]::new);
      if (remainder.length == 0) {
        log.error("Missing command");
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      return dispatch(remainder);
    }
    return dispatch(safeArgs);
  }

  private static ExitCode dispatch(String[] args) {
    String command = args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    return switch (command) {
      case "classify" -> ClassifyCli.run(delegateArgs);
      case "sources" -> SourcesCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
