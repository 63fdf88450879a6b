package ca.gc.cra.haplotree.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line tokens split into recognised switches and {@code key=value} settings.
 *
 * @param settings tokens handed to {@link CliArgsParser}, in input order
 * @param help {@code --help}, {@code -h} or {@code help} was present
 * @param verbose {@code --verbose}, {@code -v} or {@code --debug} was present
 * @param unknownFlags other dash-prefixed tokens without {@code =}, lowercased, in input order
 */
record CliInput(List<String> settings, boolean help, boolean verbose, List<String> unknownFlags) {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  CliInput {
    settings = List.copyOf(settings);
    unknownFlags = List.copyOf(unknownFlags);
  }

  /**
   * Splits raw arguments. {@code null} and blank tokens are skipped.
   *
   * @param args raw CLI arguments, may be {@code null}
   * @return split arguments
   */
  static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    List<String> unknown = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          help = true;
        } else if (VERBOSE_FLAGS.contains(lower)) {
          verbose = true;
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          unknown.add(lower);
        } else {
          settings.add(arg);
        }
      }
    }
    return new CliInput(settings, help, verbose, unknown);
  }

  static boolean isVerboseFlag(String arg) {
    return arg != null && VERBOSE_FLAGS.contains(arg.trim().toLowerCase(Locale.ROOT));
  }

  String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }
}
