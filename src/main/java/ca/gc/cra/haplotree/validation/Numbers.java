package ca.gc.cra.haplotree.validation;

/**
 * <strong>What:</strong> Numeric parsing and range checks for configuration values.
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> No logging; failures raise {@link IllegalArgumentException} naming the
 * offending key.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name for diagnostics
   * @param value candidate value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return the value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer setting and checks its range.
   *
   * @param name setting key
   * @param raw textual value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or is out of range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      return (int) requireRange(name, Long.parseLong(text), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + text + "')", ex);
    }
  }

  /**
   * Parses a finite decimal setting and checks its range.
   *
   * @param name setting key
   * @param raw textual value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a finite number or is out of range
   */
  public static double parseDouble(String name, String raw, double min, double max) {
    String text = Strings.requireNonBlank(name, raw);
    double value;
    try {
      value = Double.parseDouble(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + text + "')", ex);
    }
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + text + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
