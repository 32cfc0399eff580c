package ca.gc.cra.beacon.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects out-of-range queue sizes, periods, and thread counts before the daemon
 * allocates sockets or threads.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
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
   * Parses a decimal integer and validates its range.
   *
   * @param name logical parameter name
   * @param raw text to parse
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside the range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long parsed;
    try {
      parsed = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + trimmed + ")", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
