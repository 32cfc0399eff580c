package ca.gc.cra.beacon.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI or YAML.
 * <p><strong>Why:</strong> Service names, topic prefixes, and resource attributes travel upstream verbatim, so they
 * must be free of control characters and use the broker's identifier alphabet.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic-like identifier.
   *
   * @param name logical parameter name included in exception messages
   * @param topic candidate topic
   * @return sanitized topic matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the topic contains unsupported characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
