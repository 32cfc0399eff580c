package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable map split on the first {@code '='}. Later duplicates win.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map keyed by the text before {@code '='}
   * @throws IllegalArgumentException if an argument is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (value.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
      }
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }
}
