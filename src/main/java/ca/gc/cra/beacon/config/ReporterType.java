package ca.gc.cra.beacon.config;

import java.util.Locale;

/**
 * Upstream reporter selected by the {@code reporter} key.
 */
public enum ReporterType {
  /** Writes relayed items to the daemon log. */
  LOG,
  /** Publishes relayed items to Kafka. */
  KAFKA;

  /**
   * Parses a reporter name, case-insensitively.
   *
   * @param raw reporter name; blank selects {@link #LOG}
   * @return reporter type
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ReporterType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return LOG;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "log" -> LOG;
      case "kafka" -> KAFKA;
      default -> throw new IllegalArgumentException("reporter must be 'log' or 'kafka' (was " + raw + ")");
    };
  }
}
