package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each CLI mode.
 *
 * <p>Keys whose default is derived at build time ({@code socketPath}, {@code pidFile},
 * {@code serviceInstance}) map to an empty string; {@link DaemonConfig#fromMap(Map)} fills them in.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a mode merged over the common defaults.
   *
   * @param mode {@code worker}, {@code start}, or {@code send}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "worker", "start" -> buildDaemonDefaults();
      case "send" -> buildSendDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("runtimeDir", DaemonConfig.DEFAULT_RUNTIME_DIR.toString());
    map.put("socketPath", "");
    map.put("logLevel", "INFO");
    map.put("logFile", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildDaemonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("pidFile", "");
    map.put("workerThreads", "0");
    map.put("queueCapacity", Integer.toString(DaemonConfig.DEFAULT_QUEUE_CAPACITY));
    map.put("heartbeatPeriod", Integer.toString(DaemonConfig.DEFAULT_HEARTBEAT_SECONDS));
    map.put("propertiesReportPeriodFactor", Integer.toString(DaemonConfig.DEFAULT_PROPERTIES_FACTOR));
    map.put("maxFrameBytes", Integer.toString(DaemonConfig.DEFAULT_MAX_FRAME_BYTES));
    map.put("maxConnections", Integer.toString(DaemonConfig.DEFAULT_MAX_CONNECTIONS));
    map.put("shutdownTimeoutMillis", Integer.toString(DaemonConfig.DEFAULT_SHUTDOWN_TIMEOUT_MILLIS));
    map.put("serviceName", DaemonConfig.DEFAULT_SERVICE_NAME);
    map.put("serviceInstance", "");
    map.put("language", DaemonConfig.DEFAULT_LANGUAGE);
    map.put("hostPid", "");
    map.put("reporter", "log");
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopicPrefix", DaemonConfig.DEFAULT_TOPIC_PREFIX);
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return map;
  }

  private static Map<String, String> buildSendDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("kind", "LOG");
    map.put("payload", "");
    map.put("count", "1");
    return map;
  }
}
