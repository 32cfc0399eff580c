package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.infrastructure.process.HostPropertiesProvider;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import ca.gc.cra.beacon.validation.Net;
import ca.gc.cra.beacon.validation.Numbers;
import ca.gc.cra.beacon.validation.Paths;
import ca.gc.cra.beacon.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * <strong>What:</strong> Immutable daemon configuration, built once at startup and handed to every component.
 * <p><strong>Why:</strong> Keeps paths, periods, and sizes out of global state so each component states exactly
 * what it depends on.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param runtimeDir directory holding the socket, pid file, and worker output
 * @param socketPath IPC socket file
 * @param pidFile singleton lock file
 * @param workerThreads warm decode threads; {@code 0} means host parallelism
 * @param queueCapacity relay queue capacity
 * @param heartbeatPeriod announcer tick period
 * @param propertiesReportPeriodFactor ticks between full instance registrations
 * @param maxFrameBytes largest accepted frame body
 * @param maxConnections concurrent producer connection cap
 * @param shutdownTimeout how long the reporter may flush after a signal
 * @param serviceName service reported upstream
 * @param serviceInstance instance reported upstream
 * @param language language tag reported upstream
 * @param hostPid pid of the instrumented host process, when known
 * @param reporter upstream reporter
 * @param kafkaBootstrap Kafka bootstrap servers for {@link ReporterType#KAFKA}
 * @param kafkaTopicPrefix Kafka topic prefix
 * @param logLevel root log level
 * @param logFile optional log file
 * @since 0.1.0
 */
public record DaemonConfig(
    Path runtimeDir,
    Path socketPath,
    Path pidFile,
    int workerThreads,
    int queueCapacity,
    Duration heartbeatPeriod,
    int propertiesReportPeriodFactor,
    int maxFrameBytes,
    int maxConnections,
    Duration shutdownTimeout,
    String serviceName,
    String serviceInstance,
    String language,
    OptionalLong hostPid,
    ReporterType reporter,
    Optional<String> kafkaBootstrap,
    String kafkaTopicPrefix,
    String logLevel,
    Optional<Path> logFile) {

  /** Default runtime directory. */
  public static final Path DEFAULT_RUNTIME_DIR = Path.of("/tmp/beacon-agent");
  /** Socket file name inside the runtime directory. */
  public static final String SOCKET_FILE_NAME = "beacon.sock";
  /** Lock file name inside the runtime directory. */
  public static final String PID_FILE_NAME = "beacon.pid";
  static final int DEFAULT_QUEUE_CAPACITY = 255;
  static final int DEFAULT_HEARTBEAT_SECONDS = 30;
  static final int DEFAULT_PROPERTIES_FACTOR = 10;
  static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;
  static final int DEFAULT_MAX_CONNECTIONS = 1024;
  static final int DEFAULT_SHUTDOWN_TIMEOUT_MILLIS = 10_000;
  static final String DEFAULT_SERVICE_NAME = "hello-beacon";
  static final String DEFAULT_LANGUAGE = "java";
  static final String DEFAULT_TOPIC_PREFIX = "beacon";
  private static final int MAX_NAME_LENGTH = 256;

  public DaemonConfig {
    Objects.requireNonNull(runtimeDir, "runtimeDir");
    Objects.requireNonNull(socketPath, "socketPath");
    Objects.requireNonNull(pidFile, "pidFile");
    Objects.requireNonNull(heartbeatPeriod, "heartbeatPeriod");
    Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(serviceInstance, "serviceInstance");
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(hostPid, "hostPid");
    Objects.requireNonNull(reporter, "reporter");
    Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
    Objects.requireNonNull(kafkaTopicPrefix, "kafkaTopicPrefix");
    Objects.requireNonNull(logLevel, "logLevel");
    Objects.requireNonNull(logFile, "logFile");
    if (reporter == ReporterType.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when reporter=kafka");
    }
  }

  /**
   * Returns the configuration used when no overrides are supplied.
   *
   * @return default configuration
   */
  public static DaemonConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Builds a validated configuration from flattened {@code key=value} settings. Unknown keys are ignored.
   *
   * @param args merged settings
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static DaemonConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Path runtimeDir = optionalString(args.get("runtimeDir"))
        .map(raw -> Paths.requireUsablePath("runtimeDir", raw))
        .orElse(DEFAULT_RUNTIME_DIR);
    Path socketPath = optionalString(args.get("socketPath"))
        .map(raw -> Paths.requireUsablePath("socketPath", raw))
        .orElse(runtimeDir.resolve(SOCKET_FILE_NAME));
    Paths.requireSocketPath("socketPath", socketPath);
    Path pidFile = optionalString(args.get("pidFile"))
        .map(raw -> Paths.requireUsablePath("pidFile", raw))
        .orElse(runtimeDir.resolve(PID_FILE_NAME));

    int workerThreads = intValue(args, "workerThreads", 0, 0, 256);
    int queueCapacity = intValue(args, "queueCapacity", DEFAULT_QUEUE_CAPACITY, 1, 65_536);
    int heartbeatSeconds = intValue(args, "heartbeatPeriod", DEFAULT_HEARTBEAT_SECONDS, 1, 3_600);
    int factor = intValue(args, "propertiesReportPeriodFactor", DEFAULT_PROPERTIES_FACTOR, 1, 1_000);
    int maxFrameBytes = intValue(args, "maxFrameBytes", DEFAULT_MAX_FRAME_BYTES, 16, 268_435_456);
    int maxConnections = intValue(args, "maxConnections", DEFAULT_MAX_CONNECTIONS, 1, 65_536);
    int shutdownMillis =
        intValue(args, "shutdownTimeoutMillis", DEFAULT_SHUTDOWN_TIMEOUT_MILLIS, 0, 600_000);

    String serviceName = name(args, "serviceName").orElse(DEFAULT_SERVICE_NAME);
    String serviceInstance = name(args, "serviceInstance").orElseGet(DaemonConfig::generateInstanceName);
    String language = name(args, "language").orElse(DEFAULT_LANGUAGE);
    OptionalLong hostPid = optionalString(args.get("hostPid"))
        .map(raw -> OptionalLong.of(Numbers.parseIntInRange("hostPid", raw, 1, Integer.MAX_VALUE)))
        .orElse(OptionalLong.empty());

    ReporterType reporter = ReporterType.fromString(args.get("reporter"));
    Optional<String> kafkaBootstrap = optionalString(args.get("kafkaBootstrap"))
        .map(raw -> Net.validateHostPortList("kafkaBootstrap", raw));
    String topicPrefix = optionalString(args.get("kafkaTopicPrefix"))
        .map(raw -> Strings.sanitizeTopic("kafkaTopicPrefix", raw))
        .orElse(DEFAULT_TOPIC_PREFIX);
    String logLevel = optionalString(args.get("logLevel"))
        .map(LoggingConfigurator::requireLevel)
        .orElse("INFO");
    Optional<Path> logFile = optionalString(args.get("logFile"))
        .map(raw -> Paths.requireUsablePath("logFile", raw));

    return new DaemonConfig(
        runtimeDir,
        socketPath,
        pidFile,
        workerThreads,
        queueCapacity,
        Duration.ofSeconds(heartbeatSeconds),
        factor,
        maxFrameBytes,
        maxConnections,
        Duration.ofMillis(shutdownMillis),
        serviceName,
        serviceInstance,
        language,
        hostPid,
        reporter,
        kafkaBootstrap,
        topicPrefix,
        logLevel,
        logFile);
  }

  /**
   * Resolves {@link #workerThreads()}, substituting host parallelism for {@code 0}.
   *
   * @return positive thread count
   */
  public int effectiveWorkerThreads() {
    return workerThreads > 0 ? workerThreads : Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  /**
   * Returns the file receiving a detached worker's stdout and stderr.
   *
   * @return worker output file
   */
  public Path workerOutputFile() {
    return runtimeDir.resolve("worker.out");
  }

  private static int intValue(Map<String, String> args, String key, int defaultValue, int min, int max) {
    return optionalString(args.get(key))
        .map(raw -> Numbers.parseIntInRange(key, raw, min, max))
        .orElse(defaultValue);
  }

  private static Optional<String> name(Map<String, String> args, String key) {
    return optionalString(args.get(key)).map(raw -> Strings.requirePrintableAscii(key, raw, MAX_NAME_LENGTH));
  }

  private static Optional<String> optionalString(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static String generateInstanceName() {
    return UUID.randomUUID().toString().replace("-", "") + "@" + HostPropertiesProvider.hostName();
  }
}
