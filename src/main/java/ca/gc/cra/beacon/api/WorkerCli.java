package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.pipeline.DaemonLifecycle;
import ca.gc.cra.beacon.application.pipeline.LifecycleResult;
import ca.gc.cra.beacon.config.CompositionRoot;
import ca.gc.cra.beacon.config.DaemonConfig;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the relay daemon in the foreground until a termination signal or a reporter failure.
 *
 * @since 0.1.0
 */
public final class WorkerCli {
  private static final Logger log = LoggerFactory.getLogger(WorkerCli.class);
  static final String MODE = "worker";
  private static final String SUMMARY_USAGE =
      "usage: worker [config=PATH] [runtimeDir=DIR] [socketPath=PATH] [reporter=log|kafka] "
          + "[kafkaBootstrap=HOST:PORT] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      Beacon worker (foreground daemon)

      Usage:
        worker [options]

      Paths:
        runtimeDir=DIR                 Runtime directory (default /tmp/beacon-agent)
        socketPath=PATH                IPC socket (default <runtimeDir>/beacon.sock)
        pidFile=PATH                   Singleton lock file (default <runtimeDir>/beacon.pid)

      Relay:
        workerThreads=N                Warm connection threads; 0 uses host parallelism (default 0)
        maxConnections=N               Concurrent producer connections (default 1024)
        queueCapacity=N                Relay queue capacity; full queue drops items (default 255)
        maxFrameBytes=N                Largest accepted frame (default 16777216)
        shutdownTimeoutMillis=N        Final flush budget after a signal (default 10000)

      Identity and heartbeat:
        serviceName=NAME               Service name (default hello-beacon)
        serviceInstance=NAME           Instance name (default random id @ hostname)
        language=NAME                  Language tag (default java)
        hostPid=PID                    Host process id reported as process_no
        heartbeatPeriod=SECONDS        Heartbeat period (default 30)
        propertiesReportPeriodFactor=N Heartbeats between full registrations (default 10)

      Upstream:
        reporter=log|kafka             Reporter (default log)
        kafkaBootstrap=HOST:PORT[,..]  Required for reporter=kafka
        kafkaTopicPrefix=PREFIX        Topic prefix (default beacon)

      Global options:
        config=PATH                    YAML file with common/worker sections
        logLevel=LEVEL                 TRACE|DEBUG|INFO|WARN|ERROR|OFF (default INFO)
        logFile=PATH                   Also write logs to PATH
        metricsExporter=otlp|none      OpenTelemetry exporter (default otlp)
        otelEndpoint=URL               OTLP endpoint
        otelResourceAttributes=K=V,..  Extra resource attributes
        --dry-run                      Print the resolved configuration and exit
        --verbose                      Enable DEBUG logging
        --help                         Show this message
      """;

  private WorkerCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    Main.exitJvm(run(args));
  }

  /**
   * Runs the worker and returns its exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for worker");
    }

    Map<String, String> effective;
    try {
      effective = ConfigResolver.resolve(MODE, input, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }
    boolean verbose = input.verbose() || ConfigCliUtils.parseBoolean(effective, "verbose", false);
    if (verbose && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    DaemonConfig config;
    try {
      TelemetryConfigurator.configureMetrics(effective);
      config = DaemonConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid worker configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printPlan(config);
      return ExitCode.SUCCESS;
    }
    applyLogging(config, verbose);

    try (CompositionRoot root = new CompositionRoot(config)) {
      DaemonLifecycle lifecycle = root.daemonLifecycle();
      log.info("Starting worker for service {} instance {}", config.serviceName(), config.serviceInstance());
      return toExitCode(lifecycle.run());
    } catch (IllegalArgumentException ex) {
      log.error("Worker configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in worker", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static ExitCode toExitCode(LifecycleResult result) {
    return switch (result) {
      case STOPPED_BY_SIGNAL, COMPLETED -> ExitCode.SUCCESS;
      case PIPELINE_FAILED -> ExitCode.PIPELINE_FAILURE;
      case ALREADY_RUNNING -> ExitCode.ALREADY_RUNNING;
      case LOCK_FAILED, BIND_FAILED -> ExitCode.IO_ERROR;
      case SIGNAL_REGISTRATION_FAILED -> ExitCode.RUNTIME_FAILURE;
      case INTERRUPTED -> ExitCode.INTERRUPTED;
    };
  }

  private static void applyLogging(DaemonConfig config, boolean verbose) {
    if (!verbose) {
      LoggingConfigurator.setRootLevel(config.logLevel());
    }
    config.logFile().ifPresent(LoggingConfigurator::attachFileAppender);
  }

  private static void printPlan(DaemonConfig config) {
    CliPrinter.printLines(
        "Worker dry-run: the daemon will not start.",
        " Socket            : " + config.socketPath(),
        " Lock file         : " + config.pidFile(),
        " Worker threads    : " + config.effectiveWorkerThreads(),
        " Max connections   : " + config.maxConnections(),
        " Queue capacity    : " + config.queueCapacity(),
        " Max frame bytes   : " + config.maxFrameBytes(),
        " Heartbeat         : " + config.heartbeatPeriod().toSeconds() + "s x"
            + config.propertiesReportPeriodFactor(),
        " Service           : " + config.serviceName() + " / " + config.serviceInstance(),
        " Reporter          : " + config.reporter(),
        " Kafka bootstrap   : " + config.kafkaBootstrap().orElse("<none>"),
        " Re-run without --dry-run to start the worker.");
  }
}
