package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.adapter.kafka.KafkaUpstreamReporter;
import ca.gc.cra.beacon.application.announce.InstanceAnnouncer;
import ca.gc.cra.beacon.application.pipeline.ConnectionDecodeLoop;
import ca.gc.cra.beacon.application.pipeline.DaemonLifecycle;
import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.ProcessLock;
import ca.gc.cra.beacon.application.port.PropertiesProvider;
import ca.gc.cra.beacon.application.port.ShutdownSignals;
import ca.gc.cra.beacon.application.port.UpstreamReporter;
import ca.gc.cra.beacon.application.relay.RelayQueue;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.beacon.infrastructure.ipc.LengthPrefixedFrameDecoder;
import ca.gc.cra.beacon.infrastructure.ipc.UnixSocketListener;
import ca.gc.cra.beacon.infrastructure.lock.FileSingletonGuard;
import ca.gc.cra.beacon.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.beacon.infrastructure.process.HostPropertiesProvider;
import ca.gc.cra.beacon.infrastructure.process.JvmShutdownSignals;
import ca.gc.cra.beacon.infrastructure.reporter.LoggingUpstreamReporter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the daemon's components from a {@link DaemonConfig}.
 * <p><strong>Role:</strong> The only place that knows which adapter implements which port.</p>
 * <p><strong>Thread-safety:</strong> Used once on the bootstrap thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final DaemonConfig config;
  private final MetricsPort metrics;
  private final AutoCloseable metricsResource;

  /**
   * Creates a root whose metrics follow the OpenTelemetry environment settings.
   *
   * @param config daemon configuration
   */
  public CompositionRoot(DaemonConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(config.serviceInstance()));
  }

  /**
   * Creates a root with an explicit metrics sink.
   *
   * @param config daemon configuration
   * @param metrics metrics sink; closed with this root when it is {@link AutoCloseable}
   */
  public CompositionRoot(DaemonConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsResource = metrics instanceof AutoCloseable closeable ? closeable : null;
  }

  /**
   * Returns the shared metrics sink.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds a daemon lifecycle with production adapters.
   *
   * @return ready-to-run lifecycle
   */
  public DaemonLifecycle daemonLifecycle() {
    return daemonLifecycle(new FileSingletonGuard(), new JvmShutdownSignals(), upstreamReporter());
  }

  /**
   * Builds a daemon lifecycle with the supplied lock, signal source, and reporter.
   *
   * @param processLock singleton lock
   * @param signals termination signal source
   * @param reporter upstream reporter
   * @return ready-to-run lifecycle
   */
  public DaemonLifecycle daemonLifecycle(
      ProcessLock processLock, ShutdownSignals signals, UpstreamReporter reporter) {
    RelayQueue<CollectItem> queue = new RelayQueue<>(config.queueCapacity(), metrics);
    ConnectionDecodeLoop decodeLoop =
        new ConnectionDecodeLoop(new LengthPrefixedFrameDecoder(config.maxFrameBytes()), queue, metrics);
    UnixSocketListener listener =
        new UnixSocketListener(config.effectiveWorkerThreads(), config.maxConnections(), metrics);
    InstanceAnnouncer announcer = new InstanceAnnouncer(
        propertiesProvider(),
        queue,
        config.heartbeatPeriod(),
        config.propertiesReportPeriodFactor(),
        ExecutorFactories.newScheduler("beacon-announcer"),
        metrics,
        ClockPort.SYSTEM);
    DaemonLifecycle.Settings settings =
        new DaemonLifecycle.Settings(config.pidFile(), config.socketPath(), config.shutdownTimeout());
    return new DaemonLifecycle(
        settings, processLock, listener, signals, reporter, queue, announcer, decodeLoop, metrics);
  }

  /**
   * Builds the reporter selected by {@link DaemonConfig#reporter()}.
   *
   * @return upstream reporter
   */
  public UpstreamReporter upstreamReporter() {
    return switch (config.reporter()) {
      case LOG -> new LoggingUpstreamReporter();
      case KAFKA -> new KafkaUpstreamReporter(
          config.kafkaBootstrap().orElseThrow(),
          config.kafkaTopicPrefix(),
          config.serviceInstance(),
          metrics);
    };
  }

  /**
   * Builds the host facts provider.
   *
   * @return properties provider
   */
  public PropertiesProvider propertiesProvider() {
    return new HostPropertiesProvider(
        config.serviceName(), config.serviceInstance(), config.language(), config.hostPid());
  }

  @Override
  public void close() {
    if (metricsResource == null) {
      return;
    }
    try {
      metricsResource.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics sink", ex);
    }
  }
}
