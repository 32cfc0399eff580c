package ca.gc.cra.beacon.application.announce;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.PropertiesProvider;
import ca.gc.cra.beacon.application.relay.EnqueueOutcome;
import ca.gc.cra.beacon.application.relay.RelayQueue;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.InstanceProperties;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Periodic heartbeat that keeps the daemon's service instance registered upstream.
 * <p><strong>Why:</strong> The backend must see the instance as alive regardless of telemetry volume.</p>
 * <p><strong>Behaviour:</strong> Fires every {@code heartbeatPeriod}, starting immediately. Every tick
 * rebuilds {@link InstanceProperties} from live host facts. Tick {@code k} emits a full properties
 * registration when {@code k % propertiesReportPeriodFactor == 0}, otherwise a keep-alive. A registration
 * that could not be enqueued is retried on the following tick.</p>
 * <p><strong>Thread-safety:</strong> Ticks run on a single scheduler thread.</p>
 * <p><strong>Observability:</strong> Counts {@code announcer.properties}, {@code announcer.keepalive},
 * {@code announcer.dropped}, and {@code announcer.error}.</p>
 *
 * @since 0.1.0
 */
public final class InstanceAnnouncer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(InstanceAnnouncer.class);

  private final PropertiesProvider propertiesProvider;
  private final RelayQueue<CollectItem> queue;
  private final Duration heartbeatPeriod;
  private final int propertiesReportPeriodFactor;
  private final ScheduledExecutorService scheduler;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AnnouncementCodec codec = new AnnouncementCodec();
  private final AtomicLong ticks = new AtomicLong();

  private volatile boolean propertiesPending;
  private ScheduledFuture<?> schedule;

  /**
   * Creates an announcer.
   *
   * @param propertiesProvider live host facts
   * @param queue relay queue shared with telemetry
   * @param heartbeatPeriod tick period; must be positive
   * @param propertiesReportPeriodFactor ticks between full registrations; at least 1
   * @param scheduler scheduler owning the tick thread; shut down by {@link #close()}
   * @param metrics metrics sink
   * @param clock timestamp source
   */
  public InstanceAnnouncer(
      PropertiesProvider propertiesProvider,
      RelayQueue<CollectItem> queue,
      Duration heartbeatPeriod,
      int propertiesReportPeriodFactor,
      ScheduledExecutorService scheduler,
      MetricsPort metrics,
      ClockPort clock) {
    this.propertiesProvider = Objects.requireNonNull(propertiesProvider, "propertiesProvider");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.heartbeatPeriod = Objects.requireNonNull(heartbeatPeriod, "heartbeatPeriod");
    if (heartbeatPeriod.isZero() || heartbeatPeriod.isNegative()) {
      throw new IllegalArgumentException("heartbeatPeriod must be positive");
    }
    if (propertiesReportPeriodFactor < 1) {
      throw new IllegalArgumentException("propertiesReportPeriodFactor must be at least 1");
    }
    this.propertiesReportPeriodFactor = propertiesReportPeriodFactor;
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Schedules the heartbeat at a fixed rate.
   *
   * @throws IllegalStateException if already started
   */
  public synchronized void start() {
    if (schedule != null) {
      throw new IllegalStateException("Announcer already started");
    }
    long periodMillis = heartbeatPeriod.toMillis();
    schedule = scheduler.scheduleAtFixedRate(this::tick, 0L, periodMillis, TimeUnit.MILLISECONDS);
    log.info("Announcer started (heartbeat every {} ms, properties every {} ticks)",
        periodMillis, propertiesReportPeriodFactor);
  }

  /**
   * Runs one heartbeat tick. Never throws so the schedule is not cancelled by a bad tick.
   */
  void tick() {
    long tick = ticks.getAndIncrement();
    try {
      InstanceProperties properties = propertiesProvider.snapshot();
      boolean registration = propertiesPending || tick % propertiesReportPeriodFactor == 0;
      long now = clock.nowMillis();
      CollectItem item = registration
          ? codec.properties(properties, now)
          : codec.keepAlive(properties, now);
      log.debug("Announcing {} on tick {}: {}", item.kind(), tick, properties.attributes());
      EnqueueOutcome outcome = queue.tryEnqueue(item);
      if (outcome == EnqueueOutcome.ENQUEUED) {
        metrics.increment(registration ? "announcer.properties" : "announcer.keepalive");
        propertiesPending = false;
      } else {
        metrics.increment("announcer.dropped");
        propertiesPending = registration || propertiesPending;
        log.warn("Announcement {} not relayed ({})", item.kind(), outcome);
      }
    } catch (RuntimeException ex) {
      metrics.increment("announcer.error");
      log.error("Heartbeat tick {} failed", tick, ex);
    }
  }

  /**
   * Returns how many ticks have run.
   *
   * @return tick count
   */
  public long tickCount() {
    return ticks.get();
  }

  /** Stops the heartbeat and the scheduler. */
  @Override
  public synchronized void close() {
    if (schedule != null) {
      schedule.cancel(false);
    }
    scheduler.shutdownNow();
    log.debug("Announcer stopped after {} ticks", ticks.get());
  }
}
