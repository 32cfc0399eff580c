package ca.gc.cra.beacon.infrastructure.metrics;

import ca.gc.cra.beacon.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards daemon counters and observations to OpenTelemetry.
 * <p>Instruments are created lazily per key and cached; safe for concurrent use from decode threads.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("beacon.metric.key");
  private static final String FALLBACK_METRIC_NAME = "beacon.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final boolean noop;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   *
   * @param serviceInstance value for the {@code service.instance.id} resource attribute
   */
  public OpenTelemetryMetricsAdapter(String serviceInstance) {
    this(OpenTelemetryBootstrap.initialize(serviceInstance));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.noop = bootstrap.isNoop();
    if (noop) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    if (noop) {
      return;
    }
    CounterInstrument instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    if (noop) {
      return;
    }
    HistogramInstrument instrument =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /** Pushes buffered measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    LongCounter counter = meter
        .counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("Beacon counter for " + key)
        .build();
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    LongHistogram histogram = meter
        .histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("Beacon observation for " + key)
        .build();
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
