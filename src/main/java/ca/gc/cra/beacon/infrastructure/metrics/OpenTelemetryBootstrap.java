package ca.gc.cra.beacon.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the daemon from system properties and environment.
 * <p>System properties ({@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint},
 * {@code otel.resource.attributes}) win over the matching {@code OTEL_*} environment variables.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.beacon";
  private static final String DEFAULT_EXPORTER = "otlp";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize(String serviceInstance) {
    try {
      BootstrapConfig config = BootstrapConfig.fromEnvironment(serviceInstance);
      if (config.exporter() == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      SdkMeterProvider provider = SdkMeterProvider.builder()
          .setResource(config.resource())
          .registerMetricReader(otlpReader(config.endpoint()))
          .build();
      Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
          .setInstrumentationVersion(config.version())
          .build();
      log.info("OpenTelemetry metrics exporting to {}", config.endpoint());
      return BootstrapResult.active(provider, meter);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    String version = detectServiceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version, "test", Attributes.empty()))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static MetricReader otlpReader(String endpoint) {
    OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
    return PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
  }

  private static Resource buildResource(String version, String instanceId, Attributes additional) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "beacon")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    if (instanceId != null && !instanceId.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instanceId);
    }
    Resource base = Resource.create(builder.build());
    Resource extra = additional.isEmpty() ? Resource.empty() : Resource.create(additional);
    return Resource.getDefault().merge(base).merge(extra);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null && !pkg.getImplementationVersion().isBlank()) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/beacon/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  record BootstrapConfig(ExporterMode exporter, String endpoint, Resource resource, String version) {
    static BootstrapConfig fromEnvironment(String serviceInstance) {
      Properties props = System.getProperties();
      ExporterMode exporter = ExporterMode.from(firstNonBlank(
          props.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), DEFAULT_EXPORTER));
      String endpoint = firstNonBlank(
          props.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      String attributes = firstNonBlank(
          props.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
      String version = detectServiceVersion();
      Resource resource = buildResource(version, serviceInstance, parseResourceAttributes(attributes));
      return new BootstrapConfig(exporter, endpoint, resource, version);
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; defaulting to {}", raw, DEFAULT_EXPORTER);
          yield OTLP;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
