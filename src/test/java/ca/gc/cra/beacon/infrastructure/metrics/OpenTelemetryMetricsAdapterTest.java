package ca.gc.cra.beacon.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void countersCarryMetricKeyAndServiceResource() {
    adapter.increment("relay.dropped");
    adapter.increment("relay.dropped");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "relay.dropped");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("relay.dropped", point.getAttributes().get(AttributeKey.stringKey("beacon.metric.key")));
    assertEquals("beacon", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observationsRecordHistogram() {
    adapter.observe("relay.queue.highWater", 3);
    adapter.observe("relay.queue.highWater", 7);

    MetricData histogram = find(reader.collectAllMetrics(), "relay.queue.highwater");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(10.0, point.getSum());
  }

  @Test
  void sanitizesInvalidNames() {
    assertEquals("ipc.frame_bad", OpenTelemetryMetricsAdapter.sanitizeName("ipc.frame bad"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("beacon.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void parsesResourceAttributesIgnoringMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=prod, bad, region = ca-central ,");

    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("ca-central", attributes.get(AttributeKey.stringKey("region")));
    assertEquals(2, attributes.size());
  }

  @Test
  void noopBootstrapIgnoresUpdates() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop());
    noop.increment("anything");
    noop.observe("anything", 1);
    noop.close();
    assertTrue(reader.collectAllMetrics().isEmpty());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
