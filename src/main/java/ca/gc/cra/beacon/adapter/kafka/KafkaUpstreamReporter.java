package ca.gc.cra.beacon.adapter.kafka;

import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.UpstreamTransportException;
import ca.gc.cra.beacon.application.relay.DrainingReporter;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.ItemKind;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reporter that publishes relayed items to Kafka, one topic per item family.
 * <p><strong>Why:</strong> Lets collectors on other hosts consume agent telemetry without a direct connection
 * to every daemon.</p>
 * <p><strong>Topics:</strong> {@code <prefix>-segments}, {@code <prefix>-meters}, {@code <prefix>-logs}; instance
 * properties and keep-alives share {@code <prefix>-management}. Records are keyed by service instance and carry a
 * {@code beacon.kind} header.</p>
 * <p><strong>Failure model:</strong> Sends are asynchronous. The first failed send is remembered and rethrown
 * as {@link UpstreamTransportException} on the next forward or flush, which ends the pipeline.</p>
 * <p><strong>Observability:</strong> Counts {@code sink.kafka.sent} and {@code sink.kafka.error}.</p>
 *
 * @since 0.1.0
 */
public final class KafkaUpstreamReporter extends DrainingReporter {
  private static final Logger log = LoggerFactory.getLogger(KafkaUpstreamReporter.class);
  static final String KIND_HEADER = "beacon.kind";
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Producer<String, byte[]> producer;
  private final Map<ItemKind, String> topics;
  private final String recordKey;
  private final MetricsPort metrics;
  private final AtomicReference<Exception> sendFailure = new AtomicReference<>();

  /**
   * Creates a reporter backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated bootstrap servers
   * @param topicPrefix topic prefix
   * @param serviceInstance record key
   * @param metrics metrics sink
   */
  public KafkaUpstreamReporter(
      String bootstrapServers, String topicPrefix, String serviceInstance, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topicPrefix, serviceInstance, metrics);
  }

  KafkaUpstreamReporter(
      Producer<String, byte[]> producer, String topicPrefix, String serviceInstance, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topics = topicsFor(requireNonBlank(topicPrefix, "topicPrefix"));
    this.recordKey = requireNonBlank(serviceInstance, "serviceInstance");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  protected void forward(CollectItem item) throws UpstreamTransportException {
    throwIfFailed();
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topicFor(item.kind()), recordKey, item.payload());
    record.headers().add(KIND_HEADER, item.kind().name().getBytes(StandardCharsets.US_ASCII));
    try {
      producer.send(record, (metadata, exception) -> {
        if (exception == null) {
          metrics.increment("sink.kafka.sent");
          return;
        }
        metrics.increment("sink.kafka.error");
        if (sendFailure.compareAndSet(null, exception)) {
          log.error("Kafka send to {} failed", record.topic(), exception);
        }
      });
    } catch (KafkaException ex) {
      metrics.increment("sink.kafka.error");
      throw new UpstreamTransportException("Kafka send to " + record.topic() + " failed", ex);
    }
  }

  @Override
  protected void flush() throws UpstreamTransportException {
    try {
      producer.flush();
    } catch (KafkaException ex) {
      throw new UpstreamTransportException("Kafka flush failed", ex);
    }
    throwIfFailed();
  }

  @Override
  protected void release() {
    try {
      producer.close(CLOSE_TIMEOUT);
    } catch (KafkaException ex) {
      log.warn("Kafka producer did not close cleanly", ex);
    }
  }

  @Override
  public String name() {
    return "kafka";
  }

  /**
   * Returns the topic an item kind is published to.
   *
   * @param kind item kind
   * @return topic name
   */
  public String topicFor(ItemKind kind) {
    return topics.get(kind);
  }

  private void throwIfFailed() throws UpstreamTransportException {
    Exception failure = sendFailure.get();
    if (failure != null) {
      throw new UpstreamTransportException("Kafka rejected a previous send", failure);
    }
  }

  private static Map<ItemKind, String> topicsFor(String prefix) {
    Map<ItemKind, String> topics = new EnumMap<>(ItemKind.class);
    topics.put(ItemKind.SEGMENT, prefix + "-segments");
    topics.put(ItemKind.METER, prefix + "-meters");
    topics.put(ItemKind.LOG, prefix + "-logs");
    topics.put(ItemKind.INSTANCE_PROPERTIES, prefix + "-management");
    topics.put(ItemKind.KEEP_ALIVE, prefix + "-management");
    return topics;
  }

  private static String requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value.trim();
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, requireNonBlank(bootstrapServers, "bootstrapServers"));
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.CLIENT_ID_CONFIG, "beacon-reporter");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
