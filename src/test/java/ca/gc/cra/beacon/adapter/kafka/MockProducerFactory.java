package ca.gc.cra.beacon.adapter.kafka;

import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Builds {@link MockProducer} instances with a fixed partition.
 */
final class MockProducerFactory {
  private static final Partitioner SINGLE_PARTITION = new Partitioner() {
    @Override
    public void configure(Map<String, ?> configs) {
      // no configuration
    }

    @Override
    public int partition(
        String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes, Cluster cluster) {
      return 0;
    }

    @Override
    public void close() {
      // nothing to release
    }
  };

  private MockProducerFactory() {}

  static MockProducer<String, byte[]> byteArrayProducer(boolean autoComplete) {
    return new MockProducer<>(autoComplete, SINGLE_PARTITION, new StringSerializer(), new ByteArraySerializer());
  }
}
