package ca.gc.cra.beacon.application.relay;

import ca.gc.cra.beacon.application.port.CollectItemConsumer;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import java.util.Objects;
import java.util.Optional;

/**
 * Exposes a {@link RelayQueue} to an upstream reporter through {@link CollectItemConsumer}.
 *
 * @since 0.1.0
 */
public final class RelayQueueConsumer implements CollectItemConsumer {
  private final RelayQueue<CollectItem> queue;
  private final MetricsPort metrics;

  /**
   * Wraps the relay queue.
   *
   * @param queue relay queue drained by the reporter
   * @param metrics metrics sink
   */
  public RelayQueueConsumer(RelayQueue<CollectItem> queue, MetricsPort metrics) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public Optional<CollectItem> next() throws InterruptedException {
    Optional<CollectItem> item = queue.next();
    if (item.isPresent()) {
      metrics.increment("sink.forwarded");
    }
    return item;
  }

  @Override
  public Optional<CollectItem> tryNext() {
    Optional<CollectItem> item = queue.tryNext();
    if (item.isPresent()) {
      metrics.increment("sink.flushed");
    }
    return item;
  }
}
