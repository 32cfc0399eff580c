package ca.gc.cra.beacon.application.relay;

import ca.gc.cra.beacon.application.port.CollectItemConsumer;
import ca.gc.cra.beacon.application.port.UpstreamReporter;
import ca.gc.cra.beacon.application.port.UpstreamTransportException;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Base {@link UpstreamReporter} implementing the relay drain protocol.
 * <p><strong>Behaviour:</strong> Blocks on {@link CollectItemConsumer#next()} until the relay closes, then forwards
 * whatever {@link CollectItemConsumer#tryNext()} still yields, then calls {@link #flush()} and {@link #release()}.
 * {@link #release()} runs even when forwarding fails.</p>
 * <p><strong>Thread-safety:</strong> Subclasses are driven by one reporter thread.</p>
 *
 * @since 0.1.0
 */
public abstract class DrainingReporter implements UpstreamReporter {
  private static final Logger log = LoggerFactory.getLogger(DrainingReporter.class);

  @Override
  public final void report(CollectItemConsumer consumer) throws Exception {
    Objects.requireNonNull(consumer, "consumer");
    long forwarded = 0;
    long flushed = 0;
    try {
      Optional<CollectItem> item;
      while ((item = consumer.next()).isPresent()) {
        forward(item.get());
        forwarded++;
      }
      log.debug("Relay closed; draining remaining items");
      while ((item = consumer.tryNext()).isPresent()) {
        forward(item.get());
        flushed++;
      }
      flush();
      log.info("Reporter {} finished: {} forwarded, {} flushed on shutdown", name(), forwarded, flushed);
    } finally {
      release();
    }
  }

  /**
   * Ships one item upstream.
   *
   * @param item item to forward
   * @throws UpstreamTransportException if the transport has failed
   */
  protected abstract void forward(CollectItem item) throws UpstreamTransportException;

  /**
   * Waits for in-flight items to be acknowledged.
   *
   * @throws UpstreamTransportException if the transport has failed
   */
  protected abstract void flush() throws UpstreamTransportException;

  /** Releases transport resources. */
  protected void release() {
    // nothing to release by default
  }
}
