package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.collect.CollectItem;
import java.util.Optional;

/**
 * Drain-side view of the relay queue handed to an {@link UpstreamReporter}.
 *
 * <p>{@link #next()} is used for steady-state streaming; once it reports closed, the reporter may
 * call {@link #tryNext()} until it returns empty to flush whatever was still queued.</p>
 *
 * @since 0.1.0
 */
public interface CollectItemConsumer {
  /**
   * Blocks until an item is available or the relay has been closed.
   *
   * @return next item, or empty once the relay is closed
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  Optional<CollectItem> next() throws InterruptedException;

  /**
   * Returns a queued item without waiting.
   *
   * @return queued item, or empty when nothing is buffered
   */
  Optional<CollectItem> tryNext();
}
