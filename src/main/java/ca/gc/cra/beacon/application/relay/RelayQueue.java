package ca.gc.cra.beacon.application.relay;

import ca.gc.cra.beacon.application.port.MetricsPort;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fixed-capacity fan-in queue between connection decode loops and the reporter.
 * <p><strong>Why:</strong> Producers (request-handling processes) must never wait on telemetry, so the
 * queue sheds load instead of blocking: a full queue drops the offered item.</p>
 * <p><strong>Role:</strong> The only contended resource of the daemon; many writers, one reader.</p>
 * <p><strong>Thread-safety:</strong> {@link #tryEnqueue(Object)} is safe from any thread; {@link #next()} and
 * {@link #tryNext()} are intended for the single reporter thread.</p>
 * <p><strong>Observability:</strong> Counts {@code relay.enqueued}, {@code relay.dropped},
 * {@code relay.closed.rejected} and tracks {@code relay.queue.highWater}.</p>
 *
 * @param <T> element type
 * @since 0.1.0
 */
public final class RelayQueue<T> {
  private static final Logger log = LoggerFactory.getLogger(RelayQueue.class);

  /** Largest capacity accepted. */
  public static final int MAX_CAPACITY = 65_536;

  private static final long IDLE_POLL_MILLIS = 25L;
  private static final int DROP_LOG_INTERVAL = 1_000;

  private final BlockingQueue<T> queue;
  private final int capacity;
  private final MetricsPort metrics;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicInteger highWaterMark = new AtomicInteger();

  /**
   * Creates a relay queue.
   *
   * @param capacity fixed capacity between 1 and {@link #MAX_CAPACITY}
   * @param metrics metrics sink
   * @throws IllegalArgumentException if capacity is out of range
   */
  public RelayQueue(int capacity, MetricsPort metrics) {
    if (capacity < 1 || capacity > MAX_CAPACITY) {
      throw new IllegalArgumentException(
          "capacity must be between 1 and " + MAX_CAPACITY + " (was " + capacity + ")");
    }
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Offers an item without blocking.
   *
   * @param item item to relay; must not be {@code null}
   * @return {@link EnqueueOutcome#ENQUEUED}, {@link EnqueueOutcome#DROPPED} when full, or
   *     {@link EnqueueOutcome#CLOSED} after {@link #close()}
   */
  public EnqueueOutcome tryEnqueue(T item) {
    Objects.requireNonNull(item, "item");
    if (closed.get()) {
      metrics.increment("relay.closed.rejected");
      return EnqueueOutcome.CLOSED;
    }
    if (!queue.offer(item)) {
      metrics.increment("relay.dropped");
      logDrop(dropped.incrementAndGet());
      return EnqueueOutcome.DROPPED;
    }
    metrics.increment("relay.enqueued");
    updateHighWater(queue.size());
    return EnqueueOutcome.ENQUEUED;
  }

  /**
   * Waits for the next item. Returns empty as soon as the queue is closed, even if items remain;
   * use {@link #tryNext()} to flush those.
   *
   * @return next item, or empty once closed
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<T> next() throws InterruptedException {
    while (!closed.get()) {
      T item = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (item != null) {
        return Optional.of(item);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns a buffered item without waiting; keeps working after close.
   *
   * @return buffered item or empty
   */
  public Optional<T> tryNext() {
    return Optional.ofNullable(queue.poll());
  }

  /** Closes the queue. Idempotent. Buffered items stay available through {@link #tryNext()}. */
  public void close() {
    if (closed.compareAndSet(false, true)) {
      log.debug("Relay queue closed with {} buffered items", queue.size());
      metrics.observe("relay.queue.depth", queue.size());
    }
  }

  /**
   * Indicates whether {@link #close()} was called.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Returns the number of buffered items.
   *
   * @return current depth
   */
  public int size() {
    return queue.size();
  }

  /**
   * Returns the fixed capacity.
   *
   * @return capacity
   */
  public int capacity() {
    return capacity;
  }

  /**
   * Returns the total number of dropped items since creation.
   *
   * @return drop count
   */
  public long droppedCount() {
    return dropped.get();
  }

  private void logDrop(long count) {
    // full-queue drops are steady-state backpressure, not faults
    if (count == 1 || count % DROP_LOG_INTERVAL == 0) {
      log.warn("Relay queue full (capacity={}); dropped {} item(s) so far", capacity, count);
    }
  }

  private void updateHighWater(int depth) {
    int previous;
    do {
      previous = highWaterMark.get();
      if (depth <= previous) {
        return;
      }
    } while (!highWaterMark.compareAndSet(previous, depth));
    metrics.observe("relay.queue.highWater", depth);
  }
}
