package ca.gc.cra.beacon.application.relay;

/**
 * Result of a non-blocking {@link RelayQueue#tryEnqueue(Object)}.
 *
 * @since 0.1.0
 */
public enum EnqueueOutcome {
  /** The item was accepted. */
  ENQUEUED,
  /** The queue was at capacity; the item was discarded and will not be retried. */
  DROPPED,
  /** The queue has been closed; the caller should stop producing. */
  CLOSED
}
