package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.collect.CollectItem;
import java.util.Objects;

/**
 * Outcome of reading one frame from a producer connection.
 *
 * @param status which of the three outcomes occurred
 * @param item decoded item when {@code status == ITEM}
 * @param error decode failure when {@code status == ERROR}
 * @since 0.1.0
 */
public record ReceiveResult(Status status, CollectItem item, DecodeException error) {
  private static final ReceiveResult END_OF_STREAM = new ReceiveResult(Status.END_OF_STREAM, null, null);

  /** Receive outcomes. */
  public enum Status {
    /** A frame was decoded into an item. */
    ITEM,
    /** The peer closed the connection. */
    END_OF_STREAM,
    /** The frame could not be decoded; the connection may still be usable. */
    ERROR
  }

  public ReceiveResult {
    Objects.requireNonNull(status, "status");
    if (status == Status.ITEM && item == null) {
      throw new IllegalArgumentException("item required for ITEM result");
    }
    if (status == Status.ERROR && error == null) {
      throw new IllegalArgumentException("error required for ERROR result");
    }
  }

  /**
   * Wraps a decoded item.
   *
   * @param item decoded item
   * @return item result
   */
  public static ReceiveResult item(CollectItem item) {
    return new ReceiveResult(Status.ITEM, item, null);
  }

  /**
   * Signals a clean end of stream.
   *
   * @return shared end-of-stream result
   */
  public static ReceiveResult endOfStream() {
    return END_OF_STREAM;
  }

  /**
   * Wraps a decode failure.
   *
   * @param error failure
   * @return error result
   */
  public static ReceiveResult error(DecodeException error) {
    return new ReceiveResult(Status.ERROR, null, error);
  }
}
