package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.DecodeException;
import ca.gc.cra.beacon.application.port.FrameDecoder;
import ca.gc.cra.beacon.application.port.IpcConnection;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.ReceiveResult;
import ca.gc.cra.beacon.application.relay.EnqueueOutcome;
import ca.gc.cra.beacon.application.relay.RelayQueue;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Receive loop run once per producer connection.
 *
 * <p>Frames are forwarded to the relay queue in arrival order. A malformed frame is logged and
 * skipped so the rest of the session survives; a clean end of stream ends the loop silently; a
 * closed relay ends it because nothing downstream will consume further items. Transport errors are
 * retried like malformed frames, but a run of {@code maxConsecutiveTransportErrors} in a row
 * abandons the connection.</p>
 *
 * <p>Stateless apart from configuration; one instance serves every connection.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionDecodeLoop {
  private static final Logger log = LoggerFactory.getLogger(ConnectionDecodeLoop.class);

  /** Default consecutive transport failures tolerated before a connection is abandoned. */
  public static final int DEFAULT_MAX_CONSECUTIVE_TRANSPORT_ERRORS = 16;

  private final FrameDecoder decoder;
  private final RelayQueue<CollectItem> queue;
  private final MetricsPort metrics;
  private final int maxConsecutiveTransportErrors;

  /** Reasons a decode loop ends. */
  public enum Exit {
    /** Peer closed the connection. */
    END_OF_STREAM,
    /** Relay queue closed during shutdown. */
    RELAY_CLOSED,
    /** Too many consecutive transport failures. */
    TRANSPORT_FAILED
  }

  /**
   * Creates a decode loop with the default transport error budget.
   *
   * @param decoder frame decoder
   * @param queue relay queue receiving decoded items
   * @param metrics metrics sink
   */
  public ConnectionDecodeLoop(FrameDecoder decoder, RelayQueue<CollectItem> queue, MetricsPort metrics) {
    this(decoder, queue, metrics, DEFAULT_MAX_CONSECUTIVE_TRANSPORT_ERRORS);
  }

  /**
   * Creates a decode loop.
   *
   * @param decoder frame decoder
   * @param queue relay queue receiving decoded items
   * @param metrics metrics sink
   * @param maxConsecutiveTransportErrors transport failures in a row before giving up; at least 1
   */
  public ConnectionDecodeLoop(
      FrameDecoder decoder,
      RelayQueue<CollectItem> queue,
      MetricsPort metrics,
      int maxConsecutiveTransportErrors) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (maxConsecutiveTransportErrors < 1) {
      throw new IllegalArgumentException("maxConsecutiveTransportErrors must be positive");
    }
    this.maxConsecutiveTransportErrors = maxConsecutiveTransportErrors;
  }

  /**
   * Runs the loop until the connection ends, then closes it.
   *
   * @param connection producer connection owned by this loop
   * @return why the loop ended
   */
  public Exit run(IpcConnection connection) {
    Objects.requireNonNull(connection, "connection");
    MDC.put("connection", connection.id());
    metrics.increment("ipc.connection.opened");
    log.debug("Entering receive loop");
    try {
      return receiveUntilDone(connection.input());
    } finally {
      closeQuietly(connection);
      metrics.increment("ipc.connection.closed");
      MDC.remove("connection");
    }
  }

  private Exit receiveUntilDone(InputStream in) {
    long received = 0;
    int consecutiveTransportErrors = 0;
    while (true) {
      ReceiveResult result = decoder.receive(in);
      if (result.status() == ReceiveResult.Status.END_OF_STREAM) {
        log.debug("Leaving receive loop after {} frames", received);
        return Exit.END_OF_STREAM;
      }
      if (result.status() == ReceiveResult.Status.ERROR) {
        DecodeException error = result.error();
        if (error.kind() == DecodeException.Kind.TRANSPORT) {
          metrics.increment("ipc.frame.transportError");
          consecutiveTransportErrors++;
          if (consecutiveTransportErrors >= maxConsecutiveTransportErrors) {
            log.error("Abandoning connection after {} consecutive transport errors",
                consecutiveTransportErrors, error);
            return Exit.TRANSPORT_FAILED;
          }
        } else {
          metrics.increment("ipc.frame.malformed");
          consecutiveTransportErrors = 0;
        }
        log.error("Frame receive failed: {}", error.getMessage(), error);
        continue;
      }

      consecutiveTransportErrors = 0;
      received++;
      metrics.increment("ipc.frame.received");
      // try-enqueue: a producer blocked on IPC stalls its own request handling
      EnqueueOutcome outcome = queue.tryEnqueue(result.item());
      if (outcome == EnqueueOutcome.CLOSED) {
        log.debug("Relay closed; leaving receive loop after {} frames", received);
        return Exit.RELAY_CLOSED;
      }
    }
  }

  private static void closeQuietly(IpcConnection connection) {
    try {
      connection.close();
    } catch (IOException ex) {
      log.warn("Failed to close connection {}", connection.id(), ex);
    }
  }
}
