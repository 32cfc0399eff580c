package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Port for the component that ships relayed telemetry to the observability backend.
 * <p><strong>Why:</strong> Keeps the wire protocol (Kafka, gRPC, ...) outside the daemon core.</p>
 * <p><strong>Contract:</strong> Implementations drive {@link CollectItemConsumer#next()} until it reports
 * closed, then drain {@link CollectItemConsumer#tryNext()} until empty, flush their transport, and
 * return. Any exception thrown is treated as pipeline-fatal and terminates the daemon with a non-zero
 * exit code.</p>
 * <p><strong>Thread-safety:</strong> {@link #report(CollectItemConsumer)} is invoked once, on a dedicated thread.</p>
 *
 * @since 0.1.0
 */
public interface UpstreamReporter {
  /**
   * Streams items from the consumer until the relay closes.
   *
   * @param consumer drain interface over the relay queue
   * @throws Exception when the upstream transport fails irrecoverably
   */
  void report(CollectItemConsumer consumer) throws Exception;

  /**
   * Short name used in logs.
   *
   * @return reporter name
   */
  String name();
}
