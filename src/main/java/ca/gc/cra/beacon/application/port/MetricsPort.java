package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Domain port abstracting BEACON metrics emission.
 * <p><strong>Why:</strong> Lets the relay pipeline count drops, frames, and heartbeats without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} discards everything.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every connection thread.</p>
 * <p><strong>Performance:</strong> Calls must never block; they sit on the producer-facing decode path.</p>
 *
 * @implNote Metric keys use dotted names such as {@code relay.dropped} or {@code ipc.frame.malformed}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value (queue depth, bytes, nanoseconds)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
