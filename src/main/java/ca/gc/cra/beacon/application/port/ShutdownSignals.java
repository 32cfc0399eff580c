package ca.gc.cra.beacon.application.port;

/**
 * Source of external termination requests (SIGTERM, SIGINT).
 *
 * @since 0.1.0
 */
public interface ShutdownSignals {
  /**
   * Registers the callback run when a termination signal arrives. The callback may block until
   * the daemon has finished its cleanup.
   *
   * @param onSignal callback invoked at most once
   * @throws IllegalStateException if the handler cannot be installed (e.g., the JVM is already shutting down)
   */
  void register(Runnable onSignal);

  /** Removes the registered callback; a no-op when nothing is registered or the signal already fired. */
  void unregister();
}
