package ca.gc.cra.beacon.application.pipeline;

/**
 * How a {@link DaemonLifecycle#run()} ended.
 *
 * @since 0.1.0
 */
public enum LifecycleResult {
  /** A termination signal (or programmatic request) stopped the daemon. */
  STOPPED_BY_SIGNAL,
  /** The reporter returned on its own without error. */
  COMPLETED,
  /** The reporter failed; the daemon's purpose is lost. */
  PIPELINE_FAILED,
  /** Another daemon instance holds the singleton lock. */
  ALREADY_RUNNING,
  /** The singleton lock file could not be opened or locked. */
  LOCK_FAILED,
  /** Termination handlers could not be installed. */
  SIGNAL_REGISTRATION_FAILED,
  /** The IPC socket could not be bound. */
  BIND_FAILED,
  /** The coordinating thread was interrupted. */
  INTERRUPTED
}
