package ca.gc.cra.beacon.application.pipeline;

/**
 * States of {@link DaemonLifecycle}. Transitions only move forward.
 *
 * @since 0.1.0
 */
public enum LifecycleState {
  /** Acquiring the lock, binding the socket, starting background tasks. */
  STARTING,
  /** Pipeline racing against termination signals. */
  RUNNING,
  /** Signal received or pipeline finished; stopping tasks and flushing. */
  SHUTTING_DOWN,
  /** Socket file removed; the process may exit. */
  STOPPED
}
