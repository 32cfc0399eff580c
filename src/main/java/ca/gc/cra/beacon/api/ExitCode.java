package ca.gc.cra.beacon.api;

/**
 * <strong>What:</strong> Process exit codes shared by the beacon commands.
 * <p><strong>Why:</strong> Supervisors and install scripts branch on these values, so they stay stable.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including shutdown on a termination signal. */
  SUCCESS(0),
  /** The upstream reporter failed and the daemon stopped. */
  PIPELINE_FAILURE(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred, such as an unusable lock file or socket path. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Another daemon already holds the runtime directory. */
  ALREADY_RUNNING(6),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
