package ca.gc.cra.beacon.api;

/**
 * Ends a CLI run early with a chosen exit code after the failure has been logged.
 */
final class CliAbort extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient ExitCode exitCode;

  CliAbort(ExitCode exitCode) {
    super(null, null, false, false);
    this.exitCode = exitCode;
  }

  ExitCode exitCode() {
    return exitCode;
  }
}
