package ca.gc.cra.beacon.application.port;

/**
 * Signals that the upstream transport rejected or lost relayed items. Always pipeline-fatal.
 *
 * @since 0.1.0
 */
public class UpstreamTransportException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception.
   *
   * @param message description
   * @param cause underlying transport failure
   */
  public UpstreamTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
