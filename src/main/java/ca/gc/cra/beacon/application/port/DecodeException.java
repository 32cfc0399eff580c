package ca.gc.cra.beacon.application.port;

/**
 * Failure to decode a single IPC frame.
 * <p>Carries whether the problem was the frame content or the underlying transport so the decode
 * loop can apply its retry policy.</p>
 *
 * @since 0.1.0
 */
public final class DecodeException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Failure categories. */
  public enum Kind {
    /** Frame was read completely but its content is invalid. */
    MALFORMED,
    /** Reading from the connection failed. */
    TRANSPORT
  }

  private final Kind kind;

  /**
   * Creates a decode failure.
   *
   * @param kind failure category
   * @param message description
   * @param cause underlying cause; may be {@code null}
   */
  public DecodeException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Creates a decode failure without a cause.
   *
   * @param kind failure category
   * @param message description
   */
  public DecodeException(Kind kind, String message) {
    this(kind, message, null);
  }

  /**
   * Returns the failure category.
   *
   * @return failure kind
   */
  public Kind kind() {
    return kind;
  }
}
