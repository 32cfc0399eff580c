package ca.gc.cra.beacon.application.port;

/**
 * Wall-clock abstraction so announcement timestamps are deterministic in tests.
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time.
   *
   * @return milliseconds since the epoch
   */
  long nowMillis();

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
