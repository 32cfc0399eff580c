package ca.gc.cra.beacon.application.port;

import java.io.Closeable;
import java.io.InputStream;

/**
 * One producer session on the local IPC channel.
 * <p>Owned exclusively by the decode loop that handles it.</p>
 *
 * @since 0.1.0
 */
public interface IpcConnection extends Closeable {
  /**
   * Returns a short identifier for logs and MDC.
   *
   * @return connection id
   */
  String id();

  /**
   * Returns the stream frames are read from.
   *
   * @return connection input
   */
  InputStream input();
}
