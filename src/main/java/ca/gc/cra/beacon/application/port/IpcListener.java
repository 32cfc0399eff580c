package ca.gc.cra.beacon.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Local IPC server accepting producer connections.
 * <p><strong>Contract:</strong> {@link #bind(Path)} removes a stale socket file, binds, and widens
 * permissions so any local producer can connect. {@link #start(Consumer)} accepts connections until
 * {@link #close()} and runs the handler for each connection on its own task. Accept failures are
 * logged and never stop the listener.</p>
 *
 * @since 0.1.0
 */
public interface IpcListener extends AutoCloseable {
  /**
   * Binds the listening socket.
   *
   * @param socketPath socket file location
   * @throws IOException if the socket cannot be bound after stale-file cleanup
   */
  void bind(Path socketPath) throws IOException;

  /**
   * Starts accepting connections in the background.
   *
   * @param handler invoked once per accepted connection on a dedicated task; runs until the connection ends
   * @throws IllegalStateException if the listener is not bound or already started
   */
  void start(Consumer<IpcConnection> handler);

  /** Stops accepting new connections. Existing connections are left to finish on their own. */
  @Override
  void close();
}
