package ca.gc.cra.beacon.application.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped exit action that removes the IPC socket file when the daemon's top-level scope closes.
 *
 * <p>Used with try-with-resources around the whole pipeline so removal runs on normal completion,
 * signal-driven shutdown, and fatal errors alike. Closing before {@link #markCreated(Path)} only
 * logs a warning.</p>
 *
 * @since 0.1.0
 */
public final class SocketFileCleanup implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SocketFileCleanup.class);

  private volatile Path socketFile;
  private volatile boolean closed;

  /**
   * Records the socket file once it has been bound.
   *
   * @param path bound socket file
   */
  public void markCreated(Path path) {
    this.socketFile = path;
  }

  /**
   * Indicates whether the cleanup already ran.
   *
   * @return {@code true} after {@link #close()}
   */
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    Path path = socketFile;
    if (path == null) {
      log.warn("Socket file not created; nothing to remove");
      return;
    }
    log.info("Removing socket file {}", path);
    try {
      if (!Files.deleteIfExists(path)) {
        log.warn("Socket file {} was already absent", path);
      }
    } catch (IOException ex) {
      log.error("Failed to remove socket file {}", path, ex);
    }
  }
}
