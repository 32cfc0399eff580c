package ca.gc.cra.beacon.infrastructure.ipc;

import ca.gc.cra.beacon.application.port.IpcConnection;
import ca.gc.cra.beacon.application.port.IpcListener;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> UNIX-domain socket server that hands each producer connection to its own decode task.
 * <p><strong>Role:</strong> Infrastructure adapter for {@link IpcListener}.</p>
 * <p><strong>Behaviour:</strong>
 * <ul>
 *   <li>{@link #bind(Path)} removes a stale socket file, binds, and opens permissions to {@code rwxrwxrwx}.</li>
 *   <li>The accept loop runs on {@code beacon-accept}; connections run on the {@code beacon-conn-*} pool
 *   whose core size is the configured worker thread count.</li>
 *   <li>Accept failures are logged and the loop continues after a short pause. A saturated pool
 *   refuses the connection by closing it.</li>
 * </ul>
 * <p><strong>Observability:</strong> Counts {@code ipc.accept.error} and {@code ipc.connection.rejected}.</p>
 *
 * @since 0.1.0
 */
public final class UnixSocketListener implements IpcListener {
  private static final Logger log = LoggerFactory.getLogger(UnixSocketListener.class);
  private static final String SOCKET_PERMISSIONS = "rwxrwxrwx";
  private static final long ACCEPT_ERROR_PAUSE_MILLIS = 50L;

  private final int workerThreads;
  private final int maxConnections;
  private final MetricsPort metrics;
  private final AtomicLong connectionSeq = new AtomicLong();

  private volatile boolean closed;
  private ServerSocketChannel server;
  private Path socketPath;
  private ThreadPoolExecutor connectionPool;
  private Thread acceptThread;

  /**
   * Creates an unbound listener.
   *
   * @param workerThreads warm connection threads; at least 1
   * @param maxConnections concurrent connection cap; at least {@code workerThreads}
   * @param metrics metrics sink
   */
  public UnixSocketListener(int workerThreads, int maxConnections, MetricsPort metrics) {
    if (workerThreads < 1) {
      throw new IllegalArgumentException("workerThreads must be positive");
    }
    this.workerThreads = workerThreads;
    this.maxConnections = Math.max(workerThreads, maxConnections);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public synchronized void bind(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (server != null) {
      throw new IllegalStateException("Listener already bound to " + socketPath);
    }
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    removeStaleSocket(path);

    ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
    try {
      channel.bind(UnixDomainSocketAddress.of(path));
    } catch (IOException ex) {
      channel.close();
      throw ex;
    }
    this.server = channel;
    this.socketPath = path;
    widenPermissions(path);
    log.info("Bound IPC socket {}", path);
  }

  @Override
  public synchronized void start(Consumer<IpcConnection> handler) {
    Objects.requireNonNull(handler, "handler");
    if (server == null) {
      throw new IllegalStateException("Listener is not bound");
    }
    if (acceptThread != null) {
      throw new IllegalStateException("Listener already started");
    }
    connectionPool = ExecutorFactories.newConnectionPool(
        workerThreads, maxConnections, "beacon-conn", this::onConnectionCrash);
    acceptThread = ExecutorFactories.newLoopThread("beacon-accept", () -> acceptLoop(server, handler));
    acceptThread.start();
    log.debug("Accepting connections on {} ({} warm threads, {} max)", socketPath, workerThreads, maxConnections);
  }

  private void acceptLoop(ServerSocketChannel channel, Consumer<IpcConnection> handler) {
    while (!closed) {
      SocketChannel accepted;
      try {
        accepted = channel.accept();
      } catch (ClosedChannelException ex) {
        if (!closed) {
          log.error("IPC socket closed unexpectedly; accept loop stopping", ex);
        }
        return;
      } catch (IOException ex) {
        metrics.increment("ipc.accept.error");
        log.error("Accept failed", ex);
        pauseAfterError();
        continue;
      }
      dispatch(accepted, handler);
    }
  }

  private void dispatch(SocketChannel accepted, Consumer<IpcConnection> handler) {
    UnixSocketConnection connection =
        new UnixSocketConnection("conn-" + connectionSeq.incrementAndGet(), accepted);
    try {
      connectionPool.execute(() -> handler.accept(connection));
    } catch (RejectedExecutionException ex) {
      metrics.increment("ipc.connection.rejected");
      log.warn("Refusing connection {}: {} connections already active", connection.id(), maxConnections);
      try {
        connection.close();
      } catch (IOException closeFailure) {
        log.debug("Failed to close refused connection {}", connection.id(), closeFailure);
      }
    }
  }

  private void pauseAfterError() {
    try {
      TimeUnit.MILLISECONDS.sleep(ACCEPT_ERROR_PAUSE_MILLIS);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      closed = true;
    }
  }

  /**
   * Returns the bound socket path.
   *
   * @return socket path or {@code null} when unbound
   */
  public synchronized Path socketPath() {
    return socketPath;
  }

  /**
   * Returns the number of connection tasks currently running.
   *
   * @return active connections
   */
  public synchronized int activeConnections() {
    return connectionPool == null ? 0 : connectionPool.getActiveCount();
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (server != null) {
      try {
        server.close();
      } catch (IOException ex) {
        log.warn("Failed to close IPC socket {}", socketPath, ex);
      }
    }
    if (connectionPool != null) {
      // in-flight decode loops finish on their own
      connectionPool.shutdown();
    }
    log.debug("IPC listener closed");
  }

  private void onConnectionCrash(Thread thread, Throwable throwable) {
    log.error("Connection thread {} threw an uncaught exception", thread.getName(), throwable);
  }

  private static void removeStaleSocket(Path path) {
    if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
      return;
    }
    try {
      Files.delete(path);
      log.info("Removed stale socket file {}", path);
    } catch (IOException ex) {
      log.error("Remove socket file failed: {}", path, ex);
    }
  }

  private static void widenPermissions(Path path) {
    try {
      Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(SOCKET_PERMISSIONS));
    } catch (IOException | UnsupportedOperationException ex) {
      log.warn("Unable to widen permissions on socket {}", path, ex);
    }
  }
}
