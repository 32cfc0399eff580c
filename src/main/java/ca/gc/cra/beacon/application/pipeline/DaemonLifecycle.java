package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.announce.InstanceAnnouncer;
import ca.gc.cra.beacon.application.port.IpcListener;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.ProcessLock;
import ca.gc.cra.beacon.application.port.ShutdownSignals;
import ca.gc.cra.beacon.application.port.UpstreamReporter;
import ca.gc.cra.beacon.application.relay.RelayQueue;
import ca.gc.cra.beacon.application.relay.RelayQueueConsumer;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Coordinates the daemon from startup to teardown.
 *
 * <p>{@code STARTING}: takes the singleton lock, installs termination handlers, binds the IPC socket,
 * and starts the listener and announcer. {@code RUNNING}: races the reporter against termination
 * signals. {@code SHUTTING_DOWN}: stops the announcer and listener, closes the relay, and gives the
 * reporter up to {@code shutdownTimeout} to flush what is still queued. {@code STOPPED}: the socket
 * file has been removed and the lock released, whatever the cause of shutdown.</p>
 *
 * <p>In-flight decode loops are not cancelled; they end on their own when their producer disconnects
 * or when they find the relay closed. Instances are single use.</p>
 *
 * @since 0.1.0
 */
public final class DaemonLifecycle {
  private static final Logger log = LoggerFactory.getLogger(DaemonLifecycle.class);

  private final Settings settings;
  private final ProcessLock processLock;
  private final IpcListener listener;
  private final ShutdownSignals signals;
  private final UpstreamReporter reporter;
  private final RelayQueue<CollectItem> queue;
  private final InstanceAnnouncer announcer;
  private final ConnectionDecodeLoop decodeLoop;
  private final MetricsPort metrics;

  private final CompletableFuture<Void> shutdownRequested = new CompletableFuture<>();
  private final CountDownLatch running = new CountDownLatch(1);
  private final CountDownLatch stopped = new CountDownLatch(1);
  private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.STARTING);
  private final AtomicReference<Thread> runThread = new AtomicReference<>();

  /**
   * Lifecycle tuning.
   *
   * @param lockFile singleton pid file
   * @param socketPath IPC socket file
   * @param shutdownTimeout how long the reporter may flush after a signal
   */
  public record Settings(Path lockFile, Path socketPath, Duration shutdownTimeout) {
    public Settings {
      Objects.requireNonNull(lockFile, "lockFile");
      Objects.requireNonNull(socketPath, "socketPath");
      shutdownTimeout = Objects.requireNonNullElse(shutdownTimeout, Duration.ofSeconds(10));
      if (shutdownTimeout.isNegative()) {
        throw new IllegalArgumentException("shutdownTimeout must not be negative");
      }
    }
  }

  /**
   * Wires the lifecycle.
   *
   * @param settings paths and timeouts
   * @param processLock singleton lock
   * @param listener IPC listener (unbound)
   * @param signals termination signal source
   * @param reporter upstream reporter
   * @param queue relay queue shared by decode loops, announcer, and reporter
   * @param announcer heartbeat announcer (not yet started)
   * @param decodeLoop per-connection receive loop
   * @param metrics metrics sink
   */
  public DaemonLifecycle(
      Settings settings,
      ProcessLock processLock,
      IpcListener listener,
      ShutdownSignals signals,
      UpstreamReporter reporter,
      RelayQueue<CollectItem> queue,
      InstanceAnnouncer announcer,
      ConnectionDecodeLoop decodeLoop,
      MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.processLock = Objects.requireNonNull(processLock, "processLock");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.signals = Objects.requireNonNull(signals, "signals");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.announcer = Objects.requireNonNull(announcer, "announcer");
    this.decodeLoop = Objects.requireNonNull(decodeLoop, "decodeLoop");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the daemon until a signal arrives or the reporter ends.
   *
   * @return how the daemon ended
   * @throws IllegalStateException if invoked more than once
   */
  public LifecycleResult run() {
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Daemon lifecycle already used");
    }
    MDC.put("daemon", "worker");
    try {
      return startAndRun();
    } finally {
      state.set(LifecycleState.STOPPED);
      running.countDown();
      stopped.countDown();
      log.info("Daemon stopped");
      MDC.remove("daemon");
    }
  }

  private LifecycleResult startAndRun() {
    log.debug("Starting daemon");
    ProcessLock.Outcome lock = processLock.acquire(settings.lockFile());
    switch (lock.status()) {
      case ALREADY_RUNNING -> {
        log.warn("Daemon already running (lock {} held by pid {}); exiting",
            settings.lockFile(),
            lock.ownerPid().isPresent() ? Long.toString(lock.ownerPid().getAsLong()) : "unknown");
        return LifecycleResult.ALREADY_RUNNING;
      }
      case IO_ERROR -> {
        log.error("Unable to acquire daemon lock {}", settings.lockFile(), lock.cause());
        return LifecycleResult.LOCK_FAILED;
      }
      default -> log.info("Acquired daemon lock {} (pid {})", settings.lockFile(), lock.held().pid());
    }

    try (ProcessLock.Held held = lock.held();
        SocketFileCleanup cleanup = new SocketFileCleanup()) {
      try {
        signals.register(this::onSignal);
      } catch (IllegalStateException ex) {
        log.error("Failed to register termination handlers", ex);
        return LifecycleResult.SIGNAL_REGISTRATION_FAILED;
      }
      try {
        return bindAndRun(cleanup);
      } finally {
        signals.unregister();
      }
    }
  }

  private LifecycleResult bindAndRun(SocketFileCleanup cleanup) {
    ExecutorService reporterExecutor =
        ExecutorFactories.newSingleThreadExecutor("beacon-reporter", this::onReporterCrash);
    try {
      try {
        log.debug("Binding IPC socket {}", settings.socketPath());
        listener.bind(settings.socketPath());
      } catch (IOException ex) {
        log.error("Failed to bind IPC socket {}", settings.socketPath(), ex);
        return LifecycleResult.BIND_FAILED;
      }
      cleanup.markCreated(settings.socketPath());
      listener.start(decodeLoop::run);
      announcer.start();

      CompletableFuture<Void> pipeline = CompletableFuture.runAsync(this::runReporter, reporterExecutor);
      state.set(LifecycleState.RUNNING);
      running.countDown();
      log.info("Daemon running; relaying {} to reporter {}", settings.socketPath(), reporter.name());

      boolean interrupted = false;
      try {
        CompletableFuture.anyOf(pipeline, shutdownRequested).get();
      } catch (ExecutionException pipelineFailure) {
        // surfaced below through the pipeline future
        log.debug("Pipeline finished exceptionally");
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        interrupted = true;
      }

      state.set(LifecycleState.SHUTTING_DOWN);
      boolean signalled = shutdownRequested.isDone() && !pipeline.isDone();
      stopProducers();

      if (interrupted) {
        log.warn("Daemon interrupted; shutting down");
        return LifecycleResult.INTERRUPTED;
      }
      if (signalled) {
        log.info("Start to shut down reporter {}", reporter.name());
        awaitFinalFlush(pipeline);
        return LifecycleResult.STOPPED_BY_SIGNAL;
      }
      Throwable failure = failureOf(pipeline);
      if (failure != null) {
        metrics.increment("sink.fatal");
        log.error("Reporter {} failed; daemon exiting", reporter.name(), failure);
        return LifecycleResult.PIPELINE_FAILED;
      }
      log.info("Reporter {} completed", reporter.name());
      return LifecycleResult.COMPLETED;
    } finally {
      stopProducers();
      reporterExecutor.shutdownNow();
    }
  }

  private void runReporter() {
    try {
      reporter.report(new RelayQueueConsumer(queue, metrics));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new CompletionException(ex);
    } catch (Exception ex) {
      throw new CompletionException(ex);
    }
  }

  private void stopProducers() {
    announcer.close();
    listener.close();
    queue.close();
  }

  private void awaitFinalFlush(CompletableFuture<Void> pipeline) {
    long timeoutMillis = settings.shutdownTimeout().toMillis();
    try {
      pipeline.get(timeoutMillis, TimeUnit.MILLISECONDS);
      log.info("Reporter flushed; {} items left unsent", queue.size());
    } catch (TimeoutException ex) {
      log.warn("Reporter still flushing after {} ms; abandoning {} queued items", timeoutMillis, queue.size());
      pipeline.cancel(true);
    } catch (ExecutionException ex) {
      log.error("Reporter failed during final flush", ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for reporter flush");
    }
  }

  private static Throwable failureOf(CompletableFuture<Void> pipeline) {
    if (!pipeline.isCompletedExceptionally()) {
      return null;
    }
    try {
      pipeline.join();
      return null;
    } catch (CompletionException ex) {
      return ex.getCause() != null ? ex.getCause() : ex;
    }
  }

  private void onReporterCrash(Thread thread, Throwable throwable) {
    log.error("Reporter thread {} threw an uncaught exception", thread.getName(), throwable);
  }

  private void onSignal() {
    requestShutdown();
    awaitStopped(settings.shutdownTimeout().plusSeconds(5));
  }

  /**
   * Requests a graceful shutdown, as a termination signal would. Safe to call from any thread.
   */
  public void requestShutdown() {
    if (shutdownRequested.complete(null)) {
      log.info("Shutdown requested");
    }
  }

  /**
   * Waits until the daemon reached {@link LifecycleState#RUNNING} (or ended during startup).
   *
   * @param timeout maximum wait
   * @return {@code true} if the state was reached in time
   */
  public boolean awaitRunning(Duration timeout) {
    return await(running, timeout);
  }

  /**
   * Waits until the daemon reached {@link LifecycleState#STOPPED}.
   *
   * @param timeout maximum wait
   * @return {@code true} if stopped in time
   */
  public boolean awaitStopped(Duration timeout) {
    return await(stopped, timeout);
  }

  /**
   * Returns the current lifecycle state.
   *
   * @return state
   */
  public LifecycleState state() {
    return state.get();
  }

  private static boolean await(CountDownLatch latch, Duration timeout) {
    try {
      return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
