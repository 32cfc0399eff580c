package ca.gc.cra.beacon.infrastructure.process;

import ca.gc.cra.beacon.application.port.ShutdownSignals;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ShutdownSignals} adapter that maps SIGTERM and SIGINT to a JVM shutdown hook.
 * <p>The hook runs the callback on the {@code beacon-shutdown} thread and the JVM waits for it, so the
 * callback may block until the daemon has flushed and released its resources.</p>
 * <p>Once the callback returns, the hook keeps the JVM alive until the main thread publishes the exit code
 * through {@link #exitDecided(int)} and then halts with that code. Returning earlier would let the JVM
 * finish shutdown with the signal status.</p>
 *
 * @since 0.1.0
 */
public final class JvmShutdownSignals implements ShutdownSignals {
  private static final Logger log = LoggerFactory.getLogger(JvmShutdownSignals.class);

  static final Duration EXIT_HANDOFF_TIMEOUT = Duration.ofSeconds(30);

  private static volatile boolean shutdownInProgress;
  private static volatile int decidedExitCode;
  private static final CountDownLatch EXIT_DECIDED = new CountDownLatch(1);

  private final Runtime runtime;
  private Thread hook;

  /** Creates an adapter over the current runtime. */
  public JvmShutdownSignals() {
    this(Runtime.getRuntime());
  }

  JvmShutdownSignals(Runtime runtime) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
  }

  @Override
  public synchronized void register(Runnable onSignal) {
    Objects.requireNonNull(onSignal, "onSignal");
    if (hook != null) {
      throw new IllegalStateException("Shutdown handler already registered");
    }
    Thread candidate = new Thread(() -> {
      shutdownInProgress = true;
      log.info("Termination signal received");
      onSignal.run();
      awaitExitCode(EXIT_HANDOFF_TIMEOUT).ifPresent(runtime::halt);
    }, "beacon-shutdown");
    try {
      runtime.addShutdownHook(candidate);
    } catch (IllegalArgumentException | SecurityException ex) {
      throw new IllegalStateException("Unable to install shutdown handler", ex);
    }
    hook = candidate;
  }

  /**
   * Reports whether a registered hook has started running, meaning the JVM is already shutting down.
   *
   * @return {@code true} once a termination signal was received
   */
  public static boolean shutdownInProgress() {
    return shutdownInProgress;
  }

  /**
   * Publishes the process exit code so a running shutdown hook can halt with it.
   *
   * @param code exit status
   */
  public static void exitDecided(int code) {
    decidedExitCode = code;
    EXIT_DECIDED.countDown();
  }

  static OptionalInt awaitExitCode(Duration timeout) {
    try {
      if (EXIT_DECIDED.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        return OptionalInt.of(decidedExitCode);
      }
      log.warn("Exit code not decided within {} ms; JVM exits with the signal status", timeout.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the exit code");
    }
    return OptionalInt.empty();
  }

  @Override
  public synchronized void unregister() {
    if (hook == null) {
      return;
    }
    Thread registered = hook;
    hook = null;
    if (Thread.currentThread() == registered) {
      return;
    }
    try {
      runtime.removeShutdownHook(registered);
    } catch (IllegalStateException ex) {
      // the JVM is already shutting down and owns the hook
      log.debug("Shutdown in progress; hook stays registered");
    }
  }
}
