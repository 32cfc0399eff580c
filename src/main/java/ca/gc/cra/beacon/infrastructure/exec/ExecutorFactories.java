package ca.gc.cra.beacon.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the daemon's named thread pools.
 */
public final class ExecutorFactories {
  private static final long CONNECTION_KEEP_ALIVE_SECONDS = 60L;

  private ExecutorFactories() {}

  /**
   * Builds the pool that runs one decode loop per producer connection. {@code coreThreads} stay
   * warm; bursts grow the pool up to {@code maxThreads}; beyond that submissions are rejected so the
   * listener can refuse the connection instead of queueing it.
   *
   * @param coreThreads warm worker threads; at least 1
   * @param maxThreads hard cap on concurrent connections; at least {@code coreThreads}
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newConnectionPool(
      int coreThreads, int maxThreads, String prefix, UncaughtExceptionHandler handler) {
    if (coreThreads <= 0) {
      throw new IllegalArgumentException("coreThreads must be positive");
    }
    if (maxThreads < coreThreads) {
      throw new IllegalArgumentException("maxThreads must be >= coreThreads");
    }
    ThreadFactory factory = namedFactory(defaultPrefix(prefix, "beacon-conn"), true, handler);
    return new ThreadPoolExecutor(
        coreThreads,
        maxThreads,
        CONNECTION_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-thread executor for a long-running task such as the reporter.
   *
   * @param name thread name
   * @param handler uncaught exception handler
   * @return executor
   */
  public static ExecutorService newSingleThreadExecutor(String name, UncaughtExceptionHandler handler) {
    String threadName = defaultPrefix(name, "beacon-task");
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    return Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, threadName);
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    });
  }

  /**
   * Builds a single-thread scheduler with daemon threads.
   *
   * @param name thread name
   * @return scheduler
   */
  public static ScheduledExecutorService newScheduler(String name) {
    String threadName = defaultPrefix(name, "beacon-scheduler");
    return Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, threadName);
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Creates a named daemon thread for a dedicated loop (e.g., the accept loop).
   *
   * @param name thread name
   * @param task loop body
   * @return unstarted thread
   */
  public static Thread newLoopThread(String name, Runnable task) {
    Thread thread = new Thread(Objects.requireNonNull(task, "task"), defaultPrefix(name, "beacon-loop"));
    thread.setDaemon(true);
    return thread;
  }

  private static ThreadFactory namedFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  private static String defaultPrefix(String value, String fallback) {
    return (value == null || value.isBlank()) ? fallback : value;
  }
}
