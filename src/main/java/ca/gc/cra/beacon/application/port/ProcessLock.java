package ca.gc.cra.beacon.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Process-wide singleton lock backed by a pid file.
 *
 * @since 0.1.0
 */
public interface ProcessLock {
  /**
   * Attempts to take the exclusive lock. Must not mutate the filesystem beyond opening the lock
   * file when another live process already holds it.
   *
   * @param lockPath pid file location
   * @return outcome describing whether the lock is now held
   */
  Outcome acquire(Path lockPath);

  /** Lock held by this process; released on {@link #close()} or process exit. */
  interface Held extends AutoCloseable {
    /**
     * Returns the lock file path.
     *
     * @return lock file
     */
    Path path();

    /**
     * Returns the pid written into the lock file.
     *
     * @return owning pid
     */
    long pid();

    @Override
    void close();
  }

  /** Acquisition statuses. */
  enum Status {
    /** The lock is now held by this process. */
    LOCKED,
    /** Another live process holds the lock. */
    ALREADY_RUNNING,
    /** The lock file could not be opened or locked. */
    IO_ERROR
  }

  /**
   * Result of {@link #acquire(Path)}.
   *
   * @param status acquisition status
   * @param held held lock when {@code LOCKED}
   * @param ownerPid pid recorded by the current holder when {@code ALREADY_RUNNING} and readable
   * @param cause failure when {@code IO_ERROR}
   */
  record Outcome(Status status, Held held, OptionalLong ownerPid, IOException cause) {
    public Outcome {
      Objects.requireNonNull(status, "status");
      ownerPid = ownerPid == null ? OptionalLong.empty() : ownerPid;
    }

    /**
     * Creates a successful outcome.
     *
     * @param held lock now held
     * @return locked outcome
     */
    public static Outcome locked(Held held) {
      return new Outcome(Status.LOCKED, Objects.requireNonNull(held, "held"), OptionalLong.empty(), null);
    }

    /**
     * Creates an outcome for a lock owned by another process.
     *
     * @param ownerPid pid read from the lock file, if any
     * @return already-running outcome
     */
    public static Outcome alreadyRunning(OptionalLong ownerPid) {
      return new Outcome(Status.ALREADY_RUNNING, null, ownerPid, null);
    }

    /**
     * Creates an I/O failure outcome.
     *
     * @param cause underlying failure
     * @return error outcome
     */
    public static Outcome ioError(IOException cause) {
      return new Outcome(Status.IO_ERROR, null, OptionalLong.empty(), Objects.requireNonNull(cause, "cause"));
    }
  }
}
