package ca.gc.cra.beacon.infrastructure.lock;

import ca.gc.cra.beacon.application.port.ProcessLock;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProcessLock} backed by an exclusive OS file lock on a PID file.
 * <p><strong>Why:</strong> The lock is released by the kernel when the owning process dies, so a crashed
 * daemon never blocks its successor.</p>
 * <p><strong>Behaviour:</strong> The file is opened without truncation; the previous owner's PID is only
 * overwritten once the lock is held. A lock held by another process, or by this JVM, is reported as
 * {@link ProcessLock.Status#ALREADY_RUNNING} with the recorded owner PID when it can be read.</p>
 * <p>Paths held by this JVM are tracked in a process-wide registry that is consulted before any channel is
 * opened: closing a second descriptor to a locked file drops the process's POSIX lock.</p>
 *
 * @since 0.1.0
 */
public final class FileSingletonGuard implements ProcessLock {
  private static final Logger log = LoggerFactory.getLogger(FileSingletonGuard.class);
  private static final Map<Path, Long> HELD_IN_JVM = new ConcurrentHashMap<>();

  private final long pid;

  /** Creates a guard that records the current process id. */
  public FileSingletonGuard() {
    this(ProcessHandle.current().pid());
  }

  /**
   * Creates a guard that records the supplied process id.
   *
   * @param pid pid written into the lock file
   */
  public FileSingletonGuard(long pid) {
    this.pid = pid;
  }

  @Override
  public Outcome acquire(Path lockPath) {
    Objects.requireNonNull(lockPath, "lockPath");
    Path key;
    try {
      key = registryKey(lockPath);
    } catch (IOException ex) {
      return Outcome.ioError(ex);
    }
    Long holder = HELD_IN_JVM.putIfAbsent(key, pid);
    if (holder != null) {
      log.debug("Singleton lock {} already held in this JVM by pid {}", key, holder);
      return Outcome.alreadyRunning(OptionalLong.of(holder));
    }
    Outcome outcome = lockFile(lockPath, key);
    if (outcome.status() != Status.LOCKED) {
      HELD_IN_JVM.remove(key, pid);
    }
    return outcome;
  }

  private Outcome lockFile(Path lockPath, Path key) {
    FileChannel channel;
    try {
      channel = FileChannel.open(
          lockPath, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
    } catch (IOException ex) {
      return Outcome.ioError(ex);
    }

    FileLock lock;
    try {
      lock = channel.tryLock();
    } catch (OverlappingFileLockException ex) {
      // held through a channel this guard did not open; keep the descriptor so the lock survives
      log.warn("Singleton lock {} is held elsewhere in this JVM", lockPath);
      return Outcome.alreadyRunning(readOwner(channel));
    } catch (IOException ex) {
      closeQuietly(channel, lockPath);
      return Outcome.ioError(ex);
    }
    if (lock == null) {
      return alreadyRunning(lockPath, channel);
    }

    try {
      byte[] content = (pid + "\n").getBytes(StandardCharsets.US_ASCII);
      channel.truncate(0);
      channel.write(ByteBuffer.wrap(content), 0);
      channel.force(true);
    } catch (IOException ex) {
      closeQuietly(channel, lockPath);
      return Outcome.ioError(ex);
    }
    log.info("Acquired singleton lock {} for pid {}", lockPath, pid);
    return Outcome.locked(new HeldLock(lockPath, key, pid, channel, lock));
  }

  private static Path registryKey(Path lockPath) throws IOException {
    Path absolute = lockPath.toAbsolutePath().normalize();
    Path parent = absolute.getParent();
    if (parent == null) {
      return absolute;
    }
    Files.createDirectories(parent);
    return parent.toRealPath().resolve(absolute.getFileName());
  }

  private static Outcome alreadyRunning(Path lockPath, FileChannel channel) {
    OptionalLong owner = readOwner(channel);
    closeQuietly(channel, lockPath);
    return Outcome.alreadyRunning(owner);
  }

  private static OptionalLong readOwner(FileChannel channel) {
    try {
      long size = Math.min(channel.size(), 32L);
      ByteBuffer buffer = ByteBuffer.allocate((int) size);
      channel.read(buffer, 0);
      String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.US_ASCII).trim();
      return text.isEmpty() ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(text));
    } catch (IOException | NumberFormatException ex) {
      log.debug("Unable to read lock owner pid", ex);
      return OptionalLong.empty();
    }
  }

  private static void closeQuietly(FileChannel channel, Path lockPath) {
    try {
      channel.close();
    } catch (IOException ex) {
      log.warn("Failed to close lock file {}", lockPath, ex);
    }
  }

  private static final class HeldLock implements Held {
    private final Path path;
    private final Path key;
    private final long pid;
    private final FileChannel channel;
    private final FileLock lock;
    private boolean released;

    HeldLock(Path path, Path key, long pid, FileChannel channel, FileLock lock) {
      this.path = path;
      this.key = key;
      this.pid = pid;
      this.channel = channel;
      this.lock = lock;
    }

    @Override
    public Path path() {
      return path;
    }

    @Override
    public long pid() {
      return pid;
    }

    @Override
    public synchronized void close() {
      if (released) {
        return;
      }
      released = true;
      try {
        lock.release();
      } catch (IOException ex) {
        log.warn("Failed to release singleton lock {}", path, ex);
      }
      closeQuietly(channel, path);
      HELD_IN_JVM.remove(key, pid);
      log.debug("Released singleton lock {}", path);
    }
  }
}
