package ca.gc.cra.beacon.infrastructure.lock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.port.ProcessLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSingletonGuardTest {
  @TempDir Path tempDir;

  @Test
  void writesPidAndReleasesOnClose() throws Exception {
    Path pidFile = tempDir.resolve("run/beacon.pid");
    ProcessLock.Outcome outcome = new FileSingletonGuard(4242).acquire(pidFile);

    assertEquals(ProcessLock.Status.LOCKED, outcome.status());
    assertEquals("4242", Files.readString(pidFile, StandardCharsets.US_ASCII).trim());
    outcome.held().close();
    outcome.held().close();

    ProcessLock.Outcome again = new FileSingletonGuard(4243).acquire(pidFile);
    assertEquals(ProcessLock.Status.LOCKED, again.status());
    again.held().close();
  }

  @Test
  void secondAcquireReportsOwnerWithoutRewritingFile() throws Exception {
    Path pidFile = tempDir.resolve("beacon.pid");
    ProcessLock.Outcome first = new FileSingletonGuard(100).acquire(pidFile);
    try {
      ProcessLock.Outcome second = new FileSingletonGuard(200).acquire(pidFile);

      assertEquals(ProcessLock.Status.ALREADY_RUNNING, second.status());
      assertEquals(OptionalLong.of(100), second.ownerPid());
      assertEquals("100", Files.readString(pidFile, StandardCharsets.US_ASCII).trim());
    } finally {
      first.held().close();
    }
  }

  @Test
  void rejectedAcquireInSameJvmKeepsLockHeldAgainstOtherProcesses() throws Exception {
    Path pidFile = tempDir.resolve("beacon.pid");
    ProcessLock.Outcome first = new FileSingletonGuard(100).acquire(pidFile);
    try {
      assertEquals(LockContender.ALREADY_RUNNING, LockContender.contend(pidFile));

      ProcessLock.Outcome second = new FileSingletonGuard(200).acquire(pidFile);
      ProcessLock.Outcome third = new FileSingletonGuard(300).acquire(tempDir.resolve("./beacon.pid"));
      assertEquals(ProcessLock.Status.ALREADY_RUNNING, second.status());
      assertEquals(ProcessLock.Status.ALREADY_RUNNING, third.status());

      assertEquals(LockContender.ALREADY_RUNNING, LockContender.contend(pidFile));
    } finally {
      first.held().close();
    }
    assertEquals(LockContender.LOCKED, LockContender.contend(pidFile));
  }

  @Test
  void unusableLocationIsIoError() throws Exception {
    Path blocker = tempDir.resolve("file");
    Files.writeString(blocker, "x");

    ProcessLock.Outcome outcome = new FileSingletonGuard(1).acquire(blocker.resolve("beacon.pid"));

    assertEquals(ProcessLock.Status.IO_ERROR, outcome.status());
    assertFalse(outcome.ownerPid().isPresent());
    assertTrue(outcome.cause() != null);
  }
}
