package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StartCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunShowsWorkerCommandAndOutputFile() {
    ExitCode code = StartCli.run(new String[] {
        "runtimeDir=" + tempDir, "hostPid=77", "metricsExporter=none", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("ca.gc.cra.beacon.api.Main worker runtimeDir=" + tempDir));
    assertTrue(out.contains("hostPid=77"));
    assertTrue(out.contains(tempDir.resolve("worker.out").toString()));
  }

  @Test
  void invalidWorkerOptionsAreRejectedBeforeLaunch() {
    ExitCode code = StartCli.run(new String[] {"heartbeatPeriod=-1", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: start"));
  }
}
