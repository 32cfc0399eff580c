package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.pipeline.LifecycleResult;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class WorkerCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(WorkerCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunPrintsResolvedPlan() {
    ExitCode code = WorkerCli.run(new String[] {
        "runtimeDir=" + tempDir,
        "queueCapacity=64",
        "serviceInstance=svc-1@host",
        "metricsExporter=none",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains(tempDir.resolve("beacon.sock").toString()));
    assertTrue(out.contains("Queue capacity    : 64"));
    assertTrue(out.contains("svc-1@host"));
  }

  @Test
  void yamlValuesApplyUnderCliOverrides() throws Exception {
    Path yaml = tempDir.resolve("beacon.yaml");
    Files.writeString(yaml, """
        common:
          runtimeDir: %s
        worker:
          queueCapacity: 32
          maxConnections: 8
        """.formatted(tempDir));

    ExitCode code = WorkerCli.run(new String[] {
        "config=" + yaml, "maxConnections=16", "metricsExporter=none", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Queue capacity    : 32"));
    assertTrue(out.contains("Max connections   : 16"));
  }

  @Test
  void invalidValueIsRejectedWithUsage() {
    ExitCode code = WorkerCli.run(new String[] {"queueCapacity=0", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: worker"));
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("queueCapacity")));
  }

  @Test
  void kafkaWithoutBootstrapIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, WorkerCli.run(new String[] {"reporter=kafka", "--dry-run"}));
  }

  @Test
  void missingConfigFileIsRejected() {
    ExitCode code = WorkerCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});
    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void lifecycleResultsMapToExitCodes() {
    assertEquals(ExitCode.SUCCESS, WorkerCli.toExitCode(LifecycleResult.STOPPED_BY_SIGNAL));
    assertEquals(ExitCode.SUCCESS, WorkerCli.toExitCode(LifecycleResult.COMPLETED));
    assertEquals(ExitCode.PIPELINE_FAILURE, WorkerCli.toExitCode(LifecycleResult.PIPELINE_FAILED));
    assertEquals(ExitCode.ALREADY_RUNNING, WorkerCli.toExitCode(LifecycleResult.ALREADY_RUNNING));
    assertEquals(ExitCode.IO_ERROR, WorkerCli.toExitCode(LifecycleResult.BIND_FAILED));
    assertEquals(ExitCode.IO_ERROR, WorkerCli.toExitCode(LifecycleResult.LOCK_FAILED));
    assertEquals(ExitCode.RUNTIME_FAILURE, WorkerCli.toExitCode(LifecycleResult.SIGNAL_REGISTRATION_FAILED));
    assertEquals(ExitCode.INTERRUPTED, WorkerCli.toExitCode(LifecycleResult.INTERRUPTED));
  }
}
