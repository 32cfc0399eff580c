package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.pipeline.ConnectionDecodeLoop;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.relay.RelayQueue;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.ItemKind;
import ca.gc.cra.beacon.infrastructure.ipc.LengthPrefixedFrameDecoder;
import ca.gc.cra.beacon.infrastructure.ipc.UnixSocketListener;
import ca.gc.cra.beacon.testutil.SocketPaths;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SendCliTest {
  private StringWriter buffer;
  private Path dir;

  @BeforeEach
  void setUp() throws Exception {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    dir = SocketPaths.newSocketDir();
  }

  @AfterEach
  void tearDown() throws Exception {
    CliPrinter.clearTestWriter();
    SocketPaths.deleteRecursively(dir);
  }

  @Test
  void sendsFramesToListeningDaemon() throws Exception {
    Path socket = dir.resolve("s.sock");
    RelayQueue<CollectItem> queue = new RelayQueue<>(16, MetricsPort.NO_OP);
    try (UnixSocketListener listener = new UnixSocketListener(1, 2, MetricsPort.NO_OP)) {
      listener.bind(socket);
      ConnectionDecodeLoop loop = new ConnectionDecodeLoop(new LengthPrefixedFrameDecoder(), queue, MetricsPort.NO_OP);
      listener.start(loop::run);

      ExitCode code = SendCli.run(new String[] {
          "socketPath=" + socket, "kind=meter", "payload=cpu=0.5", "count=3"});

      assertEquals(ExitCode.SUCCESS, code);
      assertTrue(buffer.toString().contains("Sent 3 METER frame(s)"));
      List<CollectItem> received = awaitItems(queue, 3);
      assertEquals(ItemKind.METER, received.get(0).kind());
      assertEquals("cpu=0.5", new String(received.get(2).payload(), StandardCharsets.UTF_8));
    }
  }

  @Test
  void unknownKindIsInvalid() {
    ExitCode code = SendCli.run(new String[] {"runtimeDir=" + dir, "kind=TRACE", "payload=x"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: send"));
  }

  @Test
  void emptyTelemetryPayloadIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, SendCli.run(new String[] {"runtimeDir=" + dir, "kind=LOG"}));
  }

  @Test
  void countOutOfRangeIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS,
        SendCli.run(new String[] {"runtimeDir=" + dir, "payload=x", "count=0"}));
  }

  @Test
  void missingDaemonIsIoError() {
    assertEquals(ExitCode.IO_ERROR, SendCli.run(new String[] {"runtimeDir=" + dir, "payload=x"}));
  }

  private static List<CollectItem> awaitItems(RelayQueue<CollectItem> queue, int expected) throws InterruptedException {
    List<CollectItem> items = new ArrayList<>();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (items.size() < expected && System.nanoTime() < deadline) {
      Optional<CollectItem> item = queue.tryNext();
      if (item.isPresent()) {
        items.add(item.get());
      } else {
        TimeUnit.MILLISECONDS.sleep(10);
      }
    }
    assertEquals(expected, items.size());
    return items;
  }
}
