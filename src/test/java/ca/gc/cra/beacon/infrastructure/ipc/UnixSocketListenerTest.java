package ca.gc.cra.beacon.infrastructure.ipc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.pipeline.ConnectionDecodeLoop;
import ca.gc.cra.beacon.application.relay.RelayQueue;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.ItemKind;
import ca.gc.cra.beacon.testutil.RecordingMetricsPort;
import ca.gc.cra.beacon.testutil.SocketPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UnixSocketListenerTest {
  private Path dir;
  private Path socket;
  private RecordingMetricsPort metrics;
  private RelayQueue<CollectItem> queue;
  private UnixSocketListener listener;

  @BeforeEach
  void setUp() throws IOException {
    dir = SocketPaths.newSocketDir();
    socket = dir.resolve("t.sock");
    metrics = new RecordingMetricsPort();
    queue = new RelayQueue<>(64, metrics);
    listener = new UnixSocketListener(2, 4, metrics);
  }

  @AfterEach
  void tearDown() throws IOException {
    listener.close();
    SocketPaths.deleteRecursively(dir);
  }

  @Test
  void bindReplacesStaleFileAndOpensPermissions() throws IOException {
    Files.writeString(socket, "stale");

    listener.bind(socket);

    assertTrue(Files.exists(socket));
    assertEquals("rwxrwxrwx", PosixFilePermissions.toString(Files.getPosixFilePermissions(socket)));
    assertThrows(IllegalStateException.class, () -> listener.bind(socket));
  }

  @Test
  void oneProducerDisconnectingLeavesOthersFlowing() throws Exception {
    listener.bind(socket);
    ConnectionDecodeLoop loop = new ConnectionDecodeLoop(new LengthPrefixedFrameDecoder(), queue, metrics);
    listener.start(loop::run);

    try (UnixSocketProducer steady = UnixSocketProducer.connect(socket)) {
      try (UnixSocketProducer shortLived = UnixSocketProducer.connect(socket)) {
        shortLived.send(new CollectItem(ItemKind.SEGMENT, new byte[] {1}));
      }
      steady.send(new CollectItem(ItemKind.METER, new byte[] {2}));
      steady.sendRaw(new byte[] {0, 0, 0, 2, 0x7F, 0});
      steady.send(new CollectItem(ItemKind.LOG, new byte[] {3}));

      List<ItemKind> kinds = drain(3);
      assertTrue(kinds.contains(ItemKind.SEGMENT));
      assertTrue(kinds.indexOf(ItemKind.METER) < kinds.indexOf(ItemKind.LOG));
    }
    assertTrue(waitFor(() -> metrics.count("ipc.frame.malformed") == 1));
  }

  @Test
  void closeStopsAccepting() throws Exception {
    listener.bind(socket);
    listener.start(connection -> { });
    listener.close();
    listener.close();

    assertFalse(waitFor(() -> canConnect(socket)));
  }

  private List<ItemKind> drain(int expected) throws InterruptedException {
    List<ItemKind> kinds = new ArrayList<>();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (kinds.size() < expected && System.nanoTime() < deadline) {
      Optional<CollectItem> item = queue.tryNext();
      if (item.isPresent()) {
        kinds.add(item.get().kind());
      } else {
        TimeUnit.MILLISECONDS.sleep(10);
      }
    }
    assertEquals(expected, kinds.size());
    return kinds;
  }

  private static boolean canConnect(Path socket) {
    try (UnixSocketProducer producer = UnixSocketProducer.connect(socket)) {
      return true;
    } catch (IOException ex) {
      return false;
    }
  }

  private static boolean waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) {
        return true;
      }
      TimeUnit.MILLISECONDS.sleep(10);
    }
    return condition.getAsBoolean();
  }
}
