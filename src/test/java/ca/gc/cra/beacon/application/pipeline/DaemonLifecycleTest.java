package ca.gc.cra.beacon.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.announce.InstanceAnnouncer;
import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.CollectItemConsumer;
import ca.gc.cra.beacon.application.port.ShutdownSignals;
import ca.gc.cra.beacon.application.port.UpstreamReporter;
import ca.gc.cra.beacon.application.port.UpstreamTransportException;
import ca.gc.cra.beacon.application.relay.RelayQueue;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.InstanceProperties;
import ca.gc.cra.beacon.domain.collect.ItemKind;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.beacon.infrastructure.ipc.LengthPrefixedFrameDecoder;
import ca.gc.cra.beacon.infrastructure.ipc.UnixSocketListener;
import ca.gc.cra.beacon.infrastructure.ipc.UnixSocketProducer;
import ca.gc.cra.beacon.infrastructure.lock.FileSingletonGuard;
import ca.gc.cra.beacon.testutil.RecordingMetricsPort;
import ca.gc.cra.beacon.testutil.SocketPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DaemonLifecycleTest {
  private Path dir;
  private Path socket;
  private Path pidFile;
  private RecordingMetricsPort metrics;
  private RelayQueue<CollectItem> queue;

  @BeforeEach
  void setUp() throws IOException {
    dir = SocketPaths.newSocketDir();
    socket = dir.resolve("d.sock");
    pidFile = dir.resolve("d.pid");
    metrics = new RecordingMetricsPort();
    queue = new RelayQueue<>(32, metrics);
  }

  @AfterEach
  void tearDown() throws IOException {
    SocketPaths.deleteRecursively(dir);
  }

  @Test
  void relaysFramesAndRemovesSocketAfterShutdownRequest() throws Exception {
    CollectingReporter reporter = new CollectingReporter(false);
    DaemonLifecycle lifecycle = lifecycle(reporter, new FileSingletonGuard(7));

    CompletableFuture<LifecycleResult> run = CompletableFuture.supplyAsync(lifecycle::run);
    assertTrue(lifecycle.awaitRunning(Duration.ofSeconds(5)));
    assertEquals(LifecycleState.RUNNING, lifecycle.state());
    assertTrue(Files.exists(socket));

    try (UnixSocketProducer producer = UnixSocketProducer.connect(socket)) {
      producer.send(new CollectItem(ItemKind.SEGMENT, new byte[] {1, 2}));
    }
    assertTrue(waitFor(() -> reporter.kinds().contains(ItemKind.SEGMENT)));

    lifecycle.requestShutdown();
    assertEquals(LifecycleResult.STOPPED_BY_SIGNAL, run.get(10, TimeUnit.SECONDS));
    assertEquals(LifecycleState.STOPPED, lifecycle.state());
    assertFalse(Files.exists(socket));
    assertTrue(reporter.kinds().contains(ItemKind.INSTANCE_PROPERTIES));
  }

  @Test
  void reporterFailureEndsDaemonAndStillRemovesSocket() throws Exception {
    DaemonLifecycle lifecycle = lifecycle(new CollectingReporter(true), new FileSingletonGuard(8));

    LifecycleResult result = CompletableFuture.supplyAsync(lifecycle::run).get(10, TimeUnit.SECONDS);

    assertEquals(LifecycleResult.PIPELINE_FAILED, result);
    assertFalse(Files.exists(socket));
    assertEquals(1, metrics.count("sink.fatal"));
  }

  @Test
  void secondInstanceExitsWithoutBinding() throws Exception {
    FileSingletonGuard guard = new FileSingletonGuard(9);
    var held = guard.acquire(pidFile).held();
    try {
      DaemonLifecycle lifecycle = lifecycle(new CollectingReporter(false), new FileSingletonGuard(10));

      assertEquals(LifecycleResult.ALREADY_RUNNING, lifecycle.run());
      assertFalse(Files.exists(socket));
      assertThrows(IllegalStateException.class, lifecycle::run);
    } finally {
      held.close();
    }
  }

  @Test
  void failedSignalRegistrationStopsStartup() {
    ShutdownSignals broken = new ShutdownSignals() {
      @Override
      public void register(Runnable onSignal) {
        throw new IllegalStateException("shutdown in progress");
      }

      @Override
      public void unregister() {
      }
    };
    DaemonLifecycle lifecycle = lifecycle(new CollectingReporter(false), new FileSingletonGuard(11), broken);

    assertEquals(LifecycleResult.SIGNAL_REGISTRATION_FAILED, lifecycle.run());
    assertFalse(Files.exists(socket));
  }

  private DaemonLifecycle lifecycle(UpstreamReporter reporter, FileSingletonGuard guard) {
    return lifecycle(reporter, guard, new ManualSignals());
  }

  private DaemonLifecycle lifecycle(UpstreamReporter reporter, FileSingletonGuard guard, ShutdownSignals signals) {
    InstanceAnnouncer announcer = new InstanceAnnouncer(
        () -> new InstanceProperties("svc", "svc-1", Map.of(InstanceProperties.KEY_HOST_NAME, "h")),
        queue,
        Duration.ofMillis(50),
        3,
        ExecutorFactories.newScheduler("test-announcer"),
        metrics,
        ClockPort.SYSTEM);
    return new DaemonLifecycle(
        new DaemonLifecycle.Settings(pidFile, socket, Duration.ofSeconds(2)),
        guard,
        new UnixSocketListener(2, 4, metrics),
        signals,
        reporter,
        queue,
        announcer,
        new ConnectionDecodeLoop(new LengthPrefixedFrameDecoder(), queue, metrics),
        metrics);
  }

  private static boolean waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) {
        return true;
      }
      TimeUnit.MILLISECONDS.sleep(10);
    }
    return false;
  }

  private static final class ManualSignals implements ShutdownSignals {
    @Override
    public void register(Runnable onSignal) {
    }

    @Override
    public void unregister() {
    }
  }

  private static final class CollectingReporter implements UpstreamReporter {
    private final List<CollectItem> items = new CopyOnWriteArrayList<>();
    private final boolean fail;

    CollectingReporter(boolean fail) {
      this.fail = fail;
    }

    @Override
    public void report(CollectItemConsumer consumer) throws Exception {
      if (fail) {
        throw new UpstreamTransportException("broker unreachable", null);
      }
      Optional<CollectItem> item;
      while ((item = consumer.next()).isPresent()) {
        items.add(item.get());
      }
      while ((item = consumer.tryNext()).isPresent()) {
        items.add(item.get());
      }
    }

    List<ItemKind> kinds() {
      return items.stream().map(CollectItem::kind).toList();
    }

    @Override
    public String name() {
      return "collecting";
    }
  }
}
