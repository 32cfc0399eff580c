package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class DaemonConfigTest {

  @Test
  void defaultsDeriveFilesFromRuntimeDir() {
    DaemonConfig config = DaemonConfig.defaults();

    assertEquals(DaemonConfig.DEFAULT_RUNTIME_DIR, config.runtimeDir());
    assertEquals(DaemonConfig.DEFAULT_RUNTIME_DIR.resolve("beacon.sock"), config.socketPath());
    assertEquals(DaemonConfig.DEFAULT_RUNTIME_DIR.resolve("beacon.pid"), config.pidFile());
    assertEquals(255, config.queueCapacity());
    assertEquals(Duration.ofSeconds(30), config.heartbeatPeriod());
    assertEquals(10, config.propertiesReportPeriodFactor());
    assertEquals(ReporterType.LOG, config.reporter());
    assertEquals("hello-beacon", config.serviceName());
    assertTrue(config.serviceInstance().contains("@"));
    assertTrue(config.effectiveWorkerThreads() >= 1);
    assertEquals(OptionalLong.empty(), config.hostPid());
  }

  @Test
  void explicitValuesOverrideDefaults() {
    Map<String, String> args = new HashMap<>();
    args.put("runtimeDir", "/var/run/beacon");
    args.put("socketPath", "/tmp/custom.sock");
    args.put("workerThreads", "4");
    args.put("queueCapacity", "1000");
    args.put("heartbeatPeriod", "5");
    args.put("propertiesReportPeriodFactor", "3");
    args.put("serviceInstance", "svc-1@host");
    args.put("hostPid", "4321");
    args.put("reporter", "KAFKA");
    args.put("kafkaBootstrap", "broker:9092");
    args.put("logFile", "/var/log/beacon.log");
    args.put("unknownKey", "ignored");

    DaemonConfig config = DaemonConfig.fromMap(args);

    assertEquals(Path.of("/var/run/beacon/beacon.pid"), config.pidFile());
    assertEquals(Path.of("/tmp/custom.sock"), config.socketPath());
    assertEquals(4, config.effectiveWorkerThreads());
    assertEquals(1000, config.queueCapacity());
    assertEquals(Duration.ofSeconds(5), config.heartbeatPeriod());
    assertEquals(3, config.propertiesReportPeriodFactor());
    assertEquals("svc-1@host", config.serviceInstance());
    assertEquals(OptionalLong.of(4321), config.hostPid());
    assertEquals(ReporterType.KAFKA, config.reporter());
    assertEquals(Optional.of("broker:9092"), config.kafkaBootstrap());
    assertEquals(Optional.of(Path.of("/var/log/beacon.log")), config.logFile());
    assertEquals(Path.of("/var/run/beacon/worker.out"), config.workerOutputFile());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> DaemonConfig.fromMap(Map.of("queueCapacity", "0")));
    assertThrows(IllegalArgumentException.class, () -> DaemonConfig.fromMap(Map.of("queueCapacity", "65537")));
    assertThrows(IllegalArgumentException.class, () -> DaemonConfig.fromMap(Map.of("heartbeatPeriod", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> DaemonConfig.fromMap(Map.of("propertiesReportPeriodFactor", "0")));
    assertThrows(IllegalArgumentException.class, () -> DaemonConfig.fromMap(Map.of("logLevel", "chatty")));
    assertThrows(IllegalArgumentException.class, () -> DaemonConfig.fromMap(Map.of("reporter", "grpc")));
  }

  @Test
  void kafkaReporterRequiresBootstrap() {
    assertThrows(IllegalArgumentException.class, () -> DaemonConfig.fromMap(Map.of("reporter", "kafka")));
  }

  @Test
  void socketPathMustFitAddressLimit() {
    String deep = "/tmp/" + "d".repeat(120);
    assertThrows(IllegalArgumentException.class, () -> DaemonConfig.fromMap(Map.of("runtimeDir", deep)));
  }
}
