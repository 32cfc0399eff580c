package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("worker");
    Map<String, String> yaml = Map.of("queueCapacity", "512", "serviceName", "checkout");
    Map<String, String> cli = Map.of("queueCapacity", "1024");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "worker", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("1024", merged.get("queueCapacity"));
    assertEquals("checkout", merged.get("serviceName"));
    assertEquals("30", merged.get("heartbeatPeriod"));
    assertEquals(List.of("CLI overrides YAML for key: queueCapacity"), warnings);
  }

  @Test
  void kafkaReporterRequiresBootstrapInDaemonModes() {
    Map<String, String> cli = Map.of("reporter", "kafka");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "start", Optional.empty(), cli, DefaultsForMode.asFlatMap("start"), msg -> { }));
  }

  @Test
  void sendModeSkipsDaemonValidation() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "send", Optional.empty(), Map.of("reporter", "kafka"), DefaultsForMode.asFlatMap("send"), msg -> { });

    assertEquals("LOG", merged.get("kind"));
    assertEquals("1", merged.get("count"));
  }

  @Test
  void defaultsAreModeSpecific() {
    assertTrue(DefaultsForMode.asFlatMap("worker").containsKey("queueCapacity"));
    assertTrue(DefaultsForMode.asFlatMap("send").containsKey("payload"));
    assertTrue(DefaultsForMode.asFlatMap("send").containsKey("runtimeDir"));
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
