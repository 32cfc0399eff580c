package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void mergesCommonAndModeSections() throws Exception {
    Path file = tempDir.resolve("beacon.yaml");
    Files.writeString(file, """
        common:
          runtimeDir: /tmp/beacon-test
          logLevel: DEBUG
        worker:
          queueCapacity: 128
          logLevel: WARN
          kafka:
            bootstrap: broker:9092
        send:
          kind: METER
        """);

    Map<String, String> worker = YamlConfigLoader.load(file, "worker").orElseThrow();
    assertEquals("/tmp/beacon-test", worker.get("runtimeDir"));
    assertEquals("128", worker.get("queueCapacity"));
    assertEquals("WARN", worker.get("logLevel"));
    assertEquals("broker:9092", worker.get("kafka.bootstrap"));
    assertFalse(worker.containsKey("kind"));

    assertEquals(worker, YamlConfigLoader.load(file, "start").orElseThrow());
    assertEquals("METER", YamlConfigLoader.load(file, "send").orElseThrow().get("kind"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "worker"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = tempDir.resolve("empty.yaml");
    Files.writeString(file, "");

    assertTrue(YamlConfigLoader.load(file, "worker").orElseThrow().isEmpty());
  }

  @Test
  void rejectsArraysAndBrokenYaml() throws Exception {
    Path arrays = tempDir.resolve("arrays.yaml");
    Files.writeString(arrays, "worker:\n  kafkaBootstrap:\n    - a:1\n    - b:2\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "worker"));

    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "worker: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "worker"));
  }
}
