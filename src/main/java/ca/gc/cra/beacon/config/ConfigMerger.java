package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn receives a message whenever a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("worker") && !normalized.equals("start")) {
      return;
    }
    String reporter = trim(effective.get("reporter"));
    if (reporter.equalsIgnoreCase("kafka") && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when reporter=kafka");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
