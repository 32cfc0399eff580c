package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.config.ConfigMerger;
import ca.gc.cra.beacon.config.DefaultsForMode;
import ca.gc.cra.beacon.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the effective settings for a command from CLI arguments, an optional {@code config=} YAML file, and
 * the mode defaults.
 */
final class ConfigResolver {
  private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

  private ConfigResolver() {}

  /**
   * Parses and merges configuration, logging and printing usage on failure.
   *
   * @param mode command name
   * @param input parsed CLI input
   * @param usage one-line usage printed on invalid input
   * @return mutable effective configuration map
   * @throws CliAbort with {@link ExitCode#INVALID_ARGS} or {@link ExitCode#IO_ERROR}
   */
  static Map<String, String> resolve(String mode, CliInput input, String usage) throws CliAbort {
    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    Optional<Map<String, String>> yaml = loadYaml(mode, ConfigCliUtils.extractConfigPath(cliKv), usage);
    try {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
      return new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(mode, yaml, cliKv, defaults, log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static Optional<Map<String, String>> loadYaml(String mode, String configPath, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }
}
