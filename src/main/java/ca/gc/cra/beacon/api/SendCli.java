package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.config.DaemonConfig;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.ItemKind;
import ca.gc.cra.beacon.infrastructure.ipc.UnixSocketProducer;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import ca.gc.cra.beacon.validation.Numbers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostic producer: connects to a running daemon and writes frames.
 *
 * @since 0.1.0
 */
public final class SendCli {
  private static final Logger log = LoggerFactory.getLogger(SendCli.class);
  static final String MODE = "send";
  private static final int MAX_COUNT = 100_000;
  private static final String SUMMARY_USAGE =
      "usage: send payload=TEXT [kind=SEGMENT|METER|LOG|INSTANCE_PROPERTIES|KEEP_ALIVE] [count=N] "
          + "[runtimeDir=DIR|socketPath=PATH]";
  private static final String HELP_TEXT = """
      Beacon send (diagnostic producer)

      Usage:
        send payload=TEXT [options]

      Options:
        kind=KIND          Item kind (default LOG)
        payload=TEXT       UTF-8 payload; may be empty only for KEEP_ALIVE
        count=N            Frames to send (default 1, max 100000)
        runtimeDir=DIR     Runtime directory of the target daemon
        socketPath=PATH    Socket of the target daemon (default <runtimeDir>/beacon.sock)
        config=PATH        YAML file with common/send sections
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;

  private SendCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    Main.exitJvm(run(args));
  }

  /**
   * Sends frames and returns an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> effective;
    try {
      effective = ConfigResolver.resolve(MODE, input, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }
    boolean verbose = input.verbose() || ConfigCliUtils.parseBoolean(effective, "verbose", false);
    if (verbose && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path socketPath;
    CollectItem item;
    int count;
    try {
      socketPath = DaemonConfig.fromMap(effective).socketPath();
      ItemKind kind = ItemKind.valueOf(effective.getOrDefault("kind", "LOG").trim().toUpperCase(Locale.ROOT));
      item = new CollectItem(kind, effective.getOrDefault("payload", "").getBytes(StandardCharsets.UTF_8));
      count = Numbers.parseIntInRange("count", effective.getOrDefault("count", "1"), 1, MAX_COUNT);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid send arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (UnixSocketProducer producer = UnixSocketProducer.connect(socketPath)) {
      for (int i = 0; i < count; i++) {
        producer.send(item);
      }
      CliPrinter.println("Sent " + count + " " + item.kind() + " frame(s) to " + socketPath);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to send to {}: {}", socketPath, ex.getMessage());
      return ExitCode.IO_ERROR;
    }
  }
}
