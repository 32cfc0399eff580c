package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.infrastructure.process.JvmShutdownSignals;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Beacon CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: beacon <start|worker|send> [options]";
  private static final String HELP_TEXT = """
      Beacon agent relay

      Usage:
        beacon <command> [options]

      Commands:
        start     Launch the relay daemon in the background
        worker    Run the relay daemon in the foreground
        send      Write diagnostic frames to a running daemon

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    exitJvm(run(args));
  }

  /**
   * Terminates the JVM with the given code. The code is published first so a shutdown hook that is
   * already running halts with it. When a termination signal already started JVM shutdown,
   * {@link System#exit(int)} would block behind the shutdown hooks, so the process halts instead.
   *
   * @param exit exit code
   */
  static void exitJvm(ExitCode exit) {
    JvmShutdownSignals.exitDecided(exit.code());
    if (JvmShutdownSignals.shutdownInProgress()) {
      Runtime.getRuntime().halt(exit.code());
    }
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0] == null ? "" : args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);

    return switch (command) {
      case "start" -> StartCli.run(delegateArgs);
      case "worker" -> WorkerCli.run(delegateArgs);
      case "send" -> SendCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled for dispatcher");
        yield run(delegateArgs);
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
