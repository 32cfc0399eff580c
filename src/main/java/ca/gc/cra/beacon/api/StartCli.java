package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.config.DaemonConfig;
import ca.gc.cra.beacon.infrastructure.process.DetachedWorkerLauncher;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the daemon configuration, spawns a detached worker, and returns immediately.
 *
 * @since 0.1.0
 */
public final class StartCli {
  private static final Logger log = LoggerFactory.getLogger(StartCli.class);
  static final String MODE = "start";
  private static final String SUMMARY_USAGE =
      "usage: start [config=PATH] [worker options] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      Beacon launcher

      Usage:
        start [worker options]

      Spawns 'worker' as a background JVM with the same options and exits. The worker
      writes stdout/stderr to <runtimeDir>/worker.out and reports this launcher's parent
      process as hostPid unless hostPid= is given. See 'worker --help' for options.

      Options:
        --dry-run   Print the worker command line without starting it
        --verbose   Enable DEBUG logging here and in the worker
        --help      Show this message
      """;

  private StartCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    Main.exitJvm(run(args));
  }

  /**
   * Runs the launcher.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, new DetachedWorkerLauncher());
  }

  static ExitCode run(String[] args, DetachedWorkerLauncher launcher) {
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

    DaemonConfig config;
    try {
      TelemetryConfigurator.configureMetrics(effective);
      config = DaemonConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid worker configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<String> workerArgs = new ArrayList<>(Arrays.asList(input.keyValueArgs()));
    if (input.verbose()) {
      workerArgs.add("--verbose");
    }

    if (input.hasFlag("--dry-run")) {
      OptionalLong hostPid = ProcessHandle.current().parent()
          .map(parent -> OptionalLong.of(parent.pid()))
          .orElse(OptionalLong.empty());
      CliPrinter.printLines(
          "Start dry-run: no worker will be launched.",
          " Command : " + String.join(" ", launcher.command(workerArgs, hostPid)),
          " Output  : " + config.workerOutputFile());
      return ExitCode.SUCCESS;
    }

    try {
      long pid = launcher.launch(workerArgs, config.workerOutputFile());
      CliPrinter.println("Worker started (pid " + pid + "); socket " + config.socketPath());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to launch worker", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure launching worker", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
