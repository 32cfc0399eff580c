package ca.gc.cra.beacon.infrastructure.process;

import java.io.File;
import java.io.IOException;
import java.lang.ProcessBuilder.Redirect;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Spawns the daemon as a separate background JVM running the {@code worker} command.
 * <p><strong>Behaviour:</strong> The child runs with the launcher's JVM and class path, reads stdin from the null
 * device, and appends stdout and stderr to a file. The launcher does not wait for it; the worker takes the
 * singleton lock and binds the socket on its own.</p>
 * <p><strong>Host pid:</strong> Unless the caller already passed {@code hostPid=}, the launcher's parent pid is
 * appended so the worker reports the instrumented host process rather than the short-lived launcher.</p>
 *
 * @since 0.1.0
 */
public final class DetachedWorkerLauncher {
  private static final Logger log = LoggerFactory.getLogger(DetachedWorkerLauncher.class);
  static final String MAIN_CLASS = "ca.gc.cra.beacon.api.Main";
  static final String WORKER_COMMAND = "worker";
  private static final File NULL_DEVICE = new File("/dev/null");

  private final String javaExecutable;
  private final String classPath;

  /** Creates a launcher that reuses the current JVM binary and class path. */
  public DetachedWorkerLauncher() {
    this(currentJavaExecutable(), System.getProperty("java.class.path", ""));
  }

  DetachedWorkerLauncher(String javaExecutable, String classPath) {
    this.javaExecutable = Objects.requireNonNull(javaExecutable, "javaExecutable");
    this.classPath = Objects.requireNonNull(classPath, "classPath");
  }

  /**
   * Builds the worker command line.
   *
   * @param workerArgs {@code key=value} arguments forwarded to the worker
   * @param hostPid pid to report as the host process when the arguments do not name one
   * @return command line
   */
  public List<String> command(List<String> workerArgs, OptionalLong hostPid) {
    Objects.requireNonNull(workerArgs, "workerArgs");
    Objects.requireNonNull(hostPid, "hostPid");
    List<String> command = new ArrayList<>();
    command.add(javaExecutable);
    if (!classPath.isBlank()) {
      command.add("-cp");
      command.add(classPath);
    }
    command.add(MAIN_CLASS);
    command.add(WORKER_COMMAND);
    command.addAll(workerArgs);
    boolean hostPidGiven = workerArgs.stream().anyMatch(arg -> arg.trim().startsWith("hostPid="));
    if (!hostPidGiven && hostPid.isPresent()) {
      command.add("hostPid=" + hostPid.getAsLong());
    }
    return List.copyOf(command);
  }

  /**
   * Starts the worker and returns without waiting for it.
   *
   * @param workerArgs {@code key=value} arguments forwarded to the worker
   * @param outputFile file receiving the worker's stdout and stderr
   * @return worker pid
   * @throws IOException if the process cannot be started
   */
  public long launch(List<String> workerArgs, Path outputFile) throws IOException {
    Objects.requireNonNull(outputFile, "outputFile");
    OptionalLong hostPid = ProcessHandle.current().parent()
        .map(parent -> OptionalLong.of(parent.pid()))
        .orElse(OptionalLong.empty());
    Path parent = outputFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    List<String> command = command(workerArgs, hostPid);
    log.debug("Launching worker: {}", command);
    Process process = new ProcessBuilder(command)
        .redirectInput(Redirect.from(NULL_DEVICE))
        .redirectOutput(Redirect.appendTo(outputFile.toFile()))
        .redirectErrorStream(true)
        .start();
    log.info("Worker started with pid {}; output in {}", process.pid(), outputFile);
    return process.pid();
  }

  private static String currentJavaExecutable() {
    return ProcessHandle.current().info().command()
        .orElseGet(() -> Path.of(System.getProperty("java.home"), "bin", "java").toString());
  }
}
