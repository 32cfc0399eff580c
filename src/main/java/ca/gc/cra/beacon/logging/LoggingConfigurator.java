package ca.gc.cra.beacon.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures daemon logging from CLI and YAML settings.
 * <p><strong>Why:</strong> The worker runs detached from any terminal, so operators pick its verbosity and
 * destination file at launch instead of editing {@code logback.xml}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Adjust the root level, including {@code OFF}.</li>
 *   <li>Attach a file appender for the worker log.</li>
 *   <li>Warn when the backend does not support dynamic configuration.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for the single bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");
  static final String FILE_APPENDER_NAME = "BEACON_FILE";
  private static final String FILE_PATTERN =
      "%d{yyyy-MM-dd'T'HH:mm:ss.SSSXXX} %-5level [%thread] %logger{36} %X{connection} - %msg%n";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG.
   */
  public static void enableVerboseLogging() {
    setRootLevel("DEBUG");
  }

  /**
   * Parses a level name.
   *
   * @param raw level text, case-insensitive
   * @return normalized upper-case level name
   * @throws IllegalArgumentException if the level is unknown
   */
  public static String requireLevel(String raw) {
    String normalized = Objects.requireNonNull(raw, "logLevel").trim().toUpperCase(Locale.ROOT);
    if (!LEVELS.contains(normalized)) {
      throw new IllegalArgumentException("logLevel must be one of " + LEVELS + " (was " + raw + ")");
    }
    return normalized;
  }

  /**
   * Sets the root logger level.
   *
   * @param level level name such as {@code INFO} or {@code OFF}
   * @throws IllegalArgumentException if the level is unknown
   */
  public static void setRootLevel(String level) {
    String normalized = requireLevel(level);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      Level target = Level.toLevel(normalized);
      if (!target.equals(root.getLevel())) {
        root.setLevel(target);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        normalized, factory.getClass().getName());
  }

  /**
   * Appends root logging output to a file. Calling again replaces the previous file appender.
   *
   * @param file log file; parent directories are created by Logback
   */
  public static void attachFileAppender(Path file) {
    Objects.requireNonNull(file, "file");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Log file {} requested but backend {} does not support programmatic appenders",
          file, factory.getClass().getName());
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.detachAppender(FILE_APPENDER_NAME);

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(FILE_PATTERN);
    encoder.start();

    FileAppender<ILoggingEvent> appender = new FileAppender<>();
    appender.setContext(context);
    appender.setName(FILE_APPENDER_NAME);
    appender.setFile(file.toAbsolutePath().toString());
    appender.setAppend(true);
    appender.setPrudent(false);
    appender.setEncoder(encoder);
    appender.start();
    root.addAppender(appender);
    log.debug("Logging to {}", file);
  }
}
