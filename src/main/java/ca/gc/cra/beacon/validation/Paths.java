package ca.gc.cra.beacon.validation;

import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem path validation for the runtime directory, socket, and lock file.
 * <p><strong>Why:</strong> UNIX-domain socket addresses are limited in length by the kernel, and a path with
 * control characters would produce an unusable socket file.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  /** Conservative upper bound for {@code sun_path} across Linux and macOS. */
  public static final int MAX_SOCKET_PATH_BYTES = 103;

  private Paths() {
    // Utility
  }

  /**
   * Parses and normalizes a filesystem path.
   *
   * @param name parameter name for diagnostics
   * @param raw candidate path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the text is blank, contains control characters, or is not a valid path
   */
  public static Path requireUsablePath(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(sanitized).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + ex.getMessage(), ex);
    }
  }

  /**
   * Ensures a path fits in a UNIX-domain socket address.
   *
   * @param name parameter name for diagnostics
   * @param path socket path
   * @return the same path
   * @throws IllegalArgumentException if the encoded path is too long
   */
  public static Path requireSocketPath(String name, Path path) {
    int length = path.toString().getBytes(StandardCharsets.UTF_8).length;
    if (length > MAX_SOCKET_PATH_BYTES) {
      throw new IllegalArgumentException(
          name + " must be at most " + MAX_SOCKET_PATH_BYTES + " bytes (was " + length + ")");
    }
    return path;
  }
}
