package ca.gc.cra.beacon.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep payload previews bounded.
 * <p><strong>Why:</strong> Producer payloads can be megabytes; logs carry at most a short preview.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return truncate(value.getBytes(StandardCharsets.UTF_8), maxBytes);
  }

  /**
   * Decodes UTF-8 bytes for logging, keeping at most {@code maxBytes}.
   *
   * @param bytes UTF-8 payload; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return decoded preview, suffixed with {@code "... (truncated, X of Y)"} when shortened
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(byte[] bytes, int maxBytes) {
    if (bytes == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int keep = Math.min(bytes.length, maxBytes);
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String decoded;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, keep));
      decoded = buffer.toString();
    } catch (CharacterCodingException ex) {
      decoded = new String(bytes, 0, keep, StandardCharsets.UTF_8);
    }
    if (bytes.length <= maxBytes) {
      return decoded;
    }
    return decoded + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }
}
