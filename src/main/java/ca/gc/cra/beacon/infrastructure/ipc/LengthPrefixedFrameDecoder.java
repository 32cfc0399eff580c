package ca.gc.cra.beacon.infrastructure.ipc;

import ca.gc.cra.beacon.application.port.DecodeException;
import ca.gc.cra.beacon.application.port.FrameDecoder;
import ca.gc.cra.beacon.application.port.ReceiveResult;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.ItemKind;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decodes producer frames of the form {@code u32 length (big-endian) | u8 kind | payload}.
 * <p><strong>Why:</strong> Gives the decode loop three distinct outcomes: an item, a clean end of
 * stream, or a recoverable error.</p>
 * <p><strong>Framing rules:</strong>
 * <ul>
 *   <li>EOF before or inside a frame ends the stream; the peer is gone either way.</li>
 *   <li>A zero length, a length above {@code maxFrameBytes}, an unknown kind tag, or an empty telemetry
 *   payload is {@link DecodeException.Kind#MALFORMED}. Oversized bodies are skipped so the next read
 *   starts on a frame boundary.</li>
 *   <li>Any other {@link IOException} is {@link DecodeException.Kind#TRANSPORT}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; share one instance across connections.</p>
 *
 * @since 0.1.0
 */
public final class LengthPrefixedFrameDecoder implements FrameDecoder {
  private static final Logger log = LoggerFactory.getLogger(LengthPrefixedFrameDecoder.class);

  /** Bytes in the length prefix. */
  public static final int HEADER_BYTES = 4;
  /** Default upper bound on a frame body. */
  public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

  private final int maxFrameBytes;

  /** Creates a decoder with {@link #DEFAULT_MAX_FRAME_BYTES}. */
  public LengthPrefixedFrameDecoder() {
    this(DEFAULT_MAX_FRAME_BYTES);
  }

  /**
   * Creates a decoder.
   *
   * @param maxFrameBytes largest accepted frame body (kind byte plus payload); at least 2
   */
  public LengthPrefixedFrameDecoder(int maxFrameBytes) {
    if (maxFrameBytes < 2) {
      throw new IllegalArgumentException("maxFrameBytes must be at least 2");
    }
    this.maxFrameBytes = maxFrameBytes;
  }

  @Override
  public ReceiveResult receive(InputStream in) {
    try {
      byte[] header = new byte[HEADER_BYTES];
      int headerRead = readFully(in, header);
      if (headerRead < HEADER_BYTES) {
        if (headerRead > 0) {
          log.debug("Peer closed inside a frame header ({} of {} bytes)", headerRead, HEADER_BYTES);
        }
        return ReceiveResult.endOfStream();
      }
      long length = readUnsignedInt(header);
      if (length == 0) {
        return malformed("empty frame");
      }
      if (length > maxFrameBytes) {
        return skipOversized(in, length);
      }

      byte[] body = new byte[(int) length];
      int bodyRead = readFully(in, body);
      if (bodyRead < body.length) {
        log.debug("Peer closed inside a frame body ({} of {} bytes)", bodyRead, body.length);
        return ReceiveResult.endOfStream();
      }
      return toItem(body);
    } catch (IOException ex) {
      return ReceiveResult.error(
          new DecodeException(DecodeException.Kind.TRANSPORT, "read failed: " + ex.getMessage(), ex));
    }
  }

  private ReceiveResult skipOversized(InputStream in, long length) throws IOException {
    try {
      in.skipNBytes(length);
    } catch (EOFException eof) {
      log.debug("Peer closed while skipping an oversized frame of {} bytes", length);
      return ReceiveResult.endOfStream();
    }
    return malformed("frame of " + length + " bytes exceeds limit of " + maxFrameBytes);
  }

  private static ReceiveResult toItem(byte[] body) {
    ItemKind kind;
    try {
      kind = ItemKind.fromTag(body[0]);
    } catch (IllegalArgumentException ex) {
      return malformed(ex.getMessage());
    }
    try {
      return ReceiveResult.item(new CollectItem(kind, Arrays.copyOfRange(body, 1, body.length)));
    } catch (IllegalArgumentException ex) {
      return malformed(ex.getMessage());
    }
  }

  private static ReceiveResult malformed(String message) {
    return ReceiveResult.error(new DecodeException(DecodeException.Kind.MALFORMED, message));
  }

  private static long readUnsignedInt(byte[] header) {
    return ((header[0] & 0xFFL) << 24)
        | ((header[1] & 0xFFL) << 16)
        | ((header[2] & 0xFFL) << 8)
        | (header[3] & 0xFFL);
  }

  private static int readFully(InputStream in, byte[] buffer) throws IOException {
    int offset = 0;
    while (offset < buffer.length) {
      int read = in.read(buffer, offset, buffer.length - offset);
      if (read < 0) {
        break;
      }
      offset += read;
    }
    return offset;
  }
}
