package ca.gc.cra.beacon.application.port;

import java.io.InputStream;

/**
 * <strong>What:</strong> Reads one length-delimited frame from a producer connection.
 * <p><strong>Role:</strong> Port used by the per-connection decode loop; implemented by
 * {@code LengthPrefixedFrameDecoder}.</p>
 * <p><strong>Contract:</strong> Never throws; end of stream and failures are reported through
 * {@link ReceiveResult}. After an {@code ERROR} result the stream must be positioned at the next
 * frame boundary whenever the frame length was readable.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and may be shared across connections.</p>
 *
 * @since 0.1.0
 */
public interface FrameDecoder {
  /**
   * Blocks until a full frame is read, the peer closes, or the read fails.
   *
   * @param in connection input stream owned by the calling decode loop
   * @return receive outcome
   */
  ReceiveResult receive(InputStream in);
}
