package ca.gc.cra.beacon.infrastructure.ipc;

import ca.gc.cra.beacon.domain.collect.CollectItem;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Producer-side counterpart of {@link LengthPrefixedFrameDecoder}.
 */
public final class FrameEncoder {
  private FrameEncoder() {}

  /**
   * Encodes an item as a complete frame.
   *
   * @param item item to encode
   * @return frame bytes including the length prefix
   */
  public static byte[] encode(CollectItem item) {
    Objects.requireNonNull(item, "item");
    byte[] payload = item.payload();
    ByteBuffer frame = ByteBuffer.allocate(LengthPrefixedFrameDecoder.HEADER_BYTES + 1 + payload.length);
    frame.putInt(payload.length + 1);
    frame.put(item.kind().tag());
    frame.put(payload);
    return frame.array();
  }

  /**
   * Writes one frame to the stream.
   *
   * @param out destination
   * @param item item to write
   * @throws IOException if the write fails
   */
  public static void write(OutputStream out, CollectItem item) throws IOException {
    out.write(encode(item));
  }
}
