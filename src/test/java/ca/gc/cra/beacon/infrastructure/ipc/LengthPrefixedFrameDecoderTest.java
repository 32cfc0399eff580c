package ca.gc.cra.beacon.infrastructure.ipc;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.beacon.application.port.DecodeException;
import ca.gc.cra.beacon.application.port.ReceiveResult;
import ca.gc.cra.beacon.domain.collect.CollectItem;
import ca.gc.cra.beacon.domain.collect.ItemKind;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LengthPrefixedFrameDecoderTest {
  private final LengthPrefixedFrameDecoder decoder = new LengthPrefixedFrameDecoder(64);

  @Test
  void decodesFrameThenReportsEndOfStream() {
    CollectItem segment = new CollectItem(ItemKind.SEGMENT, "span".getBytes(StandardCharsets.UTF_8));
    InputStream in = new ByteArrayInputStream(FrameEncoder.encode(segment));

    ReceiveResult first = decoder.receive(in);
    assertEquals(ReceiveResult.Status.ITEM, first.status());
    assertEquals(ItemKind.SEGMENT, first.item().kind());
    assertArrayEquals("span".getBytes(StandardCharsets.UTF_8), first.item().payload());

    assertEquals(ReceiveResult.Status.END_OF_STREAM, decoder.receive(in).status());
  }

  @Test
  void zeroLengthFrameIsMalformedAndNextFrameStillDecodes() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(new byte[] {0, 0, 0, 0});
    FrameEncoder.write(out, new CollectItem(ItemKind.METER, new byte[] {9}));
    InputStream in = new ByteArrayInputStream(out.toByteArray());

    ReceiveResult empty = decoder.receive(in);
    assertEquals(ReceiveResult.Status.ERROR, empty.status());
    assertEquals(DecodeException.Kind.MALFORMED, empty.error().kind());

    assertEquals(ItemKind.METER, decoder.receive(in).item().kind());
  }

  @Test
  void oversizedFrameIsSkippedToNextBoundary() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(ByteBuffer.allocate(4).putInt(100).array());
    out.write(new byte[100]);
    FrameEncoder.write(out, new CollectItem(ItemKind.LOG, new byte[] {1, 2, 3}));
    InputStream in = new ByteArrayInputStream(out.toByteArray());

    ReceiveResult oversized = decoder.receive(in);
    assertEquals(DecodeException.Kind.MALFORMED, oversized.error().kind());
    assertEquals(ItemKind.LOG, decoder.receive(in).item().kind());
  }

  @Test
  void unknownTagAndEmptyTelemetryPayloadAreMalformed() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(new byte[] {0, 0, 0, 2, 0x7F, 1});
    out.write(new byte[] {0, 0, 0, 1, ItemKind.SEGMENT.tag()});
    out.write(new byte[] {0, 0, 0, 1, ItemKind.KEEP_ALIVE.tag()});
    InputStream in = new ByteArrayInputStream(out.toByteArray());

    assertEquals(DecodeException.Kind.MALFORMED, decoder.receive(in).error().kind());
    assertEquals(DecodeException.Kind.MALFORMED, decoder.receive(in).error().kind());
    ReceiveResult keepAlive = decoder.receive(in);
    assertEquals(ItemKind.KEEP_ALIVE, keepAlive.item().kind());
    assertEquals(0, keepAlive.item().size());
  }

  @Test
  void truncatedFrameEndsStream() {
    byte[] frame = FrameEncoder.encode(new CollectItem(ItemKind.LOG, new byte[] {1, 2, 3, 4}));
    byte[] truncated = new byte[frame.length - 2];
    System.arraycopy(frame, 0, truncated, 0, truncated.length);

    assertEquals(ReceiveResult.Status.END_OF_STREAM,
        decoder.receive(new ByteArrayInputStream(truncated)).status());
    assertEquals(ReceiveResult.Status.END_OF_STREAM,
        decoder.receive(new ByteArrayInputStream(new byte[] {0, 0})).status());
  }

  @Test
  void readFailureIsTransportError() {
    InputStream failing = new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("reset by peer");
      }
    };

    ReceiveResult result = decoder.receive(failing);
    assertEquals(ReceiveResult.Status.ERROR, result.status());
    assertEquals(DecodeException.Kind.TRANSPORT, result.error().kind());
  }

  @Test
  void rejectsTinyFrameLimit() {
    assertThrows(IllegalArgumentException.class, () -> new LengthPrefixedFrameDecoder(1));
  }
}
