package ca.gc.cra.beacon.infrastructure.ipc;

import ca.gc.cra.beacon.domain.collect.CollectItem;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Minimal producer client that writes frames to a running daemon. Used by the {@code send} command and tests.
 * <p>Not thread-safe; one producer per thread.</p>
 *
 * @since 0.1.0
 */
public final class UnixSocketProducer implements AutoCloseable {
  private final SocketChannel channel;

  private UnixSocketProducer(SocketChannel channel) {
    this.channel = channel;
  }

  /**
   * Connects to the daemon socket.
   *
   * @param socketPath socket file
   * @return connected producer
   * @throws IOException if the connection fails
   */
  public static UnixSocketProducer connect(Path socketPath) throws IOException {
    Objects.requireNonNull(socketPath, "socketPath");
    SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
    try {
      channel.connect(UnixDomainSocketAddress.of(socketPath));
    } catch (IOException ex) {
      channel.close();
      throw ex;
    }
    return new UnixSocketProducer(channel);
  }

  /**
   * Sends one item as a frame.
   *
   * @param item item to send
   * @throws IOException if the write fails
   */
  public void send(CollectItem item) throws IOException {
    sendRaw(FrameEncoder.encode(item));
  }

  /**
   * Writes raw bytes, allowing callers to emit deliberately malformed frames.
   *
   * @param bytes bytes to write
   * @throws IOException if the write fails
   */
  public void sendRaw(byte[] bytes) throws IOException {
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    while (buffer.hasRemaining()) {
      channel.write(buffer);
    }
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
