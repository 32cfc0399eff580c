package ca.gc.cra.beacon.infrastructure.ipc;

import ca.gc.cra.beacon.application.port.IpcConnection;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.util.Objects;

/**
 * {@link IpcConnection} over an accepted UNIX-domain {@link SocketChannel}.
 */
final class UnixSocketConnection implements IpcConnection {
  private final String id;
  private final SocketChannel channel;
  private final InputStream input;

  UnixSocketConnection(String id, SocketChannel channel) {
    this.id = Objects.requireNonNull(id, "id");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.input = Channels.newInputStream(channel);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public InputStream input() {
    return input;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
