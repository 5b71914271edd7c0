package ca.gc.cra.rendezvous.infrastructure.transport;

import ca.gc.cra.rendezvous.validation.Net.HostPort;
import java.util.Objects;

/**
 * WebSocket listener settings.
 *
 * @param listen bind address
 * @param path WebSocket path prefix
 * @param maxFrameBytes largest accepted frame payload
 * @param maxQueuedFrames pending outbound frames tolerated per connection
 * @param pingIntervalSeconds inbound silence before a keep-alive ping
 * @param pingTimeoutSeconds wait for any inbound traffic after a ping
 * @param bossThreads acceptor threads
 * @param workerThreads I/O threads; {@code 0} lets Netty choose
 * @since 0.1.0
 */
public record TransportSettings(
    HostPort listen,
    String path,
    int maxFrameBytes,
    int maxQueuedFrames,
    int pingIntervalSeconds,
    int pingTimeoutSeconds,
    int bossThreads,
    int workerThreads) {

  public TransportSettings {
    Objects.requireNonNull(listen, "listen");
    Objects.requireNonNull(path, "path");
  }
}
