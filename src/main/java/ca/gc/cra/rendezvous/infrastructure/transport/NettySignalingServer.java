package ca.gc.cra.rendezvous.infrastructure.transport;

import ca.gc.cra.rendezvous.application.signaling.SignalingService;
import ca.gc.cra.rendezvous.infrastructure.exec.ExecutorFactories;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Netty WebSocket listener hosting the signaling service.
 * <p><strong>Role:</strong> Transport adapter started by the CLI through the composition root.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #close()} are intended for a single controlling
 * thread; {@link #close()} is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class NettySignalingServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(NettySignalingServer.class);

  private final TransportSettings settings;
  private final SignalingService service;
  private EventLoopGroup bossGroup;
  private EventLoopGroup workerGroup;
  private Channel serverChannel;
  private boolean closed;

  public NettySignalingServer(TransportSettings settings, SignalingService service) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.service = Objects.requireNonNull(service, "service");
  }

  /**
   * Binds the listener and returns once it accepts connections.
   *
   * @throws IOException when the address cannot be bound
   * @throws IllegalStateException when already started
   */
  public synchronized void start() throws IOException {
    if (serverChannel != null) {
      throw new IllegalStateException("server already started");
    }
    bossGroup = new NioEventLoopGroup(
        settings.bossThreads(), ExecutorFactories.namedThreadFactory("rendezvous-accept", false));
    workerGroup = new NioEventLoopGroup(
        settings.workerThreads(), ExecutorFactories.namedThreadFactory("rendezvous-io", false));
    ServerBootstrap bootstrap = new ServerBootstrap()
        .group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .option(ChannelOption.SO_BACKLOG, 128)
        .childOption(ChannelOption.SO_KEEPALIVE, true)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .childHandler(new SignalingChannelInitializer(settings, service));

    ChannelFuture bind = bootstrap
        .bind(settings.listen().host(), settings.listen().port())
        .awaitUninterruptibly();
    if (!bind.isSuccess()) {
      shutdownGroups();
      throw new IOException("Failed to bind " + settings.listen(), bind.cause());
    }
    serverChannel = bind.channel();
    log.info("Signaling server listening on ws://{}{}", settings.listen(), settings.path());
  }

  /**
   * Returns the bound socket address.
   *
   * @return local address, or {@code null} before start
   */
  public synchronized InetSocketAddress boundAddress() {
    return serverChannel == null ? null : (InetSocketAddress) serverChannel.localAddress();
  }

  /**
   * Blocks until the listener channel closes.
   *
   * @throws InterruptedException when interrupted while waiting
   */
  public void awaitClose() throws InterruptedException {
    Channel channel;
    synchronized (this) {
      channel = serverChannel;
    }
    if (channel != null) {
      channel.closeFuture().sync();
    }
  }

  /** Closes every peer with 1001, stops accepting and shuts the event loops down gracefully. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (serverChannel != null) {
      serverChannel.close().awaitUninterruptibly();
    }
    service.shutdown();
    shutdownGroups();
    log.info("Signaling server stopped");
  }

  private void shutdownGroups() {
    if (bossGroup != null) {
      bossGroup.shutdownGracefully(0, 5000, TimeUnit.MILLISECONDS).awaitUninterruptibly();
    }
    if (workerGroup != null) {
      workerGroup.shutdownGracefully(100, 5000, TimeUnit.MILLISECONDS).awaitUninterruptibly();
    }
  }

  boolean eventLoopsTerminated() {
    return bossGroup != null && bossGroup.isTerminated()
        && workerGroup != null && workerGroup.isTerminated();
  }
}
