package ca.gc.cra.rendezvous.infrastructure.transport;

import ca.gc.cra.rendezvous.application.port.PeerTransport;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PeerTransport} over a Netty WebSocket channel.
 *
 * <p>Writes never block. Frames still waiting to be flushed are counted; a peer that lets more than
 * {@code maxQueuedFrames} accumulate is disconnected. A failed write closes the channel, which in turn drives the
 * session's cleanup.</p>
 *
 * @since 0.1.0
 */
final class NettyPeerTransport implements PeerTransport {
  private static final Logger log = LoggerFactory.getLogger(NettyPeerTransport.class);
  static final String QUEUE_OVERFLOW_REASON = "Send queue overflow";

  private final Channel channel;
  private final int maxQueuedFrames;
  private final AtomicInteger pending = new AtomicInteger();
  private final AtomicBoolean closing = new AtomicBoolean();

  NettyPeerTransport(Channel channel, int maxQueuedFrames) {
    this.channel = Objects.requireNonNull(channel, "channel");
    if (maxQueuedFrames <= 0) {
      throw new IllegalArgumentException("maxQueuedFrames must be positive");
    }
    this.maxQueuedFrames = maxQueuedFrames;
  }

  @Override
  public boolean sendText(String text) {
    if (!isOpen()) {
      return false;
    }
    if (pending.incrementAndGet() > maxQueuedFrames) {
      pending.decrementAndGet();
      log.warn("Outbound queue of {} exceeded {} frames; closing", channel.id(), maxQueuedFrames);
      close(POLICY_VIOLATION, QUEUE_OVERFLOW_REASON);
      return false;
    }
    channel.writeAndFlush(new TextWebSocketFrame(text)).addListener(future -> {
      pending.decrementAndGet();
      if (!future.isSuccess()) {
        log.debug("Write to {} failed; closing", channel.id(), future.cause());
        channel.close();
      }
    });
    return true;
  }

  @Override
  public void close(int code, String reason) {
    if (!closing.compareAndSet(false, true)) {
      return;
    }
    if (channel.isActive()) {
      channel.writeAndFlush(new CloseWebSocketFrame(code, reason)).addListener(ChannelFutureListener.CLOSE);
    } else {
      channel.close();
    }
  }

  @Override
  public boolean isOpen() {
    return !closing.get() && channel.isActive();
  }

  @Override
  public String remoteAddress() {
    return hostOf(channel.remoteAddress());
  }

  int pendingFrames() {
    return pending.get();
  }

  static String hostOf(SocketAddress address) {
    if (address instanceof InetSocketAddress inet) {
      return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
    }
    return address == null ? "unknown" : address.toString();
  }
}
