package ca.gc.cra.rendezvous.infrastructure.transport;

import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a WebSocket ping when the upstream {@link io.netty.handler.timeout.IdleStateHandler} reports reader
 * idleness, and closes the connection when nothing at all arrives within the ping timeout.
 *
 * <p>Pong frames are consumed here; every other inbound message is passed on. One instance per channel.</p>
 */
final class KeepAliveHandler extends ChannelDuplexHandler {
  private static final Logger log = LoggerFactory.getLogger(KeepAliveHandler.class);
  static final int KEEPALIVE_TIMEOUT_STATUS = 1011;
  static final String KEEPALIVE_TIMEOUT_REASON = "keepalive ping timeout";

  private final long pingTimeoutMillis;
  private boolean upgraded;
  private long lastReadNanos = System.nanoTime();
  private ScheduledFuture<?> timeout;

  KeepAliveHandler(long pingTimeoutMillis) {
    this.pingTimeoutMillis = pingTimeoutMillis;
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
    lastReadNanos = System.nanoTime();
    cancelTimeout();
    if (msg instanceof PongWebSocketFrame pong) {
      pong.release();
      return;
    }
    super.channelRead(ctx, msg);
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
      upgraded = true;
    } else if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.READER_IDLE) {
      if (upgraded && timeout == null) {
        sendPing(ctx);
      }
      return;
    }
    super.userEventTriggered(ctx, evt);
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    cancelTimeout();
    super.channelInactive(ctx);
  }

  private void sendPing(ChannelHandlerContext ctx) {
    long pingSentNanos = System.nanoTime();
    ctx.writeAndFlush(new PingWebSocketFrame());
    timeout = ctx.executor().schedule(() -> {
      timeout = null;
      if (lastReadNanos - pingSentNanos < 0 && ctx.channel().isActive()) {
        log.info("Keep-alive timeout on {}; closing", ctx.channel().id());
        ctx.writeAndFlush(new CloseWebSocketFrame(KEEPALIVE_TIMEOUT_STATUS, KEEPALIVE_TIMEOUT_REASON))
            .addListener(ChannelFutureListener.CLOSE);
      }
    }, pingTimeoutMillis, TimeUnit.MILLISECONDS);
  }

  private void cancelTimeout() {
    if (timeout != null) {
      timeout.cancel(false);
      timeout = null;
    }
  }
}
