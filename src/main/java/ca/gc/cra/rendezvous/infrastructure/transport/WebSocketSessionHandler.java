package ca.gc.cra.rendezvous.infrastructure.transport;

import ca.gc.cra.rendezvous.application.port.PeerTransport;
import ca.gc.cra.rendezvous.application.signaling.SignalingService;
import ca.gc.cra.rendezvous.application.signaling.SignalingSession;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Binds one WebSocket channel to a {@link SignalingSession}.
 * <p><strong>Why:</strong> Admission runs once the handshake completes, before any peer is registered; afterwards
 * every data frame is handed to the session on the channel's event loop, which keeps one peer's frames in receipt
 * order while other channels proceed in parallel.</p>
 * <p><strong>Thread-safety:</strong> Not sharable; one instance per channel, confined to its event loop.</p>
 *
 * @since 0.1.0
 */
final class WebSocketSessionHandler extends SimpleChannelInboundHandler<WebSocketFrame> {
  private static final Logger log = LoggerFactory.getLogger(WebSocketSessionHandler.class);
  static final String ADMISSION_REFUSED_REASON = "Rate limit exceeded";

  private final SignalingService service;
  private final int maxQueuedFrames;
  private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPORT)
      .onUnmappableCharacter(CodingErrorAction.REPORT);
  private SignalingSession session;

  WebSocketSessionHandler(SignalingService service, int maxQueuedFrames) {
    this.service = Objects.requireNonNull(service, "service");
    this.maxQueuedFrames = maxQueuedFrames;
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
      NettyPeerTransport transport = new NettyPeerTransport(ctx.channel(), maxQueuedFrames);
      if (!service.admit(transport.remoteAddress())) {
        transport.close(PeerTransport.POLICY_VIOLATION, ADMISSION_REFUSED_REASON);
        return;
      }
      session = service.open(transport);
      return;
    }
    super.userEventTriggered(ctx, evt);
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
    if (session == null) {
      return;
    }
    if (frame instanceof TextWebSocketFrame text) {
      session.onFrame(text.text());
    } else if (frame instanceof BinaryWebSocketFrame binary) {
      String text;
      try {
        text = utf8.decode(binary.content().nioBuffer()).toString();
      } catch (CharacterCodingException ex) {
        session.onUndecodableFrame("binary frame is not UTF-8 (" + ex + ")");
        return;
      }
      session.onFrame(text);
    } else {
      log.debug("Ignoring {} on {}", frame.getClass().getSimpleName(), ctx.channel().id());
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    if (session != null) {
      session.close();
    }
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    log.warn("Connection error on {}: {}", ctx.channel().id(), cause.toString());
    log.debug("Connection error detail", cause);
    ctx.close();
  }

  SignalingSession session() {
    return session;
  }
}
