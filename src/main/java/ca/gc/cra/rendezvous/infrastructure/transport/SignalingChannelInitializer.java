package ca.gc.cra.rendezvous.infrastructure.transport;

import ca.gc.cra.rendezvous.application.signaling.SignalingService;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Builds the per-connection pipeline: HTTP upgrade, WebSocket framing with the frame size limit, keep-alive
 * pings and the session handler.
 *
 * @since 0.1.0
 */
final class SignalingChannelInitializer extends ChannelInitializer<Channel> {
  private static final int MAX_HANDSHAKE_BYTES = 65_536;

  private final TransportSettings settings;
  private final SignalingService service;

  SignalingChannelInitializer(TransportSettings settings, SignalingService service) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.service = Objects.requireNonNull(service, "service");
  }

  @Override
  protected void initChannel(Channel ch) {
    WebSocketServerProtocolConfig protocolConfig = WebSocketServerProtocolConfig.newBuilder()
        .websocketPath(settings.path())
        .checkStartsWith(true)
        .maxFramePayloadLength(settings.maxFrameBytes())
        .dropPongFrames(false)
        .build();
    ch.pipeline()
        .addLast("http", new HttpServerCodec())
        .addLast("aggregator", new HttpObjectAggregator(MAX_HANDSHAKE_BYTES))
        .addLast("idle", new IdleStateHandler(settings.pingIntervalSeconds(), 0, 0, TimeUnit.SECONDS))
        .addLast("websocket", new WebSocketServerProtocolHandler(protocolConfig))
        .addLast("fragments", new WebSocketFrameAggregator(settings.maxFrameBytes()))
        .addLast("keepalive", new KeepAliveHandler(TimeUnit.SECONDS.toMillis(settings.pingTimeoutSeconds())))
        .addLast("session", new WebSocketSessionHandler(service, settings.maxQueuedFrames()));
  }
}
