package ca.gc.cra.rendezvous.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.rendezvous.application.port.ClockPort;
import ca.gc.cra.rendezvous.application.port.MetricsPort;
import ca.gc.cra.rendezvous.application.signaling.SignalingService;
import ca.gc.cra.rendezvous.application.signaling.SignalingSession;
import ca.gc.cra.rendezvous.config.CompositionRoot;
import ca.gc.cra.rendezvous.config.SignalingConfig;
import ca.gc.cra.rendezvous.infrastructure.json.JacksonWireCodec;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WebSocketSessionHandlerTest {
  private final JacksonWireCodec codec = new JacksonWireCodec();

  @Test
  void handshakeRegistersPeerAndSendsWelcome() {
    SignalingService service = service(Map.of());
    WebSocketSessionHandler handler = new WebSocketSessionHandler(service, 8);
    EmbeddedChannel channel = new EmbeddedChannel(handler);

    completeHandshake(channel);

    assertEquals("welcome", readMessage(channel).get("type"));
    assertNotNull(handler.session());
    assertEquals(1, service.registry().size());
    channel.finishAndReleaseAll();
  }

  @Test
  void framesBeforeHandshakeAreIgnored() {
    SignalingService service = service(Map.of());
    EmbeddedChannel channel = new EmbeddedChannel(new WebSocketSessionHandler(service, 8));

    channel.writeInbound(new TextWebSocketFrame("{\"type\":\"ping\"}"));

    assertNull(channel.readOutbound());
    assertEquals(0, service.registry().size());
    channel.finishAndReleaseAll();
  }

  @Test
  void textAndBinaryFramesReachTheSession() {
    SignalingService service = service(Map.of());
    EmbeddedChannel channel = new EmbeddedChannel(new WebSocketSessionHandler(service, 8));
    completeHandshake(channel);
    readMessage(channel);

    channel.writeInbound(new TextWebSocketFrame("{\"type\":\"ping\"}"));
    assertEquals("pong", readMessage(channel).get("type"));

    channel.writeInbound(new BinaryWebSocketFrame(
        Unpooled.copiedBuffer("{\"type\":\"auth_request\"}", StandardCharsets.UTF_8)));
    assertEquals("auth_challenge", readMessage(channel).get("type"));
    channel.finishAndReleaseAll();
  }

  @Test
  void binaryFrameWithInvalidUtf8CountsAsMalformed() {
    SignalingService service = service(Map.of());
    WebSocketSessionHandler handler = new WebSocketSessionHandler(service, 8);
    EmbeddedChannel channel = new EmbeddedChannel(handler);
    completeHandshake(channel);
    readMessage(channel);

    channel.writeInbound(new BinaryWebSocketFrame(
        Unpooled.wrappedBuffer(new byte[] {'{', '"', 't', (byte) 0xC3, (byte) 0x28, '"', '}'})));

    assertEquals(48, handler.session().peer().orElseThrow().reputation());
    assertNull(channel.readOutbound());
    channel.writeInbound(new TextWebSocketFrame("{\"type\":\"ping\"}"));
    assertEquals("pong", readMessage(channel).get("type"));
    channel.finishAndReleaseAll();
  }

  @Test
  void channelInactiveRemovesPeer() {
    SignalingService service = service(Map.of());
    WebSocketSessionHandler handler = new WebSocketSessionHandler(service, 8);
    EmbeddedChannel channel = new EmbeddedChannel(handler);
    completeHandshake(channel);

    channel.close();

    assertEquals(SignalingSession.State.CLOSED, handler.session().state());
    assertEquals(0, service.registry().size());
    channel.finishAndReleaseAll();
  }

  @Test
  void refusedAdmissionClosesWithPolicyViolation() {
    SignalingService service = service(Map.of("rateLimit.connections.max", "1"));
    EmbeddedChannel first = new EmbeddedChannel(new WebSocketSessionHandler(service, 8));
    completeHandshake(first);
    WebSocketSessionHandler refusedHandler = new WebSocketSessionHandler(service, 8);
    EmbeddedChannel refused = new EmbeddedChannel(refusedHandler);

    completeHandshake(refused);

    CloseWebSocketFrame close = refused.readOutbound();
    assertEquals(1008, close.statusCode());
    assertEquals(WebSocketSessionHandler.ADMISSION_REFUSED_REASON, close.reasonText());
    close.release();
    assertFalse(refused.isOpen());
    assertNull(refusedHandler.session());
    assertEquals(1, service.registry().size());
    assertEquals(1L, service.stats().rejectedConnections());
    first.finishAndReleaseAll();
    refused.finishAndReleaseAll();
  }

  @Test
  void exceptionsCloseTheChannel() {
    SignalingService service = service(Map.of());
    EmbeddedChannel channel = new EmbeddedChannel(new WebSocketSessionHandler(service, 8));
    completeHandshake(channel);

    channel.pipeline().fireExceptionCaught(new IllegalStateException("boom"));

    assertFalse(channel.isOpen());
    assertEquals(0, service.registry().size());
    channel.finishAndReleaseAll();
  }

  private static SignalingService service(Map<String, String> overrides) {
    return new CompositionRoot(SignalingConfig.fromMap(overrides), MetricsPort.NO_OP, ClockPort.SYSTEM)
        .signalingService();
  }

  private static void completeHandshake(EmbeddedChannel channel) {
    channel.pipeline().fireUserEventTriggered(
        new WebSocketServerProtocolHandler.HandshakeComplete("/", new DefaultHttpHeaders(), null));
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> readMessage(EmbeddedChannel channel) {
    TextWebSocketFrame frame = channel.readOutbound();
    assertNotNull(frame, "expected an outbound text frame");
    try {
      return (Map<String, Object>) codec.decode(frame.text());
    } finally {
      frame.release();
    }
  }
}
