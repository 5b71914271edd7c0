package ca.gc.cra.rendezvous.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.util.ReferenceCountUtil;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NettyPeerTransportTest {

  @Test
  void sendWritesTextFrame() {
    EmbeddedChannel channel = new EmbeddedChannel();
    NettyPeerTransport transport = new NettyPeerTransport(channel, 4);

    assertTrue(transport.sendText("{\"type\":\"pong\"}"));

    TextWebSocketFrame frame = channel.readOutbound();
    assertEquals("{\"type\":\"pong\"}", frame.text());
    frame.release();
    assertEquals(0, transport.pendingFrames());
    channel.finishAndReleaseAll();
  }

  @Test
  void slowReaderIsDisconnectedWhenQueueOverflows() {
    StalledWrites stalled = new StalledWrites();
    EmbeddedChannel channel = new EmbeddedChannel(stalled);
    NettyPeerTransport transport = new NettyPeerTransport(channel, 2);

    assertTrue(transport.sendText("one"));
    assertTrue(transport.sendText("two"));
    assertFalse(transport.sendText("three"));

    assertFalse(transport.isOpen());
    assertEquals(2, transport.pendingFrames());
    Object last = stalled.messages.get(stalled.messages.size() - 1);
    CloseWebSocketFrame close = (CloseWebSocketFrame) last;
    assertEquals(1008, close.statusCode());
    assertEquals(NettyPeerTransport.QUEUE_OVERFLOW_REASON, close.reasonText());
    stalled.messages.forEach(ReferenceCountUtil::release);
    channel.finishAndReleaseAll();
  }

  @Test
  void closeSendsStatusOnceAndStopsSends() {
    EmbeddedChannel channel = new EmbeddedChannel();
    NettyPeerTransport transport = new NettyPeerTransport(channel, 4);

    transport.close(1001, "Server shutting down");
    transport.close(1008, "ignored");

    CloseWebSocketFrame close = channel.readOutbound();
    assertEquals(1001, close.statusCode());
    close.release();
    assertNull(channel.readOutbound());
    assertFalse(channel.isOpen());
    assertFalse(transport.sendText("late"));
    channel.finishAndReleaseAll();
  }

  @Test
  void closingInactiveChannelSkipsCloseFrame() {
    EmbeddedChannel channel = new EmbeddedChannel();
    channel.close();
    NettyPeerTransport transport = new NettyPeerTransport(channel, 4);

    transport.close(1008, "gone");

    assertFalse(transport.isOpen());
    assertNull(channel.readOutbound());
  }

  @Test
  void rejectsNonPositiveQueueBound() {
    assertThrows(IllegalArgumentException.class, () -> new NettyPeerTransport(new EmbeddedChannel(), 0));
  }

  @Test
  void hostOfUsesLiteralAddress() {
    assertEquals("10.1.2.3", NettyPeerTransport.hostOf(new InetSocketAddress("10.1.2.3", 4000)));
    assertEquals("unknown", NettyPeerTransport.hostOf(null));
  }

  /** Holds every outbound write without completing it. */
  private static final class StalledWrites extends ChannelOutboundHandlerAdapter {
    final List<Object> messages = new ArrayList<>();

    @Override
    public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
      messages.add(msg);
    }
  }
}
