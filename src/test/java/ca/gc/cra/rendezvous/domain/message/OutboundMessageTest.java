package ca.gc.cra.rendezvous.domain.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.rendezvous.domain.peer.PeerId;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OutboundMessageTest {
  private static final PeerId HELPER = new PeerId("3f2b8c1e-9d4a-4b7e-8a61-0c5d2e7f9a10");

  @Test
  void welcomeListsFieldsInWireOrder() {
    OutboundMessage welcome = OutboundMessage.welcome(HELPER, 1_700_000_000.5d, 8192);

    assertEquals(MessageType.WELCOME, welcome.type());
    assertEquals(List.of("peer_id", "server_time", "max_message_size"), List.copyOf(welcome.fields().keySet()));
    assertEquals(8192, welcome.fields().get("max_message_size"));
  }

  @Test
  void sanitizedCleansServerAuthoredStrings() {
    OutboundMessage found = OutboundMessage.helperFound(HELPER, "<C\"A>");

    OutboundMessage sanitized = found.sanitized();

    assertEquals("CA", sanitized.fields().get("helper_country"));
    assertEquals(HELPER.value(), sanitized.fields().get("helper_id"));
  }

  @Test
  void sanitizedLeavesRelayPayloadUntouched() {
    String sdp = "v=0\r\no=- 46117 2 IN IP4 127.0.0.1\r\ns=<session>\r\n";
    Map<String, Object> payload = Map.of("type", "offer", "sdp", sdp);

    OutboundMessage relay = OutboundMessage.relay(MessageType.OFFER, HELPER, payload).sanitized();

    assertSame(payload, relay.fields().get("offer"));
    assertEquals(HELPER.value(), relay.fields().get("from"));
  }

  @Test
  void sanitizedLeavesStringCandidatePayloadUntouched() {
    String candidate = "candidate:1 1 udp 2122260223 \"192.168.1.2\" 54321 typ host";

    OutboundMessage relay = OutboundMessage.relay(MessageType.ICE_CANDIDATE, HELPER, candidate).sanitized();

    assertEquals(candidate, relay.fields().get("candidate"));
  }

  @Test
  void relayRejectsNonRelayType() {
    assertThrows(IllegalArgumentException.class, () -> OutboundMessage.relay(MessageType.PONG, HELPER, null));
  }

  @Test
  void fieldsAreImmutable() {
    OutboundMessage pong = OutboundMessage.pong(1.0d);
    assertThrows(UnsupportedOperationException.class, () -> pong.fields().put("x", "y"));
  }
}
