package ca.gc.cra.rendezvous.application.signaling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.PeerRole;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageRouterTest {
  private final SignalingFixture fixture = new SignalingFixture();

  @Test
  void unauthenticatedHelperAnnouncementIsPenalised() {
    SignalingFixture.Client peer = fixture.connect();

    peer.send("{\"type\":\"helper_available\",\"country\":\"CA\",\"bandwidth\":100}");

    assertEquals("auth_required", peer.last().get("type"));
    assertEquals(45, peer(peer).reputation());
    assertEquals(0, fixture.registry.helperCount());
    assertEquals(1L, fixture.service.stats().securityViolations());
  }

  @Test
  void unauthenticatedHelpRequestOnlyGetsNotice() {
    SignalingFixture.Client peer = fixture.connect();

    peer.send("{\"type\":\"request_help\",\"country\":\"CA\"}");

    assertEquals("auth_required", peer.last().get("type"));
    assertEquals(50, peer(peer).reputation());
    assertEquals(0, fixture.registry.clientCount());
  }

  @Test
  void pingIsAnsweredWithoutAuthentication() {
    SignalingFixture.Client peer = fixture.connect();

    peer.send("{\"type\":\"ping\"}");

    assertEquals("pong", peer.last().get("type"));
    assertEquals(1_700_000_000d, ((Number) peer.last().get("timestamp")).doubleValue());
  }

  @Test
  void failedAuthenticationReportsFailureWithoutPenalty() {
    SignalingFixture.Client peer = fixture.connect();
    peer.send("{\"type\":\"auth_request\"}");
    String challenge = (String) peer.last().get("challenge");

    peer.send("{\"type\":\"auth_response\",\"challenge\":\"" + challenge + "\",\"response\":\"guess\"}");

    assertEquals(Map.of("type", "auth_result", "success", false), peer.last());
    assertEquals(50, peer(peer).reputation());
    assertEquals(SignalingSession.State.CONNECTED_UNAUTHENTICATED, peer.session.state());
  }

  @Test
  void helperLocaleIsCutAndBandwidthClamped() {
    SignalingFixture.Client helper = fixture.authenticatedHelper("usa", 20_000);

    Peer registered = peer(helper);
    assertEquals(PeerRole.HELPER, registered.role());
    assertEquals("us", registered.locale());
    assertEquals(0d, registered.bandwidth());
  }

  @Test
  void localesCompareWithCaseAsSent() {
    fixture.authenticatedHelper("US", 900);
    SignalingFixture.Client lowerCase = fixture.authenticatedHelper("us", 100);
    SignalingFixture.Client client = fixture.connect();
    client.authenticate();

    client.send("{\"type\":\"request_help\",\"country\":\"US\"}");

    Map<String, Object> found = client.last();
    assertEquals("helper_found", found.get("type"));
    assertEquals(lowerCase.id(), found.get("helper_id"));
    assertEquals("us", found.get("helper_country"));
  }

  @Test
  void helperWithInvalidCountryIsNotRegistered() {
    SignalingFixture.Client helper = fixture.connect();
    helper.authenticate();

    helper.send("{\"type\":\"helper_available\",\"country\":\"<script>\",\"bandwidth\":100}");

    assertEquals(0, fixture.registry.helperCount());
    assertEquals("auth_result", helper.last().get("type"));
  }

  @Test
  void helpRequestWithoutHelpersReportsNoHelper() {
    SignalingFixture.Client client = fixture.connect();
    client.authenticate();

    client.send("{\"type\":\"request_help\",\"country\":\"ca\"}");

    assertEquals("no_helper_available", client.last().get("type"));
    assertEquals("No helpers currently available", client.last().get("message"));
    assertEquals(PeerRole.CLIENT, peer(client).role());
    assertEquals("ca", peer(client).locale());
    assertEquals(1, fixture.metrics.count("signaling.match.none"));
  }

  @Test
  void helperWhoseTransportDiedIsReportedAsUnavailable() {
    SignalingFixture.Client helper = fixture.authenticatedHelper("US", 500);
    helper.transport.failSends();
    SignalingFixture.Client client = fixture.connect();
    client.authenticate();

    client.send("{\"type\":\"request_help\",\"country\":\"DE\"}");

    assertEquals("no_helper_available", client.last().get("type"));
    assertTrue(fixture.registry.get(peer(helper).id()).isEmpty());
  }

  @Test
  void helperRoleSwitchesToClientOnHelpRequest() {
    SignalingFixture.Client peer = fixture.authenticatedHelper("US", 500);

    peer.send("{\"type\":\"request_help\",\"country\":\"US\"}");

    assertEquals(0, fixture.registry.helperCount());
    assertEquals(1, fixture.registry.clientCount());
    assertEquals("no_helper_available", peer.last().get("type"));
  }

  @Test
  void relayToUnknownPeerIsSilentlyDropped() {
    SignalingFixture.Client sender = fixture.connect();
    sender.authenticate();
    int frames = sender.transport.frames().size();

    sender.send("{\"type\":\"offer\",\"to\":\"3f2b8c1e-9d4a-4b7e-8a61-0c5d2e7f9a10\",\"offer\":{}}");

    assertEquals(frames, sender.transport.frames().size());
    assertEquals(60, peer(sender).reputation());
    assertEquals(1, fixture.metrics.count("signaling.relay.dropped"));
  }

  @Test
  void relayToUntrustedPeerIsSilentlyDropped() {
    SignalingFixture.Client sender = fixture.connect();
    sender.authenticate();
    SignalingFixture.Client target = fixture.connect();
    int targetFrames = target.transport.frames().size();

    sender.send("{\"type\":\"offer\",\"to\":\"" + target.id() + "\",\"offer\":{}}");

    assertEquals(targetFrames, target.transport.frames().size());
    assertEquals(1, fixture.metrics.count("signaling.relay.dropped"));
  }

  @Test
  void relayFromPeerThatLostTrustIsDropped() {
    SignalingFixture.Client sender = fixture.connect();
    sender.authenticate();
    SignalingFixture.Client target = fixture.connect();
    target.authenticate();
    sender.send("not json");
    int targetFrames = target.transport.frames().size();

    sender.send("{\"type\":\"ice_candidate\",\"to\":\"" + target.id() + "\",\"candidate\":\"c\"}");

    assertEquals(58, peer(sender).reputation());
    assertFalse(peer(sender).isTrusted());
    assertEquals(targetFrames, target.transport.frames().size());
  }

  @Test
  void candidateWithMalformedTargetIsPenalised() {
    SignalingFixture.Client sender = fixture.connect();
    sender.authenticate();

    sender.send("{\"type\":\"ice_candidate\",\"to\":\"peer-2\",\"candidate\":\"c\"}");

    assertEquals(59, peer(sender).reputation());
    assertEquals(1, fixture.metrics.count("trust.penalty.misuse"));
  }

  private Peer peer(SignalingFixture.Client client) {
    return client.session.peer().orElseThrow();
  }
}
