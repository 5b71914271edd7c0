package ca.gc.cra.rendezvous.application.matchmaking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rendezvous.application.registry.PeerRegistry;
import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.PeerRole;
import ca.gc.cra.rendezvous.infrastructure.json.JacksonWireCodec;
import ca.gc.cra.rendezvous.testutil.ManualClock;
import ca.gc.cra.rendezvous.testutil.RecordingTransport;
import org.junit.jupiter.api.Test;

class MatchmakingEngineTest {
  private final ManualClock clock = new ManualClock(0L);
  private final PeerRegistry registry = new PeerRegistry(clock, new JacksonWireCodec());
  private final MatchmakingEngine engine = new MatchmakingEngine(registry);

  @Test
  void emptyRegistryYieldsNoHelper() {
    assertTrue(engine.findBestHelper(client("CA")).isEmpty());
  }

  @Test
  void untrustedHelpersAreIgnored() {
    Peer helper = registry.register(new RecordingTransport());
    registry.setRole(helper.id(), PeerRole.HELPER, "US", 500d);

    assertTrue(engine.findBestHelper(client("CA")).isEmpty());
  }

  @Test
  void prefersHelperFromDifferentLocale() {
    Peer sameLocale = helper("CA", 9_000d, 90);
    Peer foreign = helper("US", 10d, 60);

    assertEquals(foreign.id(), engine.findBestHelper(client("CA")).orElseThrow().id());
    assertEquals(sameLocale.id(), engine.findBestHelper(client("US")).orElseThrow().id());
  }

  @Test
  void fallsBackToSameLocaleWhenNoOtherHelper() {
    Peer sameLocale = helper("CA", 100d, 60);

    assertEquals(sameLocale.id(), engine.findBestHelper(client("CA")).orElseThrow().id());
  }

  @Test
  void ranksByReputationThenBandwidthThenAge() {
    Peer lowRep = helper("US", 9_000d, 70);
    clock.advance(1_000L);
    Peer highRepSlow = helper("DE", 100d, 90);
    clock.advance(1_000L);
    Peer highRepFast = helper("FR", 800d, 90);
    clock.advance(1_000L);
    Peer highRepFastLater = helper("GB", 800d, 90);

    assertEquals(highRepFast.id(), engine.findBestHelper(client("CA")).orElseThrow().id());

    registry.remove(highRepFast.id());
    assertEquals(highRepFastLater.id(), engine.findBestHelper(client("CA")).orElseThrow().id());

    registry.remove(highRepFastLater.id());
    assertEquals(highRepSlow.id(), engine.findBestHelper(client("CA")).orElseThrow().id());

    registry.remove(highRepSlow.id());
    assertEquals(lowRep.id(), engine.findBestHelper(client("CA")).orElseThrow().id());
  }

  @Test
  void clientIsNeverMatchedWithItself() {
    Peer peer = helper("US", 100d, 90);

    assertTrue(engine.findBestHelper(peer).isEmpty());
  }

  private Peer helper(String locale, double bandwidth, int reputation) {
    Peer helper = registry.register(new RecordingTransport());
    helper.markAuthenticated();
    helper.adjustReputation(reputation - helper.reputation());
    registry.setRole(helper.id(), PeerRole.HELPER, locale, bandwidth);
    return helper;
  }

  private Peer client(String locale) {
    Peer client = registry.register(new RecordingTransport());
    registry.setRole(client.id(), PeerRole.CLIENT, locale, null);
    return client;
  }
}
