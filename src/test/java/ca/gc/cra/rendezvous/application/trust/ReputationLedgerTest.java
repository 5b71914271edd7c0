package ca.gc.cra.rendezvous.application.trust;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.PeerId;
import ca.gc.cra.rendezvous.domain.peer.ReputationEvent;
import ca.gc.cra.rendezvous.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.Test;

class ReputationLedgerTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ReputationLedger ledger = new ReputationLedger(metrics);
  private final Peer peer = new Peer(PeerId.random(), "10.0.0.1", 0L);

  @Test
  void penaltiesFollowSchedule() {
    assertEquals(40, ledger.apply(peer, ReputationEvent.RATE_LIMIT_EXCEEDED));
    assertEquals(35, ledger.apply(peer, ReputationEvent.VALIDATION_REJECTED));
    assertEquals(33, ledger.apply(peer, ReputationEvent.MALFORMED_FRAME));
    assertEquals(32, ledger.apply(peer, ReputationEvent.PROTOCOL_MISUSE));
    assertEquals(42, ledger.apply(peer, ReputationEvent.AUTHENTICATED));
  }

  @Test
  void applyCountsEventMetric() {
    ledger.apply(peer, ReputationEvent.MALFORMED_FRAME);
    ledger.apply(peer, ReputationEvent.MALFORMED_FRAME);

    assertEquals(2, metrics.count("trust.penalty.malformed"));
  }

  @Test
  void adjustClampsAtZero() {
    for (int i = 0; i < 10; i++) {
      ledger.apply(peer, ReputationEvent.RATE_LIMIT_EXCEEDED);
    }
    assertEquals(0, peer.reputation());
    assertEquals(100, ledger.adjust(peer, 250));
  }

  @Test
  void trustNeedsAuthentication() {
    ledger.adjust(peer, 40);
    assertFalse(ledger.isTrusted(peer));
    peer.markAuthenticated();
    assertTrue(ledger.isTrusted(peer));
    assertFalse(ledger.isTrusted(null));
  }
}
