package ca.gc.cra.rendezvous.application.matchmaking;

import ca.gc.cra.rendezvous.application.registry.PeerRegistry;
import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.PeerRole;
import ca.gc.cra.rendezvous.domain.peer.PeerSnapshot;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Chooses the helper a requesting client should be introduced to.
 * <p><strong>Why:</strong> Helpers in the client's own locale likely share its censorship exposure, so foreign
 * helpers are preferred; among eligible helpers the most reputable, best provisioned and longest connected wins.</p>
 * <p><strong>Role:</strong> Application service called by the router on {@code request_help}.</p>
 * <p><strong>Thread-safety:</strong> Stateless. Each candidate is ranked on a {@link PeerSnapshot} so concurrent
 * reputation changes cannot break the comparator contract.</p>
 *
 * @implNote Selection is advisory: nothing is reserved, so concurrent clients may be matched to the same helper.
 * @since 0.1.0
 */
public final class MatchmakingEngine {
  /** Ranking order: reputation desc, bandwidth desc, connection time asc, identifier asc. */
  static final Comparator<PeerSnapshot> RANKING = Comparator
      .comparingInt(PeerSnapshot::reputation).reversed()
      .thenComparing(Comparator.comparingDouble(PeerSnapshot::bandwidth).reversed())
      .thenComparingLong(PeerSnapshot::connectedAtMillis)
      .thenComparing(PeerSnapshot::id);

  private final PeerRegistry registry;

  public MatchmakingEngine(PeerRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Selects the best trusted helper for {@code client}.
   *
   * @param client requesting peer; never matched with itself
   * @return chosen helper, or empty when no trusted helper is registered
   */
  public Optional<Peer> findBestHelper(Peer client) {
    Objects.requireNonNull(client, "client");
    String clientLocale = client.locale();
    List<Candidate> trusted = new ArrayList<>();
    for (Peer helper : registry.helpers()) {
      if (helper.id().equals(client.id())) {
        continue;
      }
      PeerSnapshot snapshot = helper.snapshot();
      if (snapshot.role() == PeerRole.HELPER && snapshot.trusted()) {
        trusted.add(new Candidate(helper, snapshot));
      }
    }
    List<Candidate> foreign = new ArrayList<>();
    for (Candidate candidate : trusted) {
      if (!candidate.snapshot().locale().equals(clientLocale)) {
        foreign.add(candidate);
      }
    }
    List<Candidate> pool = foreign.isEmpty() ? trusted : foreign;
    return pool.stream()
        .min(Comparator.comparing(Candidate::snapshot, RANKING))
        .map(Candidate::peer);
  }

  private record Candidate(Peer peer, PeerSnapshot snapshot) {}
}
