package ca.gc.cra.rendezvous.application.registry;

import ca.gc.cra.rendezvous.application.port.ClockPort;
import ca.gc.cra.rendezvous.application.port.PeerTransport;
import ca.gc.cra.rendezvous.application.port.WireCodec;
import ca.gc.cra.rendezvous.domain.message.OutboundMessage;
import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.PeerId;
import ca.gc.cra.rendezvous.domain.peer.PeerRole;
import ca.gc.cra.rendezvous.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Authoritative table of connected peers and the derived {@code helpers}/{@code clients} role
 * sets.
 * <p><strong>Why:</strong> Peers may vanish at any moment; every other component holds only {@link PeerId}s and
 * re-resolves here, so a departed peer is never messaged through a stale reference.</p>
 * <p><strong>Role:</strong> Injected into the signaling service, router and matchmaking engine; owns peer lifecycle
 * and the per-peer send path.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Allocate identifiers and create peer records on connection accept.</li>
 *   <li>Keep each identifier in at most one role set, in agreement with the peer's role.</li>
 *   <li>Serialize, sanitize and deliver outbound messages; drop peers whose transport has closed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Tables are concurrent collections. Role transitions and removal of one peer run
 * under that {@link Peer}'s monitor, so they never interleave for the same peer while different peers proceed
 * independently. No monitor is held while writing to a transport.</p>
 *
 * @since 0.1.0
 */
public final class PeerRegistry {
  private static final Logger log = LoggerFactory.getLogger(PeerRegistry.class);

  private record Entry(Peer peer, PeerTransport transport) {}

  private final ClockPort clock;
  private final WireCodec codec;
  private final Map<PeerId, Entry> peers = new ConcurrentHashMap<>();
  private final Set<PeerId> helpers = ConcurrentHashMap.newKeySet();
  private final Set<PeerId> clients = ConcurrentHashMap.newKeySet();

  public PeerRegistry(ClockPort clock, WireCodec codec) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Creates the peer record for a newly accepted connection. Call exactly once per connection.
   *
   * @param transport connection handle
   * @return new peer with a fresh server-issued identifier
   */
  public Peer register(PeerTransport transport) {
    Objects.requireNonNull(transport, "transport");
    while (true) {
      Peer peer = new Peer(PeerId.random(), transport.remoteAddress(), clock.nowMillis());
      if (peers.putIfAbsent(peer.id(), new Entry(peer, transport)) == null) {
        log.info("New peer connected: {} from {}", peer.id(), Logs.sanitize(peer.remoteAddress()));
        return peer;
      }
    }
  }

  /**
   * Updates a peer's role and announcement attributes and moves it between role sets atomically.
   *
   * @param id peer to update
   * @param role new role; {@link PeerRole#NONE} removes the peer from both sets
   * @param locale sanitized locale tag
   * @param bandwidth advertised bandwidth, or {@code null} to keep the current value
   * @return {@code false} when the peer is no longer registered
   */
  public boolean setRole(PeerId id, PeerRole role, String locale, Double bandwidth) {
    Objects.requireNonNull(role, "role");
    Entry entry = peers.get(id);
    if (entry == null) {
      return false;
    }
    Peer peer = entry.peer();
    synchronized (peer) {
      if (peer.isRemoved()) {
        return false;
      }
      peer.assignRole(role, locale, bandwidth);
      switch (role) {
        case HELPER -> {
          clients.remove(id);
          helpers.add(id);
        }
        case CLIENT -> {
          helpers.remove(id);
          clients.add(id);
        }
        default -> {
          helpers.remove(id);
          clients.remove(id);
        }
      }
    }
    return true;
  }

  /**
   * Resolves a peer.
   *
   * @param id identifier
   * @return registered peer
   */
  public Optional<Peer> get(PeerId id) {
    Entry entry = id == null ? null : peers.get(id);
    return entry == null ? Optional.empty() : Optional.of(entry.peer());
  }

  /**
   * Drops a peer and its role-set entries. Removing an absent peer is a no-op.
   *
   * @param id identifier
   * @return {@code true} when this call removed the peer
   */
  public boolean remove(PeerId id) {
    Entry entry = id == null ? null : peers.get(id);
    if (entry == null) {
      return false;
    }
    Peer peer = entry.peer();
    synchronized (peer) {
      if (!peers.remove(id, entry)) {
        return false;
      }
      helpers.remove(id);
      clients.remove(id);
      peer.markRemoved();
    }
    log.info("Cleaned up peer {}", id);
    return true;
  }

  /**
   * Sends a sanitized copy of {@code message} to a peer. A closed transport removes the peer instead of failing.
   *
   * @param id recipient
   * @param message message to deliver
   * @return {@code true} when the frame was handed to the transport
   */
  public boolean send(PeerId id, OutboundMessage message) {
    Objects.requireNonNull(message, "message");
    Entry entry = id == null ? null : peers.get(id);
    if (entry == null) {
      return false;
    }
    String text;
    try {
      text = codec.encode(message.sanitized());
    } catch (RuntimeException ex) {
      log.error("Failed to encode {} for {}", message.type(), id, ex);
      return false;
    }
    PeerTransport transport = entry.transport();
    if (!transport.isOpen() || !transport.sendText(text)) {
      log.debug("Transport of {} closed; removing peer", id);
      remove(id);
      return false;
    }
    return true;
  }

  /**
   * Returns the registered peers currently in the helper set.
   *
   * @return snapshot list, unordered
   */
  public List<Peer> helpers() {
    return resolve(helpers);
  }

  /**
   * Returns the registered peers currently in the client set.
   *
   * @return snapshot list, unordered
   */
  public List<Peer> clients() {
    return resolve(clients);
  }

  public Set<PeerId> helperIds() {
    return Set.copyOf(helpers);
  }

  public Set<PeerId> clientIds() {
    return Set.copyOf(clients);
  }

  public int size() {
    return peers.size();
  }

  public int helperCount() {
    return helpers.size();
  }

  public int clientCount() {
    return clients.size();
  }

  /**
   * Closes every registered connection; used on shutdown. Cleanup runs through each session's close path.
   *
   * @param code close status
   * @param reason close reason
   */
  public void closeAll(int code, String reason) {
    List<Entry> entries = new ArrayList<>(peers.values());
    for (Entry entry : entries) {
      try {
        entry.transport().close(code, reason);
      } catch (RuntimeException ex) {
        log.warn("Failed to close {}", entry.peer().id(), ex);
      }
    }
    log.info("Closed {} peer connection(s): {}", entries.size(), reason);
  }

  private List<Peer> resolve(Set<PeerId> ids) {
    List<Peer> resolved = new ArrayList<>(ids.size());
    for (PeerId id : ids) {
      Entry entry = peers.get(id);
      if (entry != null) {
        resolved.add(entry.peer());
      }
    }
    return resolved;
  }
}
