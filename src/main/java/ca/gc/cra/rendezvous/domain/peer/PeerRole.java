package ca.gc.cra.rendezvous.domain.peer;

/**
 * Role a peer announced most recently.
 *
 * <p>A peer starts with {@link #NONE}; {@code helper_available} makes it a {@link #HELPER} and
 * {@code request_help} a {@link #CLIENT}. The two announced roles are mutually exclusive.</p>
 *
 * @since 0.1.0
 */
public enum PeerRole {
  /** Connected but has not announced a role yet. */
  NONE,
  /** Offers relay capacity to clients. */
  HELPER,
  /** Seeks a helper. */
  CLIENT
}
