/**
 * <strong>Purpose:</strong> Peer entity, identifiers, roles and the reputation/trust rules.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.rendezvous.domain.peer.Peer} synchronizes on itself; all other
 * types are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.domain.peer;
