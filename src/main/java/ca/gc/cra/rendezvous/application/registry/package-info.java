/**
 * Peer registry: the canonical peer table, derived role sets and the per-peer send path.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.application.registry;
