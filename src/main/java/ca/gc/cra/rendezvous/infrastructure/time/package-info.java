/**
 * Wall-clock adapter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.infrastructure.time;
