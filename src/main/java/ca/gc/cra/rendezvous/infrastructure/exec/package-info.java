/**
 * Thread factories and schedulers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.infrastructure.exec;
