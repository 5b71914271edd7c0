/**
 * Helper selection for client help requests.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.application.matchmaking;
