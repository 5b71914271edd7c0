/**
 * Jackson streaming implementation of the wire codec.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.infrastructure.json;
