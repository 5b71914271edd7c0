/**
 * Sliding-window rate limiting for connection admission and per-peer message throughput.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.application.ratelimit;
