/**
 * <strong>Purpose:</strong> Configuration loading, layering (defaults, YAML, CLI) and object graph wiring.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.config;
