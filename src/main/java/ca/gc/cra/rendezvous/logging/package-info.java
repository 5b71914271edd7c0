/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and neutralize peer-supplied text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from concurrent event loops.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Escapes line breaks so hostile peers cannot forge log entries.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.logging;
