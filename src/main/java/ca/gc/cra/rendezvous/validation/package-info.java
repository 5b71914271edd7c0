/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, configuration bootstrap, and wire message
 * sanitization.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation from event loops.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Strips control characters and markup from server-authored strings so peers cannot
 * smuggle injection payloads through server responses.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.validation;
