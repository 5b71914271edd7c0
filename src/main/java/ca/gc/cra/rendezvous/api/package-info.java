/**
 * <strong>Purpose:</strong> Command-line entry points: the dispatcher and the {@code serve} command.
 * <p>Commands return an {@link ca.gc.cra.rendezvous.api.ExitCode} and print usage through
 * {@link ca.gc.cra.rendezvous.api.CliPrinter}; diagnostics go through SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.api;
