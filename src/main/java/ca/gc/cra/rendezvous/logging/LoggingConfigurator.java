package ca.gc.cra.rendezvous.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for the signaling server CLI.
 * <p><strong>Why:</strong> Operators raise verbosity to follow individual peer sessions without editing
 * {@code logback.xml}.
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String TRANSPORT_LOGGER = "io.netty";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger to DEBUG while keeping Netty internals at INFO.
   *
   * <p>Netty's DEBUG output reports buffer leak detection and event loop internals for every connection, which
   * drowns out per-peer signaling diagnostics.</p>
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      Logger transport = context.getLogger(TRANSPORT_LOGGER);
      if (transport.getLevel() == null) {
        transport.setLevel(Level.INFO);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
