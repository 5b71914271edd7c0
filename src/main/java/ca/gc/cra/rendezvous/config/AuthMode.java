package ca.gc.cra.rendezvous.config;

import java.util.Locale;

/**
 * Challenge verification scheme selected by {@code auth.mode}.
 *
 * @since 0.1.0
 */
public enum AuthMode {
  /** Publicly computable {@code stealthflow-<challenge>-verified} response. */
  ECHO,
  /** Hex HMAC-SHA256 of the challenge under {@code auth.secret}. */
  HMAC;

  /**
   * Parses a configuration value case-insensitively.
   *
   * @param raw value such as {@code echo} or {@code HMAC}; blank yields {@link #ECHO}
   * @return matching mode
   * @throws IllegalArgumentException when the value is unknown
   */
  public static AuthMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return ECHO;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("auth.mode must be echo or hmac (was " + raw + ")", ex);
    }
  }
}
