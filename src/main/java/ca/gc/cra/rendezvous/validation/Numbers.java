package ca.gc.cra.rendezvous.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by the CLI, configuration parsing and peer attributes.
 * <p><strong>Why:</strong> Guards listener tuning (frame sizes, windows, thread counts) before the server binds, and
 * keeps peer-advertised numbers inside their documented domains.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, seconds)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }
}
