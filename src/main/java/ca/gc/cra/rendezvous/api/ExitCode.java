package ca.gc.cra.rendezvous.api;

/**
 * <strong>What:</strong> Process exit codes returned by the rendezvous command line.
 * <p><strong>Why:</strong> Supervisors and scripts distinguish bad arguments from a failed bind or an interrupt.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including a clean shutdown. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The listener could not bind or a config file could not be read. */
  IO_ERROR(3),
  /** Configuration file was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
