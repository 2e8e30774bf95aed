package ca.gc.cra.netsim.api;

/**
 * <strong>What:</strong> Exit codes shared by the NETSIM command-line tools.
 * <p><strong>Why:</strong> Scripts driving lab runs need to tell bad input from a failed simulation.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** The lab ran but did not converge or the end-to-end ping failed. */
  LAB_FAILED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
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
