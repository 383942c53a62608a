package ca.gc.cra.sentinel.api;

/**
 * <strong>What:</strong> Process exit codes shared by SENTINEL command-line tools.
 * <p><strong>Why:</strong> Scripts that replay mutation logs branch on these values.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The mutation log or config file could not be read. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** A strict replay hit a rejected command, or an unexpected failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * @return numeric exit status
   */
  public int code() {
    return code;
  }
}
