package ca.gc.cra.subconv.api;

/**
 * <strong>What:</strong> Process exit codes shared by the SUBCONV commands.
 * <p><strong>Why:</strong> Scripts distinguish bad input links from bad arguments and I/O problems.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading input or writing output failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Input could not be converted (malformed link, unsupported protocol, no proxies). */
  CONVERSION_ERROR(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
