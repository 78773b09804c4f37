package io.wxpanel.api;

/**
 * Process exit codes returned by the CLI.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run finished and every canvas was saved. */
  SUCCESS(0),
  /** Arguments or configuration values were malformed. */
  INVALID_ARGS(2),
  /** A file could not be read or a canvas could not be saved. */
  IO_ERROR(3),
  /** Layout catalog or background set is unusable. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** Interrupted by the operator. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
