package org.albs.exporter.api;

/**
 * <strong>What:</strong> Process exit codes of the exporter commands.
 * <p><strong>Why:</strong> Schedulers distinguish a run that finished with failed repositories or signature
 * violations from one that could not start at all.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Every unit succeeded and no violation was found. */
  SUCCESS(0),
  /** The run finished, but at least one unit failed or one directory had signature violations. */
  PARTIAL_FAILURE(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred before the run could proceed. */
  IO_ERROR(3),
  /** Configuration or selection was rejected. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
