package org.albs.exporter.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Raised when an external command exits with a non-zero status or exceeds its time budget.
 *
 * @since 0.1.0
 */
public class ToolInvocationException extends IOException {
  private static final long serialVersionUID = 1L;

  private final List<String> command;
  private final int exitCode;

  public ToolInvocationException(List<String> command, int exitCode, String detail) {
    super(String.join(" ", command) + " exited with " + exitCode + describe(detail));
    this.command = List.copyOf(command);
    this.exitCode = exitCode;
  }

  public ToolInvocationException(List<String> command, String message, Throwable cause) {
    super(String.join(" ", command) + ": " + message, cause);
    this.command = List.copyOf(command);
    this.exitCode = -1;
  }

  public List<String> command() {
    return command;
  }

  /**
   * Returns the process exit status.
   *
   * @return exit status, or {@code -1} when the process timed out or could not be started
   */
  public int exitCode() {
    return exitCode;
  }

  private static String describe(String detail) {
    return detail == null || detail.isBlank() ? "" : ": " + detail.strip();
  }
}
