package org.albs.exporter.application.port;

import java.util.Objects;

/**
 * Captured outcome of an external command.
 *
 * @param exitCode process exit status
 * @param stdout standard output decoded as UTF-8
 * @param stderr standard error decoded as UTF-8
 * @since 0.1.0
 */
public record ToolResult(int exitCode, String stdout, String stderr) {

  public ToolResult {
    stdout = Objects.requireNonNullElse(stdout, "");
    stderr = Objects.requireNonNullElse(stderr, "");
  }

  public boolean succeeded() {
    return exitCode == 0;
  }
}
