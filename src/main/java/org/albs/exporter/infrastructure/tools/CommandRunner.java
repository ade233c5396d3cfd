package org.albs.exporter.infrastructure.tools;

import java.io.IOException;
import java.util.List;
import org.albs.exporter.application.port.ToolResult;

/**
 * Runs an external command to completion.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CommandRunner {

  /**
   * Runs {@code command}.
   *
   * @param command program and arguments
   * @return exit status and captured output
   * @throws IOException when the command cannot be started or exceeds its time budget
   * @throws InterruptedException when the caller is interrupted; the process is destroyed
   */
  ToolResult run(List<String> command) throws IOException, InterruptedException;
}
