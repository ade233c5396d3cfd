package org.albs.exporter.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Changes filesystem ownership of exported trees through a privileged helper.
 *
 * @since 0.1.0
 */
public interface OwnershipPort {

  /**
   * Assigns {@code owner:owner} to {@code path}.
   *
   * @param path file or directory
   * @param owner user and group name
   * @param recursive apply to the whole tree below {@code path}
   * @throws ToolInvocationException on a non-zero exit status or timeout
   */
  void chown(Path path, String owner, boolean recursive) throws IOException, InterruptedException;
}
