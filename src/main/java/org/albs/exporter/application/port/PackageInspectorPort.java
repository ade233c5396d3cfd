package org.albs.exporter.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the header of a package file ({@code rpm -qip}).
 *
 * @since 0.1.0
 */
public interface PackageInspectorPort {

  /**
   * Runs the header query against one file.
   *
   * <p>A non-zero exit status is returned as data; only failures to run the tool at all surface as
   * exceptions.</p>
   *
   * @param file package file
   * @return exit status and captured output
   * @throws IOException when the tool cannot be started or times out
   * @throws InterruptedException when the calling worker is interrupted
   */
  ToolResult inspect(Path file) throws IOException, InterruptedException;
}
