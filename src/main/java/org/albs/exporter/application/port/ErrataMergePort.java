package org.albs.exporter.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Merges errata of a primary architecture into the errata of a secondary architecture.
 *
 * @since 0.1.0
 */
public interface ErrataMergePort {

  /**
   * Writes the merged {@code updateinfo} document.
   *
   * @param sourceUpdateInfo primary architecture {@code updateinfo.xml}, plain or gzip-compressed
   * @param targetRepodata {@code repodata} directory of the secondary architecture
   * @param output file the merged document is written to
   * @throws IOException when a document cannot be read, parsed or written
   */
  void merge(Path sourceUpdateInfo, Path targetRepodata, Path output) throws IOException;
}
