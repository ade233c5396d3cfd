package org.albs.exporter.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Repository metadata tooling ({@code createrepo_c}, {@code modifyrepo_c}).
 *
 * @since 0.1.0
 */
public interface MetadataToolPort {

  /**
   * Regenerates the metadata of a repository directory in place.
   *
   * @param repositoryDirectory directory holding {@code Packages} and {@code repodata}
   * @param keepAllMetadata keep additional metadata (modules, comps, updateinfo) already present
   * @throws ToolInvocationException on a non-zero exit status or timeout
   */
  void regenerate(Path repositoryDirectory, boolean keepAllMetadata)
      throws IOException, InterruptedException;

  /**
   * Injects a metadata file of the given type into {@code repodata}.
   *
   * @param mdType metadata type, e.g. {@code updateinfo}
   * @param inputFile metadata document to inject
   * @param repodata target {@code repodata} directory
   * @throws ToolInvocationException on a non-zero exit status or timeout
   */
  void patch(String mdType, Path inputFile, Path repodata) throws IOException, InterruptedException;
}
