package org.albs.exporter.application.pipeline;

import java.nio.file.Path;
import java.util.Objects;
import org.albs.exporter.domain.Repository;

/**
 * Deterministic on-disk layout of exported repositories.
 *
 * <pre>
 * {exportRoot}/{exportPath}/Packages   exported packages
 * {exportRoot}/{exportPath}/repodata   repository metadata
 * </pre>
 *
 * @since 0.1.0
 */
public final class ExportLayout {
  static final String PACKAGES = "Packages";
  static final String REPODATA = "repodata";
  static final String REPOMD = "repomd.xml";
  static final String REPOMD_SIGNATURE = "repomd.xml.asc";

  private final Path exportRoot;

  public ExportLayout(Path exportRoot) {
    this.exportRoot = Objects.requireNonNull(exportRoot, "exportRoot");
  }

  public Path exportRoot() {
    return exportRoot;
  }

  /**
   * Returns the directory a repository's packages are exported into.
   *
   * @param repository repository
   * @return {@code Packages} directory under the repository's export path
   */
  public Path packagesDirectory(Repository repository) {
    String relative = repository.exportPath().replaceAll("^/+", "");
    return exportRoot.resolve(relative).resolve(PACKAGES).normalize();
  }

  public static Path repodata(Path repositoryDirectory) {
    return repositoryDirectory.resolve(REPODATA);
  }
}
