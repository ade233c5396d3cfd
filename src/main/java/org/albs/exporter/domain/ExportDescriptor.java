package org.albs.exporter.domain;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Working unit threaded through the export pipeline for one repository.
 *
 * @param repository repository being exported
 * @param versionHref latest repository version handle at provisioning time
 * @param exportPath directory the snapshot is materialized into ({@code .../Packages})
 * @param exporterHref handle of the filesystem exporter created for this run
 * @param publicationHref latest publication handle, when requested
 * @since 0.1.0
 */
public record ExportDescriptor(
    Repository repository,
    String versionHref,
    Path exportPath,
    String exporterHref,
    Optional<String> publicationHref) {

  public ExportDescriptor {
    Objects.requireNonNull(repository, "repository");
    Objects.requireNonNull(versionHref, "versionHref");
    Objects.requireNonNull(exportPath, "exportPath");
    Objects.requireNonNull(exporterHref, "exporterHref");
    publicationHref = Objects.requireNonNullElse(publicationHref, Optional.empty());
  }

  public String exporterName() {
    return repository.exporterName();
  }

  /**
   * Returns the repository root containing {@code Packages} and {@code repodata}.
   *
   * @return parent of the export path
   */
  public Path repositoryDirectory() {
    Path parent = exportPath.getParent();
    return parent == null ? exportPath : parent;
  }
}
