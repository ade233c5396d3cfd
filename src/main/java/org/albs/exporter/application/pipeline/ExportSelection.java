package org.albs.exporter.application.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * What an export run targets: platforms by name, repositories by id, or one release.
 *
 * @param platformNames platform names
 * @param repositoryIds repository identifiers
 * @param arches architectures to export; empty exports every architecture
 * @param releaseId release identifier
 * @since 0.1.0
 */
public record ExportSelection(
    List<String> platformNames,
    List<Long> repositoryIds,
    List<String> arches,
    Optional<Long> releaseId) {

  public ExportSelection {
    platformNames = platformNames == null ? List.of() : List.copyOf(platformNames);
    repositoryIds = repositoryIds == null ? List.of() : List.copyOf(repositoryIds);
    arches = arches == null ? List.of() : List.copyOf(arches);
    releaseId = releaseId == null ? Optional.empty() : releaseId;
  }

  public static ExportSelection platforms(List<String> names) {
    return new ExportSelection(names, List.of(), List.of(), Optional.empty());
  }

  public static ExportSelection repositories(List<Long> ids, List<String> arches) {
    return new ExportSelection(List.of(), ids, arches, Optional.empty());
  }

  public static ExportSelection release(long id) {
    return new ExportSelection(List.of(), List.of(), List.of(), Optional.of(id));
  }

  /**
   * Counts how many selection criteria are set.
   *
   * @return number of non-empty criteria among platforms, repositories and release
   */
  int criteriaCount() {
    int count = 0;
    if (!platformNames.isEmpty()) {
      count++;
    }
    if (!repositoryIds.isEmpty()) {
      count++;
    }
    if (releaseId.isPresent()) {
      count++;
    }
    return count;
  }
}
