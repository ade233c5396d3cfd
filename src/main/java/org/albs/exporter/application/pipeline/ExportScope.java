package org.albs.exporter.application.pipeline;

import java.util.List;
import java.util.Optional;
import org.albs.exporter.domain.Repository;

/**
 * Resolved export scope grouped per platform.
 *
 * @param platforms platform scopes in catalog order
 * @since 0.1.0
 */
public record ExportScope(List<PlatformScope> platforms) {

  public ExportScope {
    platforms = List.copyOf(platforms);
  }

  public List<Repository> exportable() {
    return platforms.stream().flatMap(scope -> scope.exportable().stream()).toList();
  }

  public Optional<PlatformScope> scopeOf(Repository repository) {
    return platforms.stream()
        .filter(scope -> scope.platform().id() == repository.platformId())
        .findFirst();
  }
}
