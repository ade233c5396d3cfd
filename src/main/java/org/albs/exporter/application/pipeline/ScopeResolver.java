package org.albs.exporter.application.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.albs.exporter.application.port.CatalogPort;
import org.albs.exporter.domain.Platform;
import org.albs.exporter.domain.Release;
import org.albs.exporter.domain.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns an {@link ExportSelection} into the repositories to export.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Exactly one of platform names, repository ids or release id must be given.</li>
 *   <li>Reference platforms and non-production repositories are never selected.</li>
 *   <li>The architecture filter narrows what is exported, not what is reconciled.</li>
 *   <li>Unknown names and identifiers are errors.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the catalog.</p>
 *
 * @since 0.1.0
 */
public final class ScopeResolver {
  private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

  private final CatalogPort catalog;

  public ScopeResolver(CatalogPort catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /**
   * Resolves a selection.
   *
   * @param selection export selection
   * @return resolved scope
   * @throws ScopeResolutionException when the selection is invalid
   * @throws IOException when the catalog cannot be read
   */
  public ExportScope resolve(ExportSelection selection) throws IOException {
    Objects.requireNonNull(selection, "selection");
    int criteria = selection.criteriaCount();
    if (criteria == 0) {
      throw new ScopeResolutionException("select platforms, repositories or a release");
    }
    if (criteria > 1) {
      throw new ScopeResolutionException("platforms, repositories and release are mutually exclusive");
    }
    ExportScope scope = selection.releaseId().isPresent()
        ? resolveRelease(selection.releaseId().get())
        : resolvePlatforms(selection);
    log.debug("Resolved {} exportable repositories", scope.exportable().size());
    return scope;
  }

  private ExportScope resolvePlatforms(ExportSelection selection) throws IOException {
    List<Platform> candidates = catalog.platforms().stream()
        .filter(platform -> !platform.reference())
        .toList();

    if (!selection.platformNames().isEmpty()) {
      Set<String> known = candidates.stream().map(Platform::name).collect(Collectors.toSet());
      List<String> unknown = selection.platformNames().stream()
          .filter(name -> !known.contains(name))
          .toList();
      if (!unknown.isEmpty()) {
        throw new ScopeResolutionException("unknown platforms: " + String.join(", ", unknown));
      }
      Set<String> wanted = Set.copyOf(selection.platformNames());
      candidates = candidates.stream().filter(platform -> wanted.contains(platform.name())).toList();
    }

    Set<Long> wantedIds = new LinkedHashSet<>(selection.repositoryIds());
    if (!wantedIds.isEmpty()) {
      Set<Long> known = candidates.stream()
          .flatMap(platform -> platform.repositories().stream())
          .map(Repository::id)
          .collect(Collectors.toSet());
      List<Long> unknown = wantedIds.stream().filter(id -> !known.contains(id)).toList();
      if (!unknown.isEmpty()) {
        throw new ScopeResolutionException("unknown repositories: " + unknown);
      }
    }

    Set<String> arches = normalizedArches(selection.arches());
    List<PlatformScope> scopes = new ArrayList<>();
    for (Platform platform : candidates) {
      List<Repository> selected = platform.repositories().stream()
          .filter(Repository::production)
          .filter(repo -> wantedIds.isEmpty() || wantedIds.contains(repo.id()))
          .toList();
      if (selected.isEmpty()) {
        continue;
      }
      List<Repository> exportable = selected.stream()
          .filter(repo -> arches.isEmpty() || arches.contains(repo.arch()))
          .toList();
      scopes.add(new PlatformScope(platform, selected, exportable));
    }
    return new ExportScope(scopes);
  }

  private ExportScope resolveRelease(long releaseId) throws IOException {
    Release release = catalog.release(releaseId)
        .orElseThrow(() -> new ScopeResolutionException("unknown release: " + releaseId));
    Platform platform = catalog.platform(release.platformId())
        .orElseThrow(() -> new ScopeResolutionException(
            "release " + releaseId + " belongs to unknown platform " + release.platformId()));
    List<Repository> selected = catalog.repositoriesByIds(release.repositoryIds()).stream()
        .filter(Repository::production)
        .toList();
    if (selected.isEmpty()) {
      log.warn("Release {} references no production repositories", releaseId);
      return new ExportScope(List.of());
    }
    return new ExportScope(List.of(new PlatformScope(platform, selected, selected)));
  }

  private static Set<String> normalizedArches(List<String> arches) {
    return arches.stream()
        .map(arch -> arch.trim().toLowerCase(Locale.ROOT))
        .filter(arch -> !arch.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
  }
}
