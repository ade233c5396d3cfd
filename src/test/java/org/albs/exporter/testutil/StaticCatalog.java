package org.albs.exporter.testutil;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.albs.exporter.application.port.CatalogPort;
import org.albs.exporter.domain.Distribution;
import org.albs.exporter.domain.Platform;
import org.albs.exporter.domain.Release;
import org.albs.exporter.domain.Repository;

/**
 * Catalog double backed by fixed lists.
 */
public final class StaticCatalog implements CatalogPort {
  private final List<Platform> platforms;
  private final List<Release> releases;
  private final List<Distribution> distributions;

  public StaticCatalog(List<Platform> platforms, List<Release> releases, List<Distribution> distributions) {
    this.platforms = List.copyOf(platforms);
    this.releases = List.copyOf(releases);
    this.distributions = List.copyOf(distributions);
  }

  public static StaticCatalog of(Platform... platforms) {
    return new StaticCatalog(List.of(platforms), List.of(), List.of());
  }

  @Override
  public List<Platform> platforms() {
    return platforms;
  }

  @Override
  public Optional<Platform> platform(long id) {
    return platforms.stream().filter(platform -> platform.id() == id).findFirst();
  }

  @Override
  public List<Repository> repositoriesByIds(List<Long> ids) {
    List<Repository> found = new ArrayList<>();
    for (Platform platform : platforms) {
      for (Repository repo : platform.repositories()) {
        if (ids.contains(repo.id())) {
          found.add(repo);
        }
      }
    }
    return found;
  }

  @Override
  public Optional<Release> release(long id) {
    return releases.stream().filter(release -> release.id() == id).findFirst();
  }

  @Override
  public Optional<Distribution> distribution(String name) {
    return distributions.stream().filter(distribution -> distribution.name().equals(name)).findFirst();
  }
}
