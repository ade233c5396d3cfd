package org.albs.exporter.application.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.albs.exporter.domain.Platform;
import org.albs.exporter.domain.Repository;
import org.albs.exporter.domain.SignKey;

/**
 * Selected repositories of one platform.
 *
 * @param platform owning platform
 * @param repositories every selected production repository; reconciliation pairs are built from these
 * @param exportable the subset matching the architecture filter
 * @since 0.1.0
 */
public record PlatformScope(Platform platform, List<Repository> repositories, List<Repository> exportable) {

  public PlatformScope {
    Objects.requireNonNull(platform, "platform");
    repositories = List.copyOf(repositories);
    exportable = List.copyOf(exportable);
  }

  /**
   * Returns the keys packages of this platform must be signed with.
   *
   * @return lower-cased key identifiers
   */
  public Set<String> authorizedKeys() {
    return platform.signKeys().stream()
        .map(SignKey::normalizedKeyId)
        .collect(Collectors.toUnmodifiableSet());
  }
}
