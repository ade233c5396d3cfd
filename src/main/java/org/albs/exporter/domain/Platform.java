package org.albs.exporter.domain;

import java.util.List;
import java.util.Objects;

/**
 * Groups repositories and the keys authorized to sign their packages.
 *
 * @param id catalog identifier
 * @param name platform name (e.g., {@code AlmaLinux-8})
 * @param reference reference platforms are excluded from export selection
 * @param repositories repositories owned by the platform
 * @param signKeys keys authorized for the platform
 * @since 0.1.0
 */
public record Platform(
    long id,
    String name,
    boolean reference,
    List<Repository> repositories,
    List<SignKey> signKeys) {

  public Platform {
    Objects.requireNonNull(name, "name");
    repositories = repositories == null ? List.of() : List.copyOf(repositories);
    signKeys = signKeys == null ? List.of() : List.copyOf(signKeys);
  }
}
