package org.albs.exporter.domain;

import java.util.List;
import java.util.Objects;

/**
 * User-assembled set of repositories, checked for noarch consistency on demand.
 *
 * @param id catalog identifier
 * @param name distribution name
 * @param repositories member repositories
 * @since 0.1.0
 */
public record Distribution(long id, String name, List<Repository> repositories) {

  public Distribution {
    Objects.requireNonNull(name, "name");
    repositories = repositories == null ? List.of() : List.copyOf(repositories);
  }
}
