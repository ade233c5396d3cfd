package org.albs.exporter.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Release of a build into production repositories.
 *
 * <p>Only the repositories referenced by the release plan matter to the exporter; the plan lists
 * packages and, for each package, the repositories it lands in.</p>
 *
 * @param id catalog identifier
 * @param platformId platform the release belongs to
 * @param plan packages of the release plan
 * @since 0.1.0
 */
public record Release(long id, long platformId, List<PlannedPackage> plan) {

  public Release {
    plan = plan == null ? List.of() : List.copyOf(plan);
  }

  /**
   * Collects the repository identifiers touched by the plan.
   *
   * @return distinct identifiers in plan order
   */
  public List<Long> repositoryIds() {
    Set<Long> ids = new LinkedHashSet<>();
    for (PlannedPackage pkg : plan) {
      ids.addAll(pkg.repositoryIds());
    }
    return new ArrayList<>(ids);
  }

  /**
   * One package of a release plan.
   *
   * @param fullName NEVRA of the package, informational only
   * @param repositoryIds repositories the package is released into
   */
  public record PlannedPackage(String fullName, List<Long> repositoryIds) {
    public PlannedPackage {
      fullName = Objects.requireNonNullElse(fullName, "");
      repositoryIds = repositoryIds == null ? List.of() : List.copyOf(repositoryIds);
    }
  }
}
