package org.albs.exporter.application.noarch;

import java.util.Objects;
import org.albs.exporter.domain.PackageRecord;

/**
 * One planned change to a destination repository.
 *
 * @param kind whether the package is new to the destination or replaces a diverging copy
 * @param source source package
 * @param replaced destination package being replaced; {@code null} for additions
 * @param sourceRepository display name of the source repository
 * @param destinationRepository display name of the destination repository
 * @param compareOnly whether the decision is only reported
 * @since 0.1.0
 */
public record ReconciliationDecision(
    Kind kind,
    PackageRecord source,
    PackageRecord replaced,
    String sourceRepository,
    String destinationRepository,
    boolean compareOnly) {

  /** Kind of change. */
  public enum Kind {
    ADD,
    REPLACE
  }

  public ReconciliationDecision {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(sourceRepository, "sourceRepository");
    Objects.requireNonNull(destinationRepository, "destinationRepository");
    if (kind == Kind.REPLACE) {
      Objects.requireNonNull(replaced, "replaced");
    }
  }

  /**
   * Renders the operator-facing message for this decision.
   *
   * @return log line naming the package file and both repositories
   */
  public String message() {
    String pkg = source.name() + '-' + source.version() + '-' + source.release() + ".noarch.rpm";
    if (kind == Kind.ADD) {
      return String.format(
          "%s %s from \"%s\" repo into \"%s\" repo",
          pkg, compareOnly ? "can be added" : "added", sourceRepository, destinationRepository);
    }
    return String.format(
        "%s %s in \"%s\" repo from \"%s\" repo",
        pkg, compareOnly ? "can be replaced" : "replaced", destinationRepository, sourceRepository);
  }
}
