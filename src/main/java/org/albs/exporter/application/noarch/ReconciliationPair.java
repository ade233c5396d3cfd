package org.albs.exporter.application.noarch;

import java.util.Objects;
import org.albs.exporter.domain.Repository;

/**
 * Source and destination repositories reconciled together.
 *
 * @param source primary architecture repository
 * @param destination secondary architecture repository with the same debug flag
 * @since 0.1.0
 */
public record ReconciliationPair(Repository source, Repository destination) {

  public ReconciliationPair {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destination, "destination");
  }

  @Override
  public String toString() {
    return source.displayName() + " -> " + destination.displayName();
  }
}
