package org.albs.exporter.application.pipeline;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.application.noarch.NoarchSyncUseCase;
import org.albs.exporter.application.noarch.ReconcileOptions;
import org.albs.exporter.application.noarch.ReconciliationPair;
import org.albs.exporter.application.noarch.ReconciliationPairPlanner;
import org.albs.exporter.application.port.CatalogPort;
import org.albs.exporter.application.task.UnitOutcome;
import org.albs.exporter.domain.Architectures;
import org.albs.exporter.domain.Distribution;
import org.albs.exporter.domain.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles noarch content across the repositories of a distribution without exporting anything.
 *
 * @since 0.1.0
 */
public final class DistributionNoarchUseCase {
  private static final Logger log = LoggerFactory.getLogger(DistributionNoarchUseCase.class);

  private final CatalogPort catalog;
  private final NoarchSyncUseCase noarch;

  public DistributionNoarchUseCase(CatalogPort catalog, NoarchSyncUseCase noarch) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.noarch = Objects.requireNonNull(noarch, "noarch");
  }

  /**
   * Runs reconciliation for one distribution.
   *
   * @param name distribution name
   * @param options reconciliation flags, empty to do nothing
   * @return per-pair outcomes
   * @throws ScopeResolutionException when the distribution is unknown
   * @throws IOException when the catalog cannot be read
   * @throws InterruptedException when the run is interrupted
   */
  public ExportReport run(String name, Optional<ReconcileOptions> options)
      throws IOException, InterruptedException {
    Distribution distribution = catalog.distribution(name)
        .orElseThrow(() -> new ScopeResolutionException("unknown distribution: " + name));
    if (options.isEmpty()) {
      log.info("Noarch reconciliation disabled; nothing to do for {}", name);
      return ExportReport.empty();
    }
    List<Repository> repositories = distribution.repositories().stream()
        .filter(repo -> !repo.isArch(Architectures.SRC))
        .toList();
    List<ReconciliationPair> pairs = ReconciliationPairPlanner.plan(repositories);
    log.info("Reconciling {} pairs of distribution {}", pairs.size(), name);
    List<UnitOutcome> outcomes = noarch.run(pairs, options.get());
    return new ExportReport(outcomes, List.of(), List.of());
  }
}
