package org.albs.exporter.application.noarch;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import org.albs.exporter.application.port.ArtifactRepositoryPort;
import org.albs.exporter.application.port.ArtifactRepositoryPort.PackageFilter;
import org.albs.exporter.application.port.MetricsPort;
import org.albs.exporter.application.task.TaskGroup;
import org.albs.exporter.application.task.UnitOutcome;
import org.albs.exporter.domain.PackageRecord;
import org.albs.exporter.domain.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reconciles noarch content for a set of repository pairs against the artifact
 * repository service.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run pairs concurrently on the shared worker pool.</li>
 *   <li>List each source repository once and share the listing between its pairs.</li>
 *   <li>Submit additions and removals of a pair in one modification, then publish the destination.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One instance may serve several runs; per-run state is local to
 * {@link #run(List, ReconcileOptions)}.</p>
 * <p><strong>Metrics:</strong> {@code noarch.pairs.reconciled}, {@code noarch.packages.added},
 * {@code noarch.packages.removed}.</p>
 *
 * @since 0.1.0
 */
public final class NoarchSyncUseCase {
  static final String STAGE = "noarch";

  private static final Logger log = LoggerFactory.getLogger(NoarchSyncUseCase.class);

  private final ArtifactRepositoryPort repository;
  private final NoarchReconciler reconciler;
  private final MetricsPort metrics;
  private final ExecutorService executor;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The worker pool is owned by the composition root and shared across use cases.")
  public NoarchSyncUseCase(
      ArtifactRepositoryPort repository,
      NoarchReconciler reconciler,
      MetricsPort metrics,
      ExecutorService executor) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Reconciles every pair.
   *
   * @param pairs pairs to reconcile
   * @param options reconciliation flags
   * @return one outcome per pair in input order
   * @throws InterruptedException when the run is interrupted
   */
  public List<UnitOutcome> run(List<ReconciliationPair> pairs, ReconcileOptions options)
      throws InterruptedException {
    Objects.requireNonNull(pairs, "pairs");
    Objects.requireNonNull(options, "options");
    if (pairs.isEmpty()) {
      log.info("No noarch pairs to reconcile");
      return List.of();
    }
    SourceListings listings = new SourceListings();
    TaskGroup group = new TaskGroup(executor, STAGE);
    for (ReconciliationPair pair : pairs) {
      group.submit(pair.toString(), () -> reconcilePair(pair, options, listings));
    }
    return group.awaitAll();
  }

  private void reconcilePair(ReconciliationPair pair, ReconcileOptions options, SourceListings listings)
      throws IOException, InterruptedException {
    Repository source = pair.source();
    Repository destination = pair.destination();
    List<PackageRecord> sourcePackages = listings.get(source);
    List<PackageRecord> destinationPackages = listNoarch(destination);

    ReconciliationPlan plan = reconciler.reconcile(
        sourcePackages,
        destinationPackages,
        source.displayName(),
        destination.displayName(),
        options);
    for (ReconciliationDecision decision : plan.decisions()) {
      log.info(decision.message());
    }
    metrics.increment("noarch.pairs.reconciled");
    if (options.compareOnly() || plan.toAdd().isEmpty()) {
      log.debug("Nothing to apply for {}", pair);
      return;
    }
    repository.modifyContent(destination.pulpHref(), plan.toAdd(), plan.toRemove());
    repository.createPublication(destination.pulpHref());
    plan.toAdd().forEach(href -> metrics.increment("noarch.packages.added"));
    plan.toRemove().forEach(href -> metrics.increment("noarch.packages.removed"));
    log.info("Applied {} additions and {} removals to {}",
        plan.toAdd().size(), plan.toRemove().size(), destination.displayName());
  }

  private List<PackageRecord> listNoarch(Repository repo) throws IOException, InterruptedException {
    String versionHref = repository.getLatestVersion(repo.pulpHref());
    return repository.listPackages(PackageFilter.noarch(versionHref));
  }

  /** Source listings shared by the pairs of one run; the first pair to ask performs the fetch. */
  private final class SourceListings {
    private final ConcurrentMap<Long, CompletableFuture<List<PackageRecord>>> listings =
        new ConcurrentHashMap<>();

    List<PackageRecord> get(Repository source) throws IOException, InterruptedException {
      CompletableFuture<List<PackageRecord>> mine = new CompletableFuture<>();
      CompletableFuture<List<PackageRecord>> existing = listings.putIfAbsent(source.id(), mine);
      if (existing == null) {
        try {
          List<PackageRecord> packages = listNoarch(source);
          mine.complete(packages);
          return packages;
        } catch (IOException | InterruptedException | RuntimeException ex) {
          mine.completeExceptionally(ex);
          throw ex;
        }
      }
      try {
        return existing.get();
      } catch (ExecutionException ex) {
        throw new IOException(
            "listing of " + source.displayName() + " failed: " + ex.getCause().getMessage(), ex.getCause());
      }
    }
  }
}
