package org.albs.exporter.application.pipeline;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.albs.exporter.application.noarch.NoarchSyncUseCase;
import org.albs.exporter.application.noarch.ReconcileOptions;
import org.albs.exporter.application.noarch.ReconciliationPairPlanner;
import org.albs.exporter.application.pipeline.RepositoryHardening.HardeningResult;
import org.albs.exporter.application.port.ArtifactRepositoryPort;
import org.albs.exporter.application.port.ArtifactRepositoryPort.FilesystemExporter;
import org.albs.exporter.application.port.MetricsPort;
import org.albs.exporter.application.port.SigningPort;
import org.albs.exporter.application.task.TaskGroup;
import org.albs.exporter.application.task.UnitOutcome;
import org.albs.exporter.domain.Architectures;
import org.albs.exporter.domain.ExportDescriptor;
import org.albs.exporter.domain.Repository;
import org.albs.exporter.domain.ViolationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Orchestrates an export run from selection to signed repository metadata.
 * <p><strong>Stages:</strong>
 * <ol>
 *   <li>Resolve the selection; invalid selections fail before any side effect.</li>
 *   <li>Replace every filesystem exporter with one per selected repository.</li>
 *   <li>Export the latest version of each repository, bounded by the worker pool.</li>
 *   <li>Reconcile noarch packages between the architectures of each platform.</li>
 *   <li>Harden and sign each exported directory; {@code ppc64le} directories run in a second wave so their
 *       errata merge reads the regenerated {@code x86_64} metadata.</li>
 * </ol>
 * <p><strong>Failure policy:</strong> A failing repository is recorded in the {@link ExportReport} and
 * skipped by later stages; its siblings continue.</p>
 * <p><strong>Thread-safety:</strong> One run at a time per instance.</p>
 * <p><strong>Metrics:</strong> {@code export.repo.exported}, {@code export.repo.failed},
 * {@code export.run.durationMillis}.</p>
 *
 * @since 0.1.0
 */
public final class ExportUseCase {
  static final String STAGE_PROVISION = "provision";
  static final String STAGE_EXPORT = "export";
  static final String STAGE_HARDEN = "harden";
  static final String STAGE_VERIFY = "verify";
  static final String STAGE_SIGN = "sign";

  private static final Logger log = LoggerFactory.getLogger(ExportUseCase.class);

  private final ScopeResolver resolver;
  private final ArtifactRepositoryPort repository;
  private final NoarchSyncUseCase noarch;
  private final RepositoryHardening hardening;
  private final SigningPort signing;
  private final ExportSettings settings;
  private final ExecutorService executor;
  private final MetricsPort metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The worker pool is owned by the composition root and shared across use cases.")
  public ExportUseCase(
      ScopeResolver resolver,
      ArtifactRepositoryPort repository,
      NoarchSyncUseCase noarch,
      RepositoryHardening hardening,
      SigningPort signing,
      ExportSettings settings,
      ExecutorService executor,
      MetricsPort metrics) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.noarch = Objects.requireNonNull(noarch, "noarch");
    this.hardening = Objects.requireNonNull(hardening, "hardening");
    this.signing = Objects.requireNonNull(signing, "signing");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Runs the pipeline.
   *
   * @param selection what to export
   * @return per-unit outcomes, violations and exported directories
   * @throws ScopeResolutionException when the selection is invalid
   * @throws IOException when the catalog cannot be read
   * @throws InterruptedException when the run is interrupted
   */
  public ExportReport run(ExportSelection selection) throws IOException, InterruptedException {
    long started = System.nanoTime();
    ExportScope scope = resolver.resolve(selection);
    if (scope.exportable().isEmpty()) {
      log.warn("Selection resolved to no exportable repositories");
      return ExportReport.empty();
    }

    List<UnitOutcome> outcomes = new ArrayList<>();
    deleteExistingExporters();
    List<ExportDescriptor> provisioned = provision(scope.exportable(), outcomes);
    List<ExportDescriptor> exported = export(provisioned, outcomes);
    reconcile(scope, outcomes);
    List<ViolationReport> violations = harden(scope, exported, outcomes);

    ExportReport report = new ExportReport(
        outcomes, violations, exported.stream().map(ExportDescriptor::exportPath).toList());
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    metrics.observe("export.run.durationMillis", elapsedMillis);
    log.info("Export finished in {} ms: {} exported, {} failed units, {} directories with violations",
        elapsedMillis, exported.size(), report.failures().size(), report.violations().size());
    return report;
  }

  private void deleteExistingExporters() throws InterruptedException {
    List<FilesystemExporter> existing;
    try {
      existing = repository.listFilesystemExporters();
    } catch (IOException ex) {
      log.error("Cannot list existing exporters: {}", ex.getMessage(), ex);
      return;
    }
    for (FilesystemExporter exporter : existing) {
      try {
        repository.deleteFilesystemExporter(exporter.href());
        log.info("Deleted exporter {}", exporter.name());
      } catch (IOException ex) {
        log.error("Cannot delete exporter {}: {}", exporter.name(), ex.getMessage());
      }
    }
  }

  private List<ExportDescriptor> provision(List<Repository> repositories, List<UnitOutcome> outcomes)
      throws InterruptedException {
    Map<Long, ExportDescriptor> descriptors = new ConcurrentHashMap<>();
    TaskGroup group = new TaskGroup(executor, STAGE_PROVISION);
    for (Repository repo : repositories) {
      group.submit(repo.exporterName(), () -> descriptors.put(repo.id(), provisionOne(repo)));
    }
    List<UnitOutcome> results = group.awaitAll();
    results.stream().filter(outcome -> !outcome.succeeded())
        .forEach(outcome -> metrics.increment("export.repo.failed"));
    outcomes.addAll(results);
    return repositories.stream()
        .map(repo -> descriptors.get(repo.id()))
        .filter(Objects::nonNull)
        .toList();
  }

  private ExportDescriptor provisionOne(Repository repo) throws IOException, InterruptedException {
    Path exportPath = settings.layout().packagesDirectory(repo);
    String exporterHref = repository.createFilesystemExporter(repo.exporterName(), exportPath.toString());
    String versionHref = repository.getLatestVersion(repo.pulpHref());
    Optional<String> publication = settings.includePublications()
        ? repository.findLatestPublication(versionHref)
        : Optional.empty();
    log.debug("Exporter {} created for {} at {}", exporterHref, versionHref, exportPath);
    return new ExportDescriptor(repo, versionHref, exportPath, exporterHref, publication);
  }

  private List<ExportDescriptor> export(List<ExportDescriptor> descriptors, List<UnitOutcome> outcomes)
      throws InterruptedException {
    TaskGroup group = new TaskGroup(executor, STAGE_EXPORT);
    for (ExportDescriptor descriptor : descriptors) {
      group.submit(descriptor.exporterName(), () -> {
        repository.exportToFilesystem(descriptor.exporterHref(), descriptor.versionHref());
        log.info("Exported {} to {}", descriptor.exporterName(), descriptor.exportPath());
      });
    }
    List<UnitOutcome> results = group.awaitAll();
    outcomes.addAll(results);
    List<ExportDescriptor> exported = new ArrayList<>();
    for (int i = 0; i < descriptors.size(); i++) {
      if (results.get(i).succeeded()) {
        metrics.increment("export.repo.exported");
        exported.add(descriptors.get(i));
      } else {
        metrics.increment("export.repo.failed");
      }
    }
    return exported;
  }

  private void reconcile(ExportScope scope, List<UnitOutcome> outcomes) throws InterruptedException {
    Optional<ReconcileOptions> options = settings.noarch();
    if (options.isEmpty()) {
      log.info("Noarch reconciliation disabled");
      return;
    }
    for (PlatformScope platformScope : scope.platforms()) {
      outcomes.addAll(noarch.run(
          ReconciliationPairPlanner.plan(platformScope.repositories()), options.get()));
    }
  }

  private List<ViolationReport> harden(
      ExportScope scope, List<ExportDescriptor> exported, List<UnitOutcome> outcomes)
      throws InterruptedException {
    SigningKeyResolver keys = new SigningKeyResolver(signing);
    List<ExportDescriptor> primary = new ArrayList<>();
    List<ExportDescriptor> secondary = new ArrayList<>();
    for (ExportDescriptor descriptor : exported) {
      (descriptor.repository().isArch(Architectures.PPC64LE) ? secondary : primary).add(descriptor);
    }
    List<ViolationReport> violations = Collections.synchronizedList(new ArrayList<>());
    List<UnitOutcome> stepOutcomes = Collections.synchronizedList(new ArrayList<>());
    outcomes.addAll(hardenWave(scope, primary, keys, violations, stepOutcomes));
    outcomes.addAll(hardenWave(scope, secondary, keys, violations, stepOutcomes));
    outcomes.addAll(stepOutcomes);
    return new ArrayList<>(violations);
  }

  private List<UnitOutcome> hardenWave(
      ExportScope scope,
      List<ExportDescriptor> wave,
      SigningKeyResolver keys,
      List<ViolationReport> violations,
      List<UnitOutcome> stepOutcomes) throws InterruptedException {
    if (wave.isEmpty()) {
      return List.of();
    }
    TaskGroup group = new TaskGroup(executor, STAGE_HARDEN);
    for (ExportDescriptor descriptor : wave) {
      String subject = descriptor.exporterName();
      group.submit(subject, () -> {
        if (!Files.isDirectory(descriptor.exportPath())) {
          throw new IOException("export directory missing: " + descriptor.exportPath());
        }
        PlatformScope platformScope = scope.scopeOf(descriptor.repository())
            .orElseThrow(() -> new IllegalStateException("no platform for " + subject));
        Optional<String> signingKey = keys.keyFor(platformScope.platform());
        HardeningResult result = hardening.harden(
            descriptor, platformScope.authorizedKeys(), settings.knownSubkeys(), signingKey);
        violations.add(result.violations());
        result.verifyFailure()
            .ifPresent(detail -> stepOutcomes.add(UnitOutcome.failed(STAGE_VERIFY, subject, detail)));
        stepOutcomes.add(toSignOutcome(subject, result.signing()));
      });
    }
    return group.awaitAll();
  }

  private static UnitOutcome toSignOutcome(String subject, SigningStatus status) {
    return switch (status) {
      case SIGNED -> UnitOutcome.ok(STAGE_SIGN, subject);
      case SKIPPED -> new UnitOutcome(STAGE_SIGN, subject, true, "no sign key");
      case FAILED -> UnitOutcome.failed(STAGE_SIGN, subject, "repomd.xml left unsigned");
    };
  }
}
