package org.albs.exporter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.albs.exporter.application.noarch.NoarchReconciler;
import org.albs.exporter.application.noarch.NoarchSyncUseCase;
import org.albs.exporter.application.pipeline.DistributionNoarchUseCase;
import org.albs.exporter.application.pipeline.ExportLayout;
import org.albs.exporter.application.pipeline.ExportSettings;
import org.albs.exporter.application.pipeline.ExportUseCase;
import org.albs.exporter.application.pipeline.OwnershipLeases;
import org.albs.exporter.application.pipeline.RepomdSigner;
import org.albs.exporter.application.pipeline.RepositoryHardening;
import org.albs.exporter.application.pipeline.ScopeResolver;
import org.albs.exporter.application.port.ArtifactRepositoryPort;
import org.albs.exporter.application.port.CatalogPort;
import org.albs.exporter.application.port.MetricsPort;
import org.albs.exporter.application.port.SigningPort;
import org.albs.exporter.application.signature.SignatureVerifier;
import org.albs.exporter.infrastructure.catalog.JsonCatalogAdapter;
import org.albs.exporter.infrastructure.errorlog.FileExportErrorLog;
import org.albs.exporter.infrastructure.exec.ExecutorFactories;
import org.albs.exporter.infrastructure.http.JsonHttpClient;
import org.albs.exporter.infrastructure.metadata.UpdateInfoMerger;
import org.albs.exporter.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.albs.exporter.infrastructure.pulp.PulpArtifactRepositoryAdapter;
import org.albs.exporter.infrastructure.sign.SignServerAdapter;
import org.albs.exporter.infrastructure.tools.CommandRunner;
import org.albs.exporter.infrastructure.tools.CreaterepoMetadataAdapter;
import org.albs.exporter.infrastructure.tools.Privilege;
import org.albs.exporter.infrastructure.tools.ProcessRunner;
import org.albs.exporter.infrastructure.tools.RpmPackageInspectorAdapter;
import org.albs.exporter.infrastructure.tools.SudoOwnershipAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the export and noarch use cases to concrete adapters.
 * <p><strong>Why:</strong> One place translates {@link ExporterConfig} into service clients, tool runners and
 * the worker pool; the CLI only asks for use cases.</p>
 * <p><strong>Lifecycle:</strong> Owns the worker pool and the metrics adapter; {@link #close()} shuts both
 * down.</p>
 * <p><strong>Thread-safety:</strong> Built and used on the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final long SHUTDOWN_SECONDS = 30;

  private final ExporterConfig config;
  private final MetricsPort metrics;
  private final ObjectMapper mapper;
  private final HttpClient httpClient;
  private final ExecutorService executor;
  private CatalogPort catalog;
  private ArtifactRepositoryPort artifactRepository;

  public CompositionRoot(ExporterConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  public CompositionRoot(ExporterConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(config.httpTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    this.executor = ExecutorFactories.newWorkerPool(config.workers(), "exporter-worker",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    log.debug("Effective configuration: {}", config);
  }

  public ExporterConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the catalog snapshot, loading it on first use.
   *
   * @return catalog view
   * @throws IOException when the snapshot cannot be read
   */
  public CatalogPort catalog() throws IOException {
    if (catalog == null) {
      catalog = JsonCatalogAdapter.load(config.catalogPath(), mapper);
    }
    return catalog;
  }

  public ScopeResolver scopeResolver() throws IOException {
    return new ScopeResolver(catalog());
  }

  /**
   * Builds the export pipeline.
   *
   * @return export use case
   * @throws IOException when the catalog or subkey file cannot be read
   * @throws IllegalArgumentException when {@code sign.url} is not configured
   */
  public ExportUseCase exportUseCase() throws IOException {
    SigningPort signing = signing();
    CommandRunner runner = new ProcessRunner(config.toolTimeout());
    Privilege privilege = config.useSudo() ? Privilege.SUDO : Privilege.NONE;

    RepositoryHardening hardening = new RepositoryHardening(
        new OwnershipLeases(new SudoOwnershipAdapter(runner, privilege), config.operator(), config.serviceOwner()),
        new CreaterepoMetadataAdapter(runner),
        new UpdateInfoMerger(),
        new SignatureVerifier(new RpmPackageInspectorAdapter(runner, privilege), metrics),
        new FileExportErrorLog(config.errorLog(), Clock.systemUTC()),
        new RepomdSigner(signing, metrics));

    ExportSettings settings = new ExportSettings(
        new ExportLayout(config.exportRoot()),
        config.includePublications(),
        config.noarchMode().options(config.differOnly()),
        KnownSubkeysLoader.load(config.knownSubkeys(), mapper));

    return new ExportUseCase(
        scopeResolver(),
        artifactRepository(),
        noarchSync(),
        hardening,
        signing,
        settings,
        executor,
        metrics);
  }

  public DistributionNoarchUseCase distributionNoarchUseCase() throws IOException {
    return new DistributionNoarchUseCase(catalog(), noarchSync());
  }

  private NoarchSyncUseCase noarchSync() {
    return new NoarchSyncUseCase(artifactRepository(), new NoarchReconciler(), metrics, executor);
  }

  private ArtifactRepositoryPort artifactRepository() {
    if (artifactRepository == null) {
      String credentials = config.pulpUser() + ":" + config.pulpPassword();
      String basic = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
      JsonHttpClient http = new JsonHttpClient(
          "pulp", config.pulpUrl(), httpClient, mapper, config.httpTimeout(), Optional.of(basic));
      artifactRepository = new PulpArtifactRepositoryAdapter(http, config.pollInterval(), config.taskTimeout());
    }
    return artifactRepository;
  }

  private SigningPort signing() {
    Optional<String> bearer = Optional.of(config.signToken())
        .filter(token -> !token.isBlank())
        .map(token -> "Bearer " + token);
    JsonHttpClient http = new JsonHttpClient(
        "sign",
        config.signUrl().orElseThrow(() -> new IllegalArgumentException("sign.url is required for export")),
        httpClient,
        mapper,
        config.httpTimeout(),
        bearer);
    return new SignServerAdapter(http);
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Worker pool did not terminate within {} seconds; forcing shutdown", SHUTDOWN_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }
}
