package org.albs.exporter.application.pipeline;

import static org.albs.exporter.testutil.Fixtures.noarch;
import static org.albs.exporter.testutil.Fixtures.repo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.albs.exporter.application.noarch.NoarchReconciler;
import org.albs.exporter.application.noarch.NoarchSyncUseCase;
import org.albs.exporter.application.noarch.ReconcileOptions;
import org.albs.exporter.domain.Distribution;
import org.albs.exporter.domain.PackageRecord;
import org.albs.exporter.domain.Repository;
import org.albs.exporter.testutil.InMemoryArtifactRepository;
import org.albs.exporter.testutil.StaticCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DistributionNoarchUseCaseTest {
  private final Repository x86 = repo(1, "almalinux-9-devel", "x86_64");
  private final Repository arm = repo(2, "almalinux-9-devel", "aarch64");
  private final Repository src = repo(3, "almalinux-9-devel", "src");
  private final PackageRecord pkg = noarch("python3-six", "1.15.0", "9.el9", "c1");

  private ExecutorService executor;
  private InMemoryArtifactRepository repository;
  private DistributionNoarchUseCase useCase;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    repository = new InMemoryArtifactRepository()
        .withRepository(x86.pulpHref(), pkg)
        .withRepository(arm.pulpHref())
        .withRepository(src.pulpHref());
    StaticCatalog catalog = new StaticCatalog(List.of(), List.of(),
        List.of(new Distribution(7, "almalinux-9-devel", List.of(x86, arm, src))));
    useCase = new DistributionNoarchUseCase(
        catalog, new NoarchSyncUseCase(repository, new NoarchReconciler(), null, executor));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void reconcilesDistributionPairsExcludingSources() throws Exception {
    ExportReport report = useCase.run("almalinux-9-devel", Optional.of(ReconcileOptions.APPLY));

    assertEquals(ExportReport.State.SUCCEEDED, report.state());
    assertEquals(1, report.outcomes().size());
    assertEquals(List.of(pkg), repository.contentOf(arm.pulpHref()));
    assertEquals(0, repository.listingsOf(src.pulpHref()));
  }

  @Test
  void compareOnlyChangesNothing() throws Exception {
    useCase.run("almalinux-9-devel", Optional.of(ReconcileOptions.COMPARE));

    assertTrue(repository.modifications().isEmpty());
  }

  @Test
  void disabledModeSkipsWork() throws Exception {
    ExportReport report = useCase.run("almalinux-9-devel", Optional.empty());

    assertTrue(report.outcomes().isEmpty());
    assertEquals(0, repository.listingsOf(x86.pulpHref()));
  }

  @Test
  void unknownDistributionIsRejected() {
    ScopeResolutionException ex = assertThrows(ScopeResolutionException.class,
        () -> useCase.run("almalinux-10", Optional.of(ReconcileOptions.APPLY)));

    assertEquals("unknown distribution: almalinux-10", ex.getMessage());
  }
}
