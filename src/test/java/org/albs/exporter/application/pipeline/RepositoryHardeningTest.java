package org.albs.exporter.application.pipeline;

import static org.albs.exporter.application.pipeline.PipelineFakes.OPERATOR;
import static org.albs.exporter.application.pipeline.PipelineFakes.SERVICE_OWNER;
import static org.albs.exporter.testutil.Fixtures.repo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.albs.exporter.application.pipeline.PipelineFakes.FakeErrata;
import org.albs.exporter.application.pipeline.PipelineFakes.FakeMetadataTool;
import org.albs.exporter.application.pipeline.PipelineFakes.FakeSigning;
import org.albs.exporter.application.pipeline.PipelineFakes.KeyedInspector;
import org.albs.exporter.application.pipeline.PipelineFakes.RecordingErrorLog;
import org.albs.exporter.application.pipeline.PipelineFakes.RecordingOwnership;
import org.albs.exporter.application.pipeline.RepositoryHardening.HardeningResult;
import org.albs.exporter.application.signature.KnownSubkeys;
import org.albs.exporter.application.signature.SignatureVerifier;
import org.albs.exporter.domain.ExportDescriptor;
import org.albs.exporter.domain.Repository;
import org.albs.exporter.testutil.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class RepositoryHardeningTest {
  @TempDir
  Path root;

  private final RecordingOwnership ownership = new RecordingOwnership();
  private final FakeMetadataTool metadata = new FakeMetadataTool();
  private final FakeErrata errata = new FakeErrata();
  private final RecordingErrorLog errorLog = new RecordingErrorLog();
  private final FakeSigning signing = new FakeSigning();
  private RepositoryHardening hardening;
  private ExportLayout layout;

  @BeforeEach
  void setUp() {
    layout = new ExportLayout(root);
    hardening = new RepositoryHardening(
        new OwnershipLeases(ownership, OPERATOR, SERVICE_OWNER),
        metadata,
        errata,
        new SignatureVerifier(new KeyedInspector(Fixtures.SIGN_KEY), null),
        errorLog,
        new RepomdSigner(signing, null));
  }

  @Test
  void hardensPrimaryArchitectureRepository() throws Exception {
    ExportDescriptor descriptor = exported(repo(1, "BaseOS", "x86_64"), "bash-5.1-6.el9.x86_64.rpm");
    Path snippet = Files.writeString(descriptor.repositoryDirectory().resolve("comps.xml.snippet"), "");

    HardeningResult result = hardening.harden(
        descriptor, Set.of(Fixtures.SIGN_KEY), KnownSubkeys.empty(), Optional.of(Fixtures.SIGN_KEY));

    assertTrue(result.violations().isEmpty());
    assertEquals(SigningStatus.SIGNED, result.signing());
    assertFalse(Files.exists(snippet));
    assertEquals(List.of(descriptor.repositoryDirectory()), metadata.regenerated);
    assertTrue(metadata.patched.isEmpty());
    assertTrue(Files.exists(descriptor.repositoryDirectory().resolve("repodata/repomd.xml.asc")));
    assertEquals(List.of(OPERATOR + " os", SERVICE_OWNER + " os"), ownership.calls);
    assertTrue(errorLog.reports.isEmpty());
  }

  @Test
  void recordsViolationsAndStillSigns() throws Exception {
    ExportDescriptor descriptor = exported(repo(1, "BaseOS", "x86_64"),
        "bash-5.1-6.el9.x86_64.rpm", "unsigned-1.0-1.el9.x86_64.rpm");

    HardeningResult result = hardening.harden(
        descriptor, Set.of(Fixtures.SIGN_KEY), KnownSubkeys.empty(), Optional.of(Fixtures.SIGN_KEY));

    assertEquals(1, result.violations().violationCount());
    assertEquals(1, errorLog.reports.size());
    assertEquals(SigningStatus.SIGNED, result.signing());
  }

  @Test
  void mergesPrimaryErrataIntoPpc64le() throws Exception {
    ExportDescriptor x86 = exported(repo(1, "BaseOS", "x86_64"), "bash-5.1-6.el9.x86_64.rpm");
    Path x86Repodata = Files.createDirectories(x86.repositoryDirectory().resolve("repodata"));
    Path source = Files.writeString(x86Repodata.resolve("0a1b-updateinfo.xml.gz"), "");
    ExportDescriptor ppc = exported(repo(2, "BaseOS", "ppc64le"), "bash-5.1-6.el9.ppc64le.rpm");

    hardening.harden(ppc, Set.of(Fixtures.SIGN_KEY), KnownSubkeys.empty(), Optional.of(Fixtures.SIGN_KEY));

    assertEquals(List.of(source), errata.sources);
    assertEquals(List.of("updateinfo updateinfo.xml exists=true"), metadata.patched);
    assertFalse(Files.exists(ppc.repositoryDirectory().resolve("repodata/updateinfo.xml")));
  }

  @Test
  void ppc64leWithoutPrimaryErrataSkipsMerge() throws Exception {
    ExportDescriptor ppc = exported(repo(2, "BaseOS", "ppc64le"), "bash-5.1-6.el9.ppc64le.rpm");

    hardening.harden(ppc, Set.of(Fixtures.SIGN_KEY), KnownSubkeys.empty(), Optional.empty());

    assertTrue(errata.sources.isEmpty());
    assertTrue(metadata.patched.isEmpty());
  }

  @Test
  void ownershipIsReturnedWhenAStepFails() throws Exception {
    ExportDescriptor descriptor = exported(repo(1, "BaseOS", "x86_64"), "bash-5.1-6.el9.x86_64.rpm");
    RepositoryHardening failing = new RepositoryHardening(
        new OwnershipLeases(ownership, OPERATOR, SERVICE_OWNER),
        new FakeMetadataTool() {
          @Override
          public void regenerate(Path repositoryDirectory, boolean keepAllMetadata) throws IOException {
            throw new IOException("createrepo_c exited with 1");
          }
        },
        errata,
        new SignatureVerifier(new KeyedInspector(Fixtures.SIGN_KEY), null),
        errorLog,
        new RepomdSigner(signing, null));

    assertThrows(IOException.class, () -> failing.harden(
        descriptor, Set.of(Fixtures.SIGN_KEY), KnownSubkeys.empty(), Optional.of(Fixtures.SIGN_KEY)));
    assertEquals(List.of(OPERATOR + " os", SERVICE_OWNER + " os"), ownership.calls);
    assertTrue(signing.signedWith.isEmpty());
  }

  @Test
  void verificationFailureStillRegeneratesAndSigns() throws Exception {
    ExportDescriptor descriptor = exported(repo(1, "BaseOS", "x86_64"), "bash-5.1-6.el9.x86_64.rpm");
    RepositoryHardening diskFull = new RepositoryHardening(
        new OwnershipLeases(ownership, OPERATOR, SERVICE_OWNER),
        metadata,
        errata,
        new SignatureVerifier(new KeyedInspector(Fixtures.SIGN_KEY), null),
        report -> {
          throw new IOException("disk full");
        },
        new RepomdSigner(signing, null));

    HardeningResult result = diskFull.harden(
        descriptor, Set.of(Fixtures.SIGN_KEY), KnownSubkeys.empty(), Optional.of(Fixtures.SIGN_KEY));

    assertEquals(Optional.of("disk full"), result.verifyFailure());
    assertEquals(List.of(descriptor.repositoryDirectory()), metadata.regenerated);
    assertEquals(List.of(Fixtures.SIGN_KEY), signing.signedWith);
    assertEquals(SigningStatus.SIGNED, result.signing());
    assertEquals(List.of(OPERATOR + " os", SERVICE_OWNER + " os"), ownership.calls);
  }

  @Test
  @Timeout(10)
  void ppc64leMergeWaitsForPrimaryRegeneration() throws Exception {
    ExportDescriptor x86 = exported(repo(1, "BaseOS", "x86_64"), "bash-5.1-6.el9.x86_64.rpm");
    Path x86Repodata = Files.createDirectories(x86.repositoryDirectory().resolve("repodata"));
    Files.writeString(x86Repodata.resolve("0a1b-updateinfo.xml.gz"), "");
    ExportDescriptor ppc = exported(repo(2, "BaseOS", "ppc64le"), "bash-5.1-6.el9.ppc64le.rpm");

    CountDownLatch regenerating = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    FakeMetadataTool slowPrimary = new FakeMetadataTool() {
      @Override
      public void regenerate(Path repositoryDirectory, boolean keepAllMetadata) throws IOException {
        if (repositoryDirectory.equals(x86.repositoryDirectory())) {
          regenerating.countDown();
          try {
            release.await();
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", ex);
          }
        }
        super.regenerate(repositoryDirectory, keepAllMetadata);
      }
    };
    List<Path> regeneratedAtMerge = new CopyOnWriteArrayList<>();
    RepositoryHardening shared = new RepositoryHardening(
        new OwnershipLeases(ownership, OPERATOR, SERVICE_OWNER),
        slowPrimary,
        (source, targetRepodata, output) -> {
          regeneratedAtMerge.addAll(slowPrimary.regenerated);
          Files.writeString(output, "<updates/>");
        },
        new SignatureVerifier(new KeyedInspector(Fixtures.SIGN_KEY), null),
        errorLog,
        new RepomdSigner(signing, null));

    ExecutorService workers = Executors.newFixedThreadPool(2);
    try {
      Future<HardeningResult> primary = workers.submit(() -> shared.harden(
          x86, Set.of(Fixtures.SIGN_KEY), KnownSubkeys.empty(), Optional.empty()));
      assertTrue(regenerating.await(5, TimeUnit.SECONDS));
      Future<HardeningResult> secondary = workers.submit(() -> shared.harden(
          ppc, Set.of(Fixtures.SIGN_KEY), KnownSubkeys.empty(), Optional.empty()));

      assertThrows(TimeoutException.class, () -> secondary.get(300, TimeUnit.MILLISECONDS));
      assertTrue(regeneratedAtMerge.isEmpty());

      release.countDown();
      primary.get(5, TimeUnit.SECONDS);
      secondary.get(5, TimeUnit.SECONDS);
    } finally {
      release.countDown();
      workers.shutdownNow();
    }

    assertTrue(regeneratedAtMerge.contains(x86.repositoryDirectory()));
    assertEquals(1, slowPrimary.patched.size());
  }

  private ExportDescriptor exported(Repository repository, String... files) throws IOException {
    Path packages = Files.createDirectories(layout.packagesDirectory(repository));
    for (String file : files) {
      Files.writeString(packages.resolve(file), "");
    }
    return new ExportDescriptor(repository, repository.pulpHref() + "versions/1/", packages,
        "/exporters/" + repository.exporterName() + "/", Optional.empty());
  }
}
