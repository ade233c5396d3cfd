package org.albs.exporter.application.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.albs.exporter.application.pipeline.OwnershipLeases.DirectoryGuard;
import org.albs.exporter.application.pipeline.OwnershipLeases.OwnershipLease;
import org.albs.exporter.application.port.ErrataMergePort;
import org.albs.exporter.application.port.ExportErrorLog;
import org.albs.exporter.application.port.MetadataToolPort;
import org.albs.exporter.application.signature.KnownSubkeys;
import org.albs.exporter.application.signature.SignatureVerifier;
import org.albs.exporter.domain.Architectures;
import org.albs.exporter.domain.ExportDescriptor;
import org.albs.exporter.domain.ViolationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Post-export treatment of one exported repository directory.
 * <p><strong>Steps</strong>, all under an ownership lease of the repository directory:
 * <ol>
 *   <li>Delete leftover {@code *snippet} files.</li>
 *   <li>Verify package signatures and append violations to the error log; a failure here is recorded in
 *       the result and the remaining steps still run.</li>
 *   <li>Regenerate metadata, keeping additional metadata already present.</li>
 *   <li>For {@code ppc64le}, merge the {@code x86_64} errata into this repository while guarding the
 *       {@code x86_64} directory against a concurrent lease.</li>
 *   <li>Sign {@code repomd.xml}.</li>
 * </ol>
 * <p>The lease is returned on every exit path.</p>
 * <p><strong>Thread-safety:</strong> Distinct directories may be hardened concurrently; the lease
 * serializes work on the same directory.</p>
 *
 * @since 0.1.0
 */
public final class RepositoryHardening {
  static final String UPDATEINFO = "updateinfo";

  private static final Logger log = LoggerFactory.getLogger(RepositoryHardening.class);
  private static final String SNIPPET_SUFFIX = "snippet";

  private final OwnershipLeases leases;
  private final MetadataToolPort metadata;
  private final ErrataMergePort errata;
  private final SignatureVerifier verifier;
  private final ExportErrorLog errorLog;
  private final RepomdSigner signer;

  public RepositoryHardening(
      OwnershipLeases leases,
      MetadataToolPort metadata,
      ErrataMergePort errata,
      SignatureVerifier verifier,
      ExportErrorLog errorLog,
      RepomdSigner signer) {
    this.leases = Objects.requireNonNull(leases, "leases");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.errata = Objects.requireNonNull(errata, "errata");
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    this.errorLog = Objects.requireNonNull(errorLog, "errorLog");
    this.signer = Objects.requireNonNull(signer, "signer");
  }

  /**
   * Hardens one exported repository.
   *
   * @param descriptor exported repository
   * @param authorizedKeys keys the packages must be signed with
   * @param subkeys known subkey delegation
   * @param signingKey key for the metadata signature, empty to skip signing
   * @return violations, verification failure and signing outcome
   * @throws IOException when snippet removal, metadata regeneration or the errata merge fails; ownership is returned before this propagates
   * @throws InterruptedException when the worker is interrupted
   */
  public HardeningResult harden(
      ExportDescriptor descriptor,
      Set<String> authorizedKeys,
      KnownSubkeys subkeys,
      Optional<String> signingKey) throws IOException, InterruptedException {
    Path packages = descriptor.exportPath();
    Path repositoryDirectory = descriptor.repositoryDirectory();
    Path repodata = ExportLayout.repodata(repositoryDirectory);

    try (OwnershipLease lease = leases.acquire(repositoryDirectory)) {
      removeSnippets(lease.directory());

      ViolationReport report = new ViolationReport(packages, authorizedKeys);
      Optional<String> verifyFailure = Optional.empty();
      try {
        report = verifier.verify(packages, authorizedKeys, subkeys);
        errorLog.append(report);
      } catch (IOException ex) {
        log.error("Signature verification of {} failed; continuing with metadata", packages, ex);
        verifyFailure = Optional.of(
            ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
      }

      metadata.regenerate(repositoryDirectory, true);
      log.info("Metadata regenerated for {}", repositoryDirectory);

      if (descriptor.repository().isArch(Architectures.PPC64LE)) {
        mergeErrata(repodata);
      }

      SigningStatus signing = signer.sign(repodata, signingKey);
      return new HardeningResult(report, verifyFailure, signing);
    }
  }

  private void removeSnippets(Path directory) throws IOException {
    List<Path> snippets;
    try (Stream<Path> walk = Files.walk(directory)) {
      snippets = walk
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().endsWith(SNIPPET_SUFFIX))
          .collect(Collectors.toList());
    }
    for (Path snippet : snippets) {
      Files.deleteIfExists(snippet);
      log.debug("Removed {}", snippet);
    }
  }

  private void mergeErrata(Path repodata) throws IOException, InterruptedException {
    Path sourceRepodata = Path.of(
        repodata.toString().replace(Architectures.PPC64LE, Architectures.X86_64));
    if (sourceRepodata.equals(repodata)) {
      log.debug("No {} sibling for {}", Architectures.X86_64, repodata);
      return;
    }
    Path merged = repodata.resolve(UPDATEINFO + ".xml");
    Optional<Path> source;
    try {
      try (DirectoryGuard guard = leases.guard(sourceRepodata.getParent())) {
        source = findUpdateInfo(sourceRepodata);
        if (source.isEmpty()) {
          log.debug("No {} errata to merge into {}", Architectures.X86_64, repodata);
          return;
        }
        errata.merge(source.get(), repodata, merged);
      }
      metadata.patch(UPDATEINFO, merged, repodata);
      log.info("Merged errata from {} into {}", source.get(), repodata);
    } finally {
      Files.deleteIfExists(merged);
    }
  }

  private static Optional<Path> findUpdateInfo(Path repodata) throws IOException {
    if (!Files.isDirectory(repodata)) {
      return Optional.empty();
    }
    PathMatcher matcher = repodata.getFileSystem().getPathMatcher("glob:*" + UPDATEINFO + ".xml*");
    try (Stream<Path> files = Files.list(repodata)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> matcher.matches(path.getFileName()))
          .sorted()
          .findFirst();
    }
  }

  /**
   * Result of hardening one directory.
   *
   * @param violations signature violations found; empty when verification could not run
   * @param verifyFailure why verification or the error-log append failed, if it did
   * @param signing metadata signing outcome
   */
  public record HardeningResult(
      ViolationReport violations, Optional<String> verifyFailure, SigningStatus signing) {}
}
