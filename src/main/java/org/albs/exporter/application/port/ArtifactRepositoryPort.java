package org.albs.exporter.application.port;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.domain.PackageRecord;

/**
 * <strong>What:</strong> Capability interface to the content repository service (Pulp).
 * <p><strong>Why:</strong> Keeps the export and reconciliation flows free of HTTP, pagination and task
 * polling details so they can be exercised against in-memory fakes.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code PulpArtifactRepositoryAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent calls; the export pipeline
 * issues a bounded number of requests in parallel.</p>
 * <p><strong>Errors:</strong> Every method throws {@link ServiceException} when the service rejects the
 * call, {@link IOException} on transport failures and timeouts, and {@link InterruptedException} when
 * the calling worker is interrupted.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactRepositoryPort {

  /**
   * Registers a filesystem exporter writing into {@code path}.
   *
   * @param name exporter name, unique within the service
   * @param path absolute directory the exporter materializes content into
   * @return exporter handle
   */
  String createFilesystemExporter(String name, String path) throws IOException, InterruptedException;

  void deleteFilesystemExporter(String exporterHref) throws IOException, InterruptedException;

  List<FilesystemExporter> listFilesystemExporters() throws IOException, InterruptedException;

  /**
   * Returns the handle of the newest version of a repository.
   *
   * @param repositoryHref repository handle
   * @return repository version handle
   */
  String getLatestVersion(String repositoryHref) throws IOException, InterruptedException;

  /**
   * Materializes a repository version through a filesystem exporter and waits for completion.
   *
   * @param exporterHref exporter handle
   * @param versionHref repository version handle
   */
  void exportToFilesystem(String exporterHref, String versionHref) throws IOException, InterruptedException;

  /**
   * Lists packages matching the filter; implementations follow pagination to exhaustion.
   *
   * @param filter package filter
   * @return every matching package
   */
  List<PackageRecord> listPackages(PackageFilter filter) throws IOException, InterruptedException;

  /**
   * Adds and removes content in one repository version transition.
   *
   * <p>Both sets are submitted in a single request so observers never see a version with packages
   * removed but their replacements not yet added.</p>
   *
   * @param repositoryHref repository handle
   * @param add content handles to add
   * @param remove content handles to remove
   */
  void modifyContent(String repositoryHref, List<String> add, List<String> remove)
      throws IOException, InterruptedException;

  /**
   * Publishes the latest version of a repository.
   *
   * @param repositoryHref repository handle
   * @return publication handle
   */
  String createPublication(String repositoryHref) throws IOException, InterruptedException;

  /**
   * Looks up the newest publication of a repository version.
   *
   * @param versionHref repository version handle
   * @return publication handle when one exists
   */
  Optional<String> findLatestPublication(String versionHref) throws IOException, InterruptedException;

  /**
   * Registered filesystem exporter.
   *
   * @param name exporter name
   * @param href exporter handle
   */
  record FilesystemExporter(String name, String href) {
    public FilesystemExporter {
      Objects.requireNonNull(href, "href");
      name = Objects.requireNonNullElse(name, "");
    }
  }

  /**
   * Package listing filter.
   *
   * @param arch architecture to match, e.g. {@code noarch}
   * @param versionHref repository version to list
   * @param fields fields to request from the service
   */
  record PackageFilter(String arch, String versionHref, List<String> fields) {
    /** Fields required to build a {@link PackageRecord}. */
    public static final List<String> RECORD_FIELDS =
        List.of("name", "version", "release", "arch", "sha256", "pulp_href");

    public PackageFilter {
      Objects.requireNonNull(versionHref, "versionHref");
      fields = fields == null || fields.isEmpty() ? RECORD_FIELDS : List.copyOf(fields);
    }

    public static PackageFilter noarch(String versionHref) {
      return new PackageFilter("noarch", versionHref, RECORD_FIELDS);
    }
  }
}
