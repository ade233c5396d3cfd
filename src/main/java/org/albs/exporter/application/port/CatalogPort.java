package org.albs.exporter.application.port;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.albs.exporter.domain.Distribution;
import org.albs.exporter.domain.Platform;
import org.albs.exporter.domain.Release;
import org.albs.exporter.domain.Repository;

/**
 * Read-only view of the build platform catalog.
 *
 * @since 0.1.0
 */
public interface CatalogPort {

  /**
   * Returns every platform with its repositories and sign keys.
   *
   * @return platforms in catalog order
   */
  List<Platform> platforms() throws IOException;

  Optional<Platform> platform(long id) throws IOException;

  List<Repository> repositoriesByIds(List<Long> ids) throws IOException;

  Optional<Release> release(long id) throws IOException;

  Optional<Distribution> distribution(String name) throws IOException;
}
