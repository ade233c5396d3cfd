package org.albs.exporter.domain;

import java.util.Objects;

/**
 * Flattened view of one package listed by the artifact repository service.
 *
 * <p>Two records describe the same package when {@link #sameNevr(PackageRecord)} holds; they carry
 * the same content only when their checksums also match.</p>
 *
 * @param name package name
 * @param version package version
 * @param release package release
 * @param arch package architecture
 * @param sha256 content checksum
 * @param href opaque content handle
 * @since 0.1.0
 */
public record PackageRecord(
    String name,
    String version,
    String release,
    String arch,
    String sha256,
    String href) {

  /** Release marker of packages built inside a module context. */
  public static final String MODULE_MARKER = ".module_el";

  public PackageRecord {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(release, "release");
    Objects.requireNonNull(href, "href");
    arch = Objects.requireNonNullElse(arch, Architectures.NOARCH);
    sha256 = Objects.requireNonNullElse(sha256, "");
  }

  public boolean isNoarch() {
    return Architectures.NOARCH.equals(arch);
  }

  public boolean isModular() {
    return release.contains(MODULE_MARKER);
  }

  public boolean sameNevr(PackageRecord other) {
    return other != null
        && name.equals(other.name)
        && version.equals(other.version)
        && release.equals(other.release);
  }

  public boolean sameContent(PackageRecord other) {
    return other != null && sha256.equals(other.sha256);
  }

  /**
   * Returns the RPM file name of the package.
   *
   * @return {@code name-version-release.arch.rpm}
   */
  public String fileName() {
    return name + '-' + version + '-' + release + '.' + arch + ".rpm";
  }
}
