package org.albs.exporter.domain;

import java.util.Objects;

/**
 * <strong>What:</strong> One exportable RPM repository as recorded by the build platform.
 * <p><strong>Why:</strong> Carries the attributes that decide whether, where and against which siblings a
 * repository is exported.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param id catalog identifier
 * @param name human repository name (e.g., {@code almalinux-8-baseos})
 * @param arch CPU architecture ({@code x86_64}, {@code ppc64le}, {@code src}, ...)
 * @param debug whether this is the debug-symbol variant
 * @param production only production repositories are exportable
 * @param exportPath export subpath below the configured export root
 * @param pulpHref opaque handle of the repository in the artifact repository service
 * @param platformId owning platform identifier
 * @since 0.1.0
 */
public record Repository(
    long id,
    String name,
    String arch,
    boolean debug,
    boolean production,
    String exportPath,
    String pulpHref,
    long platformId) {

  public Repository {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(arch, "arch");
    Objects.requireNonNull(pulpHref, "pulpHref");
    exportPath = exportPath == null ? "" : exportPath;
  }

  /**
   * Returns the filesystem exporter name registered in the artifact repository service.
   *
   * @return {@code name-arch} or {@code name-arch-debug} for debug repositories
   */
  public String exporterName() {
    return debug ? name + '-' + arch + "-debug" : name + '-' + arch;
  }

  /**
   * Returns the name used when logging reconciliation decisions.
   *
   * @return {@code name-arch} or {@code name-debuginfo-arch} for debug repositories
   */
  public String displayName() {
    return name + '-' + (debug ? "debuginfo-" : "") + arch;
  }

  public boolean isArch(String candidate) {
    return arch.equals(candidate);
  }
}
