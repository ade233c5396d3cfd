package org.albs.exporter.domain;

/**
 * Architecture names used by the exporter when pairing and selecting repositories.
 *
 * @since 0.1.0
 */
public final class Architectures {
  /** Primary architecture; the only noarch source and the origin of errata. */
  public static final String X86_64 = "x86_64";
  /** Secondary architecture that receives errata from its {@link #X86_64} sibling. */
  public static final String PPC64LE = "ppc64le";
  /** Source-package repositories; never a reconciliation participant. */
  public static final String SRC = "src";
  /** Architecture-independent packages. */
  public static final String NOARCH = "noarch";

  private Architectures() {
    // Utility
  }
}
