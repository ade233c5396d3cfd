package org.albs.exporter.application.pipeline;

/**
 * Outcome of signing one repository's metadata.
 *
 * @since 0.1.0
 */
public enum SigningStatus {
  SIGNED,
  FAILED,
  SKIPPED
}
