package org.albs.exporter.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * PGP key authorized for a platform.
 *
 * @param keyId key identifier as stored by the signing service
 * @param platformId owning platform identifier
 * @since 0.1.0
 */
public record SignKey(String keyId, long platformId) {

  public SignKey {
    Objects.requireNonNull(keyId, "keyId");
  }

  /**
   * Returns the key identifier in the form used for comparisons against package headers.
   *
   * @return lower-cased key identifier
   */
  public String normalizedKeyId() {
    return keyId.trim().toLowerCase(Locale.ROOT);
  }
}
