package org.albs.exporter.application.noarch;

import java.util.Locale;
import java.util.Optional;

/**
 * How the reconciliation stage treats divergent noarch content.
 *
 * @since 0.1.0
 */
public enum NoarchMode {
  /** Apply additions and replacements to destination repositories. */
  COPY,
  /** Only log what would be added or replaced. */
  CHECK,
  /** Skip reconciliation. */
  OFF;

  /**
   * Parses a configuration value.
   *
   * @param raw value such as {@code copy}; {@code null} or blank selects {@link #COPY}
   * @return parsed mode
   * @throws IllegalArgumentException for unknown values
   */
  public static NoarchMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return COPY;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("noarch.mode must be one of COPY, CHECK, OFF (was " + raw + ")", ex);
    }
  }

  /**
   * Translates the mode into reconciliation flags.
   *
   * @param differOnly only report or apply checksum divergences
   * @return flags, empty when reconciliation is disabled
   */
  public Optional<ReconcileOptions> options(boolean differOnly) {
    return switch (this) {
      case COPY -> Optional.of(new ReconcileOptions(false, differOnly));
      case CHECK -> Optional.of(new ReconcileOptions(true, differOnly));
      case OFF -> Optional.empty();
    };
  }
}
