package org.albs.exporter.application.pipeline;

import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.application.noarch.ReconcileOptions;
import org.albs.exporter.application.signature.KnownSubkeys;

/**
 * Run-wide knobs of the export pipeline.
 *
 * @param layout export directory layout
 * @param includePublications also look up the latest publication of each repository version
 * @param noarch reconciliation flags, empty to skip reconciliation
 * @param knownSubkeys known subkey delegation for signature verification
 * @since 0.1.0
 */
public record ExportSettings(
    ExportLayout layout,
    boolean includePublications,
    Optional<ReconcileOptions> noarch,
    KnownSubkeys knownSubkeys) {

  public ExportSettings {
    Objects.requireNonNull(layout, "layout");
    noarch = Objects.requireNonNullElse(noarch, Optional.empty());
    knownSubkeys = Objects.requireNonNullElse(knownSubkeys, KnownSubkeys.empty());
  }
}
