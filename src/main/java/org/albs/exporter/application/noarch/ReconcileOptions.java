package org.albs.exporter.application.noarch;

/**
 * Flags steering a reconciliation pass.
 *
 * @param compareOnly compute and log decisions without modifying any repository
 * @param differOnly ignore packages missing from the destination; only checksum divergences count
 * @since 0.1.0
 */
public record ReconcileOptions(boolean compareOnly, boolean differOnly) {

  public static final ReconcileOptions APPLY = new ReconcileOptions(false, false);
  public static final ReconcileOptions COMPARE = new ReconcileOptions(true, false);
}
