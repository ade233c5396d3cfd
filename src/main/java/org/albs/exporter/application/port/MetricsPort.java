package org.albs.exporter.application.port;

/**
 * <strong>What:</strong> Port abstracting exporter metrics emission.
 * <p><strong>Why:</strong> Lets the pipeline count exported repositories, reconciled packages and signature
 * violations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from export workers.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code export.repo.exported}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; units are defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
