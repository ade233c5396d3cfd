package org.albs.exporter.api;

import java.util.Locale;
import java.util.Map;
import org.albs.exporter.validation.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code metricsExporter} and {@code otelEndpoint} settings to the JVM before the metrics
 * adapter is bootstrapped.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Publishes telemetry settings as OpenTelemetry system properties.
   *
   * @param settings effective configuration
   * @throws IllegalArgumentException when the exporter or endpoint is invalid
   */
  static void configureMetrics(Map<String, String> settings) {
    if (settings == null || settings.isEmpty()) {
      return;
    }
    String exporter = settings.get("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = settings.get("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String validated = Urls.requireHttpUrl("otelEndpoint", endpoint).toString();
      log.debug("Configuring OTLP endpoint: {}", validated);
      System.setProperty("otel.exporter.otlp.endpoint", validated);
    }
  }
}
