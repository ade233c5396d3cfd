package org.albs.exporter.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private String previousExporter;
  private String previousEndpoint;

  @BeforeEach
  void remember() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    previousEndpoint = System.getProperty("otel.exporter.otlp.endpoint");
  }

  @AfterEach
  void restore() {
    restore("otel.metrics.exporter", previousExporter);
    restore("otel.exporter.otlp.endpoint", previousEndpoint);
  }

  @Test
  void publishesExporterAndEndpoint() {
    TelemetryConfigurator.configureMetrics(
        Map.of("metricsExporter", "NONE", "otelEndpoint", "http://collector:4317"));

    assertEquals("none", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
  }

  @Test
  void rejectsUnknownExporter() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("metricsExporter", "prometheus")));
  }

  @Test
  void rejectsNonHttpEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("otelEndpoint", "ftp://collector")));
  }

  private static void restore(String key, String value) {
    if (value == null) {
      System.clearProperty(key);
    } else {
      System.setProperty(key, value);
    }
  }
}
