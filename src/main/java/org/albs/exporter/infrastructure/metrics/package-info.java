/**
 * OpenTelemetry metrics adapter for the exporter.
 * <p><strong>Concurrency:</strong> Instruments are cached per key and safe for concurrent export workers.</p>
 * <p><strong>Observability:</strong> Every data point carries the original dotted key as the
 * {@code exporter.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.infrastructure.metrics;
