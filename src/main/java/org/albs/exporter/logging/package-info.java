/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize service payloads before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe from export workers.</p>
 * <p><strong>Security:</strong> {@link org.albs.exporter.logging.Logs#redact(String)} keeps service credentials
 * out of logs.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.logging;
