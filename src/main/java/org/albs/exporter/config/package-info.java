/**
 * Configuration loading and composition for the exporter CLI.
 * <p>Precedence is CLI {@code key=value} over YAML over built-in defaults; the merged map is bound once by
 * {@link org.albs.exporter.config.ExporterConfig#fromMap(java.util.Map)} and handed to the
 * {@link org.albs.exporter.config.CompositionRoot}.</p>
 * <p><strong>Security:</strong> Credentials are redacted whenever configuration is logged.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.config;
