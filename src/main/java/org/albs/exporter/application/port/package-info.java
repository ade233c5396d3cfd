/**
 * Ports through which the export pipeline reaches the content repository service, the signing
 * service, the catalog, local tooling and the error log.
 * <p><strong>Role:</strong> Application boundary; adapters live under {@code infrastructure}.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.application.port;
