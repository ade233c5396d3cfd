/**
 * Package signature verification of exported directories.
 * <p><strong>Concurrency:</strong> Verifiers are stateless; reports synchronize their own state.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.application.signature;
