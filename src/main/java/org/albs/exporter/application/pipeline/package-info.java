/**
 * Export run orchestration: scope resolution, exporter provisioning, snapshot export, noarch
 * reconciliation, hardening and metadata signing.
 * <p><strong>Concurrency:</strong> Per-repository units run on a bounded pool; work on one directory is
 * serialized through {@link org.albs.exporter.application.pipeline.OwnershipLeases}.</p>
 * <p><strong>Logging:</strong> Unit log lines carry the repository under the {@code repo} MDC key.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.application.pipeline;
