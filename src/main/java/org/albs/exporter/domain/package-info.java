/**
 * Domain records describing platforms, repositories, releases and the transient values threaded
 * through an export run.
 * <p><strong>Concurrency:</strong> Records are immutable; {@link org.albs.exporter.domain.ViolationReport}
 * synchronizes its own accumulation.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.domain;
