/**
 * Executor factories for export worker pools.
 * <p><strong>Concurrency:</strong> Pools are fixed-size; their size bounds parallel service calls and
 * external tool processes.</p>
 */
package org.albs.exporter.infrastructure.exec;
