/**
 * Adapters over local command-line tools: metadata generation, package header queries and
 * ownership changes.
 * <p><strong>Concurrency:</strong> Each call spawns its own process; adapters hold no mutable state.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.infrastructure.tools;
