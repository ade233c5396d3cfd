/**
 * Repository metadata documents handled in-process, currently errata ({@code updateinfo}).
 *
 * @since 0.1.0
 */
package org.albs.exporter.infrastructure.metadata;
