/**
 * Read-only catalog adapter over a JSON snapshot of platforms, repositories, releases and
 * distributions.
 *
 * @since 0.1.0
 */
package org.albs.exporter.infrastructure.catalog;
