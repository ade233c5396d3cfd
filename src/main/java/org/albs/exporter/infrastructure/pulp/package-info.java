/**
 * Pulp 3 REST adapter for exporters, repository versions, packages and publications.
 *
 * @since 0.1.0
 */
package org.albs.exporter.infrastructure.pulp;
