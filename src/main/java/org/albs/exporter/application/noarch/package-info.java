/**
 * Noarch package reconciliation between the primary architecture and its sibling repositories.
 *
 * @since 0.1.0
 */
package org.albs.exporter.application.noarch;
