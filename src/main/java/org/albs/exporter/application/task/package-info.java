/**
 * Bounded fan-out of per-repository work with per-unit failure isolation.
 *
 * @since 0.1.0
 */
package org.albs.exporter.application.task;
