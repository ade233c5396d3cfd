/**
 * Input validation for configuration values and CLI arguments.
 * <p>Every helper throws {@link java.lang.IllegalArgumentException}, which the CLI maps to the
 * configuration-error exit code.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.validation;
