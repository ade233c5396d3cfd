/**
 * Command-line front end: the {@code export} and {@code noarch} commands and their shared argument,
 * configuration and output helpers.
 * <p>Commands return an {@link org.albs.exporter.api.ExitCode} instead of exiting so they can be driven
 * from tests.</p>
 *
 * @since 0.1.0
 */
package org.albs.exporter.api;
