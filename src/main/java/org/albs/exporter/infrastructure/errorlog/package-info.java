/**
 * File-backed error log for signature violations.
 *
 * @since 0.1.0
 */
package org.albs.exporter.infrastructure.errorlog;
