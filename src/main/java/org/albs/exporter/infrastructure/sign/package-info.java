/**
 * Sign server adapter producing detached signatures of repository metadata.
 *
 * @since 0.1.0
 */
package org.albs.exporter.infrastructure.sign;
