/**
 * JSON transport shared by the artifact repository and signing adapters, built on
 * {@code java.net.http} and Jackson.
 *
 * @since 0.1.0
 */
package org.albs.exporter.infrastructure.http;
