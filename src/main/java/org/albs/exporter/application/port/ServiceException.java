package org.albs.exporter.application.port;

import java.io.IOException;

/**
 * Raised when a remote service (artifact repository or signing service) rejects a request or
 * reports a failed task.
 *
 * @since 0.1.0
 */
public class ServiceException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String service;
  private final int statusCode;

  public ServiceException(String service, int statusCode, String message) {
    super(service + ": " + message);
    this.service = service;
    this.statusCode = statusCode;
  }

  public ServiceException(String service, String message, Throwable cause) {
    super(service + ": " + message, cause);
    this.service = service;
    this.statusCode = -1;
  }

  public String service() {
    return service;
  }

  /**
   * Returns the HTTP status reported by the service.
   *
   * @return status code, or {@code -1} when the failure was not an HTTP status
   */
  public int statusCode() {
    return statusCode;
  }
}
