package org.albs.exporter.application.pipeline;

/**
 * Raised when an export selection is ambiguous, empty or names unknown catalog entries.
 *
 * <p>Always thrown before any side effect.</p>
 *
 * @since 0.1.0
 */
public class ScopeResolutionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ScopeResolutionException(String message) {
    super(message);
  }
}
