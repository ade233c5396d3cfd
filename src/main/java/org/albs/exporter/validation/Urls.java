package org.albs.exporter.validation;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Validation of service endpoints (repository service, signing service, OTLP collector).
 *
 * @since 0.1.0
 */
public final class Urls {
  private Urls() {
    // Utility
  }

  /**
   * Parses an absolute http(s) URL.
   *
   * @param name parameter name used in diagnostics
   * @param raw candidate URL
   * @return parsed URI
   * @throws IllegalArgumentException if the value is not an http(s) URL with a host
   */
  public static URI requireHttpUrl(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    URI uri;
    try {
      uri = new URI(text);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException(name + " must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host");
    }
    return uri;
  }
}
