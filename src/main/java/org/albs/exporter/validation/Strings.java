package org.albs.exporter.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings arriving from configuration and CLI input.
 * <p><strong>Why:</strong> Values such as account names end up on tool command lines; rejecting
 * unexpected characters up front keeps {@code chown} and friends from seeing option-like arguments.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Urls
 */
public final class Strings {
  private static final Pattern ACCOUNT_PATTERN = Pattern.compile("^[a-z_][a-z0-9_.-]{0,31}$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and free of control characters.
   *
   * @param name parameter name used in diagnostics; defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isISOControl(trimmed.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return trimmed;
  }

  /**
   * Validates a POSIX account name such as the export operator or service user.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate account name
   * @return validated account name
   * @throws IllegalArgumentException if the value is not a lower-case POSIX user name
   */
  public static String requireAccountName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!ACCOUNT_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must be a lower-case account name of at most 32 characters"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits the length budget.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return validated value
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
