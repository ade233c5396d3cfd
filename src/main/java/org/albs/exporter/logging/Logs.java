package org.albs.exporter.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Keeps service responses, tool output and credentials log-safe.
 * <p><strong>Why:</strong> Pulp error bodies and {@code createrepo_c} diagnostics can run to megabytes, and
 * connection settings carry secrets that must never reach operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final String LINE_SEPARATOR = " | ";

  private Logs() {
    // Utility
  }

  /**
   * Cuts a value to at most {@code maxBytes} UTF-8 bytes without splitting a code point.
   *
   * @param value text to shorten; {@code null} renders as {@code "<null>"}
   * @param maxBytes UTF-8 budget; must be positive
   * @return the value itself when it fits, otherwise its prefix followed by the original size
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int totalBytes = value.getBytes(StandardCharsets.UTF_8).length;
    if (totalBytes <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int codePoint = value.codePointAt(end);
      int width = utf8Width(codePoint);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(codePoint);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + totalBytes + " bytes)";
  }

  /**
   * Folds multi-line process or service output into a single bounded log line.
   *
   * @param output captured output, may be {@code null}
   * @param maxBytes UTF-8 budget of the folded line
   * @return non-blank lines joined with {@code " | "}, truncated to {@code maxBytes}
   */
  public static String excerpt(String output, int maxBytes) {
    if (output == null || output.isBlank()) {
      return "";
    }
    String folded = output.lines()
        .map(String::strip)
        .filter(line -> !line.isEmpty())
        .reduce((left, right) -> left + LINE_SEPARATOR + right)
        .orElse("");
    return truncate(folded, maxBytes);
  }

  /**
   * Returns the placeholder logged in place of a secret.
   *
   * @param value secret value, never echoed
   * @return {@code "[REDACTED]"}, or {@code "<null>"} when nothing was configured
   */
  public static String redact(String value) {
    return value == null || value.isEmpty() ? NULL_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
