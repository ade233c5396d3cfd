package org.albs.exporter.application.signature;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the signing key identifier from {@code rpm -qip} output.
 *
 * <p>Recognizes both {@code Signature : RSA/SHA256, <date>, Key ID 51d6647ec21ad6ea} and
 * {@code Signature : (none)}; the latter yields the identifier {@code none}.</p>
 *
 * @since 0.1.0
 */
public final class SignatureLineParser {
  /** Identifier reported for unsigned packages. */
  public static final String UNSIGNED = "none";

  private static final String PREFIX = "Signature";
  private static final Pattern KEY_ID =
      Pattern.compile("Signature[\\s:]+(?:.*Key ID\\s+)?\\(?(\\w+)\\)?", Pattern.CASE_INSENSITIVE);

  private SignatureLineParser() {}

  /**
   * Finds the signature header line.
   *
   * @param output header query output
   * @return first trimmed line starting with {@code Signature}
   */
  public static Optional<String> signatureLine(String output) {
    if (output == null || output.isEmpty()) {
      return Optional.empty();
    }
    return output.lines()
        .map(String::trim)
        .filter(line -> line.startsWith(PREFIX))
        .findFirst();
  }

  /**
   * Parses the key identifier out of a signature line.
   *
   * @param line signature header line
   * @return lower-cased key identifier, {@link #UNSIGNED} for unsigned packages
   */
  public static Optional<String> keyId(String line) {
    if (line == null) {
      return Optional.empty();
    }
    Matcher matcher = KEY_ID.matcher(line);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(matcher.group(1).toLowerCase(Locale.ROOT));
  }
}
