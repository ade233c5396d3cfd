package org.albs.exporter.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.albs.exporter.validation.Strings;

/**
 * Turns {@code key=value} arguments into a lookup map and splits list values such as
 * {@code platforms=AlmaLinux-8,AlmaLinux-9}.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw arguments; {@code null} returns an empty map
   * @return mutable map in argument order; later duplicates win
   * @throws IllegalArgumentException for a token without {@code =}, an invalid key or a control character
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      map.put(key, Strings.requireNonBlank(key, value));
    }
    return map;
  }

  /**
   * Splits a comma-separated value, dropping blank items.
   *
   * @param raw value such as {@code "x86_64, ppc64le"}; {@code null} yields an empty list
   * @return trimmed items in order
   */
  public static List<String> splitList(String raw) {
    List<String> items = new ArrayList<>();
    if (raw == null) {
      return items;
    }
    for (String token : raw.split(",")) {
      String item = token.trim();
      if (!item.isEmpty()) {
        items.add(item);
      }
    }
    return items;
  }

  /**
   * Splits a comma-separated list of identifiers.
   *
   * @param name argument name used in diagnostics
   * @param raw value such as {@code "12,15"}
   * @return parsed identifiers
   * @throws IllegalArgumentException when an item is not a positive number
   */
  public static List<Long> splitIds(String name, String raw) {
    List<Long> ids = new ArrayList<>();
    for (String item : splitList(raw)) {
      try {
        long id = Long.parseLong(item);
        if (id <= 0) {
          throw new IllegalArgumentException(name + " must contain positive ids (was " + item + ")");
        }
        ids.add(id);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(name + " must contain numeric ids (was " + item + ")", ex);
      }
    }
    return ids;
  }
}
