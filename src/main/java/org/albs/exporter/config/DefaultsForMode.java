package org.albs.exporter.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration for each CLI command.
 *
 * <p>The defaults are the single source of truth for optional keys; YAML and CLI values override them.</p>
 */
public final class DefaultsForMode {
  /** Command exporting repositories. */
  public static final String EXPORT = "export";
  /** Command checking noarch packages across a distribution. */
  public static final String NOARCH = "noarch";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for the requested command merged with the common defaults.
   *
   * @param mode {@code export} or {@code noarch}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case EXPORT -> buildExportDefaults();
      case NOARCH -> buildNoarchDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    String home = System.getProperty("user.home", ".");
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    map.put("pulp.host", "");
    map.put("pulp.user", "");
    map.put("pulp.password", "");
    map.put("pulp.taskTimeoutSeconds", "3600");
    map.put("pulp.pollMillis", "1000");
    map.put("sign.url", "");
    map.put("sign.token", "");
    map.put("catalog.path", home + "/config/catalog.json");
    map.put("export.root", "/srv/exports");
    map.put("export.errorLog", home + "/export.err");
    map.put("export.knownSubkeys", home + "/config/known_subkeys.json");
    map.put("export.workers", "4");
    map.put("export.includePublications", "false");
    map.put("noarch.mode", "COPY");
    map.put("noarch.differOnly", "false");
    map.put("owner.operator", System.getProperty("user.name", "root"));
    map.put("owner.service", "pulp");
    map.put("http.timeoutSeconds", "300");
    map.put("tools.timeoutSeconds", "3600");
    map.put("tools.sudo", "true");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildExportDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("platforms", "");
    map.put("repos", "");
    map.put("arches", "");
    map.put("release", "");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildNoarchDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("distribution", "");
    map.put("noarch.mode", "CHECK");
    map.put("dryRun", "false");
    return map;
  }
}
