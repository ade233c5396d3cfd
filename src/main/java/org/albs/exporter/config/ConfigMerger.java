package org.albs.exporter.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.albs.exporter.application.noarch.NoarchMode;

/**
 * Merges configuration from defaults, YAML and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    NoarchMode noarchMode = NoarchMode.fromString(effective.get("noarch.mode"));
    String normalized = mode.trim().toLowerCase(Locale.ROOT);

    if (DefaultsForMode.NOARCH.equals(normalized)) {
      if (trim(effective.get("distribution")).isEmpty()) {
        throw new IllegalArgumentException("distribution is required for the noarch command");
      }
      if (noarchMode == NoarchMode.OFF) {
        throw new IllegalArgumentException("noarch.mode=OFF disables the noarch command");
      }
    }

    if (DefaultsForMode.EXPORT.equals(normalized)) {
      boolean hasArches = !trim(effective.get("arches")).isEmpty();
      boolean hasRepos = !trim(effective.get("repos")).isEmpty();
      if (hasArches && !hasRepos) {
        throw new IllegalArgumentException("arches can only be combined with repos");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
