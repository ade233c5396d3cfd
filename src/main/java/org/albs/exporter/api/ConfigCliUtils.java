package org.albs.exporter.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.albs.exporter.config.ConfigMerger;
import org.albs.exporter.config.DefaultsForMode;
import org.albs.exporter.config.YamlConfigLoader;

/**
 * Shared steps of the export and noarch commands: locate the YAML file, merge it with CLI arguments and
 * defaults, read boolean switches.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Builds the effective configuration of a command.
   *
   * @param mode command name
   * @param cli CLI arguments; {@code config} is removed from the map
   * @param warn receives precedence warnings
   * @return merged settings
   * @throws IllegalArgumentException when the YAML file is missing or invalid, or validation fails
   * @throws IOException when the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli, Consumer<String> warn)
      throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
