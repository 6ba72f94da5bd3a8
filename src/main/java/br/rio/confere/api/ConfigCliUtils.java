package br.rio.confere.api;

import br.rio.confere.config.ConfigMerger;
import br.rio.confere.config.DefaultsForMode;
import br.rio.confere.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
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
   * Loads the optional YAML file and merges it with CLI arguments and mode defaults.
   *
   * @param mode CLI mode (run, resume, conformity)
   * @param kv CLI key/value arguments; {@code config} is consumed
   * @param log logger receiving override warnings
   * @return effective configuration
   * @throws IllegalArgumentException when the file is missing, invalid, unreadable, or validation fails
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> kv, Logger log) {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IOException ex) {
        throw new IllegalArgumentException("unable to read configuration file " + yamlPath + ": " + ex.getMessage(), ex);
      }
      log.debug("Loaded {} settings from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    return parseBoolean(map, key, false);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim().toLowerCase(Locale.ROOT));
  }
}
