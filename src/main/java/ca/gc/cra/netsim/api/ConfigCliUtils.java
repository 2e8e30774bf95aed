package ca.gc.cra.netsim.api;

import ca.gc.cra.netsim.validation.Numbers;
import java.util.Map;

/**
 * Helpers for mixing CLI arguments with YAML/Map based configuration sources.
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
   * Reads a bounded integer option.
   *
   * @throws IllegalArgumentException when the value is not an integer in range
   */
  static int parseInt(Map<String, String> map, String key, int defaultValue, int min, int max) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return (int) Numbers.requireRange(key, Numbers.parseLong(key, value), min, max);
  }
}
