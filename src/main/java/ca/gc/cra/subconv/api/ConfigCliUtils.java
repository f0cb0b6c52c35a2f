package ca.gc.cra.subconv.api;

import java.util.Map;

/**
 * Helpers for mixing CLI flags with map-based configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=} argument.
   *
   * @param args mutable argument map
   * @return trimmed path, or {@code null} when absent
   */
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

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
