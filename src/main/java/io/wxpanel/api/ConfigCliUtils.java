package io.wxpanel.api;

import java.util.Map;

/**
 * Helpers for pulling CLI-only settings out of the parsed argument map.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the YAML config path ({@code config=PATH}).
   *
   * @param args mutable argument map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  /**
   * Removes a boolean setting, e.g. {@code dryRun=true}.
   *
   * @param args mutable argument map
   * @param key setting name
   * @return parsed value, {@code false} when absent
   */
  static boolean removeBoolean(Map<String, String> args, String key) {
    if (args == null) {
      return false;
    }
    String value = args.remove(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
