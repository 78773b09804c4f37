package io.wxpanel.api;

import io.wxpanel.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@code key=value} settings into an ordered map.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Logger log = LoggerFactory.getLogger(CliArgsParser.class);
  private static final Pattern SETTING_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");

  private CliArgsParser() {
    // Utility
  }

  /**
   * Parses settings in order. A repeated key keeps its last value; empty values are kept so that
   * {@code whiteThreshold=} can clear a YAML setting.
   *
   * @param args {@code key=value} tokens; {@code null} and blank entries are skipped
   * @return settings keyed by name, in first-seen order
   * @throws IllegalArgumentException if a token has no {@code =}, an invalid name, or a value with
   *     control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String[] parts = raw.strip().split("=", 2);
      if (parts.length < 2) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw.strip() + "')");
      }
      String key = parts[0].strip();
      if (!SETTING_NAME.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid setting name '" + key + "'");
      }
      String value = parts[1].strip();
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      String previous = settings.put(key, value);
      if (previous != null) {
        log.debug("Setting {} given more than once; using '{}'", key, value);
      }
    }
    return settings;
  }
}
