package io.wxpanel.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation helpers for CLI and configuration values.
 * <p><strong>Role:</strong> Used by configuration parsing and the layout catalog loader.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern FILE_NAME = Pattern.compile("^[A-Za-z0-9._ -]+$");

  private Strings() {
    // Utility
  }

  /**
   * Trims a value and rejects blanks or control characters.
   *
   * @param name value name used in error messages
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a bare file name (no directory separators, no {@code ..}).
   *
   * @param name value name used in error messages
   * @param value candidate file name
   * @return trimmed file name
   * @throws IllegalArgumentException if the value is not a plain file name
   */
  public static String requireFileName(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!FILE_NAME.matcher(trimmed).matches() || trimmed.equals(".") || trimmed.equals("..")) {
      throw new IllegalArgumentException(message(name,
          "must be a plain file name of letters, digits, space, dot, underscore, or hyphen"));
    }
    return trimmed;
  }

  /**
   * Validates printable ASCII within a length limit.
   *
   * @param name value name used in error messages
   * @param value raw value
   * @param maxLength maximum allowed length
   * @return trimmed value
   * @throws IllegalArgumentException if too long or containing non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
