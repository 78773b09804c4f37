package io.wxpanel.domain.forecast;

import java.util.Optional;

/**
 * Placeholders recognised in image URL templates.
 *
 * @since 0.1.0
 */
public enum TemplateToken {
  /** Six-digit year and month of the issuance time. */
  YYYYMM,
  /** Ten-digit date and hour of the issuance time. */
  YYYYMMDDHH,
  /** Full issuance text, including minutes where published. */
  YYYYMMDDHHmm,
  /** Forecast-step token. */
  XX;

  /**
   * Placeholder text as written in templates, e.g. {@code {YYYYMM}}.
   *
   * @return braced token name
   */
  public String placeholder() {
    return "{" + name() + "}";
  }

  /**
   * Computes the substitution value for a run.
   *
   * @param issuance issuance time
   * @param step resolved step token
   * @return replacement text
   */
  public String valueFor(IssuanceTime issuance, String step) {
    return switch (this) {
      case YYYYMM -> issuance.yearMonth();
      case YYYYMMDDHH -> issuance.dateHour();
      case YYYYMMDDHHmm -> issuance.full();
      case XX -> step;
    };
  }

  /**
   * Looks up a token by its case-sensitive name.
   *
   * @param name token name without braces
   * @return matching token, or empty when unknown
   */
  public static Optional<TemplateToken> fromName(String name) {
    for (TemplateToken token : values()) {
      if (token.name().equals(name)) {
        return Optional.of(token);
      }
    }
    return Optional.empty();
  }
}
