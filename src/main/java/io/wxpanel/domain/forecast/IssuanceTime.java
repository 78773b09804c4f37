package io.wxpanel.domain.forecast;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Issuance timestamp of a model run, kept as the text the feed published
 * ({@code YYYYMMDDHH} or {@code YYYYMMDDHHmm}).
 * <p><strong>Role:</strong> Supplies the slices substituted into image URL templates and the hour used by
 * hour-gated step resolution.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param text timestamp text as published; never blank
 * @implNote Slices shorter than requested are returned truncated rather than rejected; a malformed
 *     timestamp yields a URL the server will reject, which surfaces as a fetch failure.
 * @since 0.1.0
 */
public record IssuanceTime(String text) {

  public IssuanceTime {
    Objects.requireNonNull(text, "text");
    if (text.isBlank()) {
      throw new IllegalArgumentException("issuance time must not be blank");
    }
  }

  /**
   * Parses an issuance feed response body.
   *
   * <p>The body is trimmed and split on commas; the second field, trimmed, is the timestamp.</p>
   *
   * @param payload raw response body; may be {@code null}
   * @return timestamp, or empty when the body has no second field or it is blank
   */
  public static Optional<IssuanceTime> fromFeedPayload(String payload) {
    if (payload == null) {
      return Optional.empty();
    }
    String[] fields = payload.strip().split(",");
    if (fields.length < 2) {
      return Optional.empty();
    }
    String value = fields[1].strip();
    return value.isEmpty() ? Optional.empty() : Optional.of(new IssuanceTime(value));
  }

  /** First six characters, {@code YYYYMM}. */
  public String yearMonth() {
    return prefix(6);
  }

  /** First ten characters, {@code YYYYMMDDHH}. */
  public String dateHour() {
    return prefix(10);
  }

  /** Full published text. */
  public String full() {
    return text;
  }

  /** Characters 9 and 10 (the run hour), possibly shorter when the text is truncated. */
  public String hourField() {
    if (text.length() <= 8) {
      return "";
    }
    return text.substring(8, Math.min(10, text.length()));
  }

  private String prefix(int length) {
    return text.substring(0, Math.min(length, text.length()));
  }

  @Override
  public String toString() {
    return text;
  }
}
