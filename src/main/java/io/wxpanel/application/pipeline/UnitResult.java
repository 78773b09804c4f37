package io.wxpanel.application.pipeline;

import java.util.Objects;

/**
 * Outcome of one unit with a short human-readable detail (URL, step, or error message).
 *
 * @param unitId unit identifier
 * @param outcome final state
 * @param detail context for logs and reports; never {@code null}
 * @since 0.1.0
 */
public record UnitResult(String unitId, UnitOutcome outcome, String detail) {
  public UnitResult {
    Objects.requireNonNull(unitId, "unitId");
    Objects.requireNonNull(outcome, "outcome");
    detail = detail == null ? "" : detail;
  }
}
