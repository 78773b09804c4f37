package io.wxpanel.domain.forecast;

import java.util.Objects;
import java.util.Optional;

/**
 * Step resolver whose token is the day offset as a zero-padded two-digit number, for any run hour.
 *
 * @since 0.1.0
 */
public final class StandardStepResolver implements StepResolver {
  /** Shared instance; the resolver holds no state. */
  public static final StandardStepResolver INSTANCE = new StandardStepResolver();

  private StandardStepResolver() {}

  @Override
  public Optional<String> resolve(IssuanceTime issuance, int dayOffset) {
    Objects.requireNonNull(issuance, "issuance");
    if (dayOffset < 0 || dayOffset > 99) {
      return Optional.empty();
    }
    return Optional.of(String.format("%02d", dayOffset));
  }

  @Override
  public String toString() {
    return "standard";
  }
}
