package io.wxpanel.domain.forecast;

import java.util.Optional;

/**
 * Maps an issuance time and a day offset to the forecast-step token used in image URLs.
 *
 * <p>An empty result means no chart covers that day for the given run; callers skip the unit
 * without treating it as an error.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface StepResolver {
  /**
   * Resolves the step token.
   *
   * @param issuance issuance time of the run; must not be {@code null}
   * @param dayOffset forecast day, {@code 1} for tomorrow
   * @return step token, or empty when no chart applies
   */
  Optional<String> resolve(IssuanceTime issuance, int dayOffset);
}
