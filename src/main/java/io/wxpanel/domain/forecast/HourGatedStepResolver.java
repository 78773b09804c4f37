package io.wxpanel.domain.forecast;

import java.util.Objects;
import java.util.Optional;

/**
 * Step resolver for products whose lead times depend on the run hour.
 *
 * <ul>
 *   <li>Runs at 03 or 21: day 1 maps to {@code 39}; later days have no chart.</li>
 *   <li>Runs at 09 or 15: day 1 maps to {@code 15}, day 2 to {@code 51}.</li>
 *   <li>Any other hour, including a non-numeric hour field, has no chart.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class HourGatedStepResolver implements StepResolver {
  public static final HourGatedStepResolver INSTANCE = new HourGatedStepResolver();

  private HourGatedStepResolver() {}

  @Override
  public Optional<String> resolve(IssuanceTime issuance, int dayOffset) {
    Objects.requireNonNull(issuance, "issuance");
    int hour = parseHour(issuance.hourField());
    return switch (hour) {
      case 3, 21 -> dayOffset == 1 ? Optional.of("39") : Optional.empty();
      case 9, 15 -> switch (dayOffset) {
        case 1 -> Optional.of("15");
        case 2 -> Optional.of("51");
        default -> Optional.empty();
      };
      default -> Optional.empty();
    };
  }

  private static int parseHour(String field) {
    if (field.length() != 2 || !Character.isDigit(field.charAt(0)) || !Character.isDigit(field.charAt(1))) {
      return -1;
    }
    return Integer.parseInt(field);
  }

  @Override
  public String toString() {
    return "hour-gated";
  }
}
