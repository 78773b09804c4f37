package io.wxpanel.domain.forecast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StepResolverTest {

  @Test
  void standardResolverPadsDayOffset() {
    IssuanceTime issuance = new IssuanceTime("2024061012");

    assertEquals(Optional.of("01"), StandardStepResolver.INSTANCE.resolve(issuance, 1));
    assertEquals(Optional.of("07"), StandardStepResolver.INSTANCE.resolve(issuance, 7));
    assertEquals(Optional.of("14"), StandardStepResolver.INSTANCE.resolve(issuance, 14));
  }

  @Test
  void standardResolverIgnoresRunHour() {
    assertEquals(
        StandardStepResolver.INSTANCE.resolve(new IssuanceTime("2024061003"), 2),
        StandardStepResolver.INSTANCE.resolve(new IssuanceTime("2024061018"), 2));
  }

  @ParameterizedTest
  @CsvSource({
      "2024061003, 1, 39",
      "2024061021, 1, 39",
      "2024061009, 1, 15",
      "2024061009, 2, 51",
      "2024061015, 1, 15",
      "2024061015, 2, 51"
  })
  void hourGatedResolverMapsPublishedRuns(String issuance, int day, String step) {
    assertEquals(Optional.of(step), HourGatedStepResolver.INSTANCE.resolve(new IssuanceTime(issuance), day));
  }

  @ParameterizedTest
  @CsvSource({
      "2024061003, 2",
      "2024061021, 2",
      "2024061009, 3",
      "2024061012, 1",
      "2024061000, 1",
      "20240610xx, 1",
      "20240610, 1"
  })
  void hourGatedResolverSkipsUncoveredDays(String issuance, int day) {
    assertTrue(HourGatedStepResolver.INSTANCE.resolve(new IssuanceTime(issuance), day).isEmpty());
  }
}
