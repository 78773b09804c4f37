package io.wxpanel.domain.forecast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IssuanceTimeTest {

  @Test
  void feedPayloadSecondFieldIsTheTimestamp() {
    IssuanceTime time = IssuanceTime.fromFeedPayload("  WRF2WEEKS_RAIN, 202406101200 ,extra\n").orElseThrow();

    assertEquals("202406101200", time.full());
    assertEquals("202406", time.yearMonth());
    assertEquals("2024061012", time.dateHour());
    assertEquals("12", time.hourField());
  }

  @Test
  void payloadWithoutSecondFieldYieldsNothing() {
    assertTrue(IssuanceTime.fromFeedPayload("CHART_ECMWF_WRFDS").isEmpty());
    assertTrue(IssuanceTime.fromFeedPayload("a, ,b").isEmpty());
    assertTrue(IssuanceTime.fromFeedPayload("").isEmpty());
    assertTrue(IssuanceTime.fromFeedPayload(null).isEmpty());
  }

  @Test
  void shortTimestampsAreSlicedToAvailableLength() {
    IssuanceTime time = new IssuanceTime("20246");

    assertEquals("20246", time.yearMonth());
    assertEquals("20246", time.dateHour());
    assertEquals("", time.hourField());
  }

  @Test
  void blankTextIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new IssuanceTime("  "));
  }
}
