package io.wxpanel.domain.forecast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ForecastModelTest {
  private final IssuanceTime run = new IssuanceTime("2024061012");

  @Test
  void ecmwfUrlUsesDateHourDirectoryAndPaddedStep() {
    assertEquals(
        "https://watch.ncdr.nat.gov.tw/00_Wxmap/2F7_ECMWF_0.25deg/202406/2024061012/ecwrf_rain_2024061012_f03.png",
        ForecastModel.ECMWF_WRF.imageUrl(run, ForecastModel.ECMWF_WRF.resolveStep(run, 3).orElseThrow()));
  }

  @Test
  void gfsUrlUsesFullTimestamp() {
    IssuanceTime full = new IssuanceTime("202406101200");

    assertEquals(
        "https://watch.ncdr.nat.gov.tw/00_Wxmap/5F24_NCDR_WRF_2WEEKS/202406/202406101200/rain_202406101200_f02.gif",
        ForecastModel.GFS_FNV3.imageUrl(full, "02"));
  }

  @Test
  void cwaUsesHourGatedSteps() {
    IssuanceTime morning = new IssuanceTime("2024061009");

    assertEquals(Optional.of("51"), ForecastModel.CWA_QPF.resolveStep(morning, 2));
    assertTrue(ForecastModel.CWA_QPF.resolveStep(run, 1).isEmpty());
    assertEquals(
        "https://watch.ncdr.nat.gov.tw/00_Wxmap/5F11_CWB_QPF_OFFICIAL/202406/O01_2024061009_f15_d12s.gif",
        ForecastModel.CWA_QPF.imageUrl(morning, "15"));
  }

  @Test
  void feedsShareBaseUrl() {
    assertEquals(
        Optional.of(ForecastModel.FEED_BASE + "WRF2WEEKS_RAIN"), ForecastModel.GSM_AI.feedUrl());
    assertEquals(ForecastModel.GFS_FNV3.feedUrl(), ForecastModel.GSM_AI.feedUrl());
  }

  @Test
  void aqiIsLocalOverlay() {
    assertFalse(ForecastModel.AQI.isRemote());
    assertEquals(ForecastModel.Source.LOCAL_OVERLAY, ForecastModel.AQI.source());
    assertTrue(ForecastModel.AQI.feedUrl().isEmpty());
    assertThrows(IllegalStateException.class, () -> ForecastModel.AQI.imageUrl(run, "01"));
  }

  @Test
  void fromIdIsCaseInsensitive() {
    assertEquals(ForecastModel.GSM_AI, ForecastModel.fromId(" GSM_AI "));
    assertThrows(IllegalArgumentException.class, () -> ForecastModel.fromId("nam"));
  }
}
