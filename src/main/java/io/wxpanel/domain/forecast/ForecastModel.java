package io.wxpanel.domain.forecast;

import static io.wxpanel.domain.forecast.TemplateToken.XX;
import static io.wxpanel.domain.forecast.TemplateToken.YYYYMM;
import static io.wxpanel.domain.forecast.TemplateToken.YYYYMMDDHH;
import static io.wxpanel.domain.forecast.TemplateToken.YYYYMMDDHHmm;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of chart sources that can fill a panel.
 * <p><strong>Why:</strong> Each model variant differs only in its issuance feed, image URL template and
 * step resolution; an enum keeps those three facts together and lets layouts refer to a model by id.</p>
 * <p><strong>Role:</strong> Referenced by {@code UnitSpec}; consulted by the run orchestrator to decide
 * whether a unit is fetched remotely or read from a local overlay.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ForecastModel {
  CWA_QPF(
      "cwa_qpf",
      "CWB_QPF_OFFICIAL",
      "https://watch.ncdr.nat.gov.tw/00_Wxmap/5F11_CWB_QPF_OFFICIAL/{YYYYMM}/O01_{YYYYMMDDHH}_f{XX}_d12s.gif",
      EnumSet.of(YYYYMM, YYYYMMDDHH, XX),
      HourGatedStepResolver.INSTANCE),
  ECMWF_WRF(
      "ecmwf_wrf",
      "CHART_ECMWF_WRFDS",
      "https://watch.ncdr.nat.gov.tw/00_Wxmap/2F7_ECMWF_0.25deg/{YYYYMM}/{YYYYMMDDHH}/ecwrf_rain_{YYYYMMDDHH}_f{XX}.png",
      EnumSet.of(YYYYMM, YYYYMMDDHH, XX),
      StandardStepResolver.INSTANCE),
  GFS_FNV3(
      "gfs_fnv3",
      "WRF2WEEKS_RAIN",
      "https://watch.ncdr.nat.gov.tw/00_Wxmap/5F24_NCDR_WRF_2WEEKS/{YYYYMM}/{YYYYMMDDHHmm}/rain_{YYYYMMDDHHmm}_f{XX}.gif",
      EnumSet.of(YYYYMM, YYYYMMDDHHmm, XX),
      StandardStepResolver.INSTANCE),
  GSM_AI(
      "gsm_ai",
      "WRF2WEEKS_RAIN",
      "https://watch.ncdr.nat.gov.tw/00_Wxmap/2F8_JMAGSM_0.5deg/{YYYYMM}/{YYYYMMDDHH}/jmamsrn_{YYYYMMDDHH}_{XX}.png",
      EnumSet.of(YYYYMM, YYYYMMDDHH, XX),
      StandardStepResolver.INSTANCE),
  /** Pre-rendered air-quality overlay read from local storage. */
  AQI("aqi", null, null, null, null);

  /** Common prefix of every issuance-time feed. */
  public static final String FEED_BASE =
      "https://watch.ncdr.nat.gov.tw/php/list_realtime_date_csv.php?v=";

  /** Where a model's image comes from. */
  public enum Source {
    REMOTE,
    LOCAL_OVERLAY
  }

  private final String id;
  private final String feedKey;
  private final UrlTemplate template;
  private final StepResolver resolver;

  ForecastModel(
      String id, String feedKey, String template, EnumSet<TemplateToken> tokens, StepResolver resolver) {
    this.id = id;
    this.feedKey = feedKey;
    this.template = template == null ? null : new UrlTemplate(template, tokens);
    this.resolver = resolver;
  }

  /** Identifier used in layout catalogs, e.g. {@code ecmwf_wrf}. */
  public String id() {
    return id;
  }

  public Source source() {
    return template == null ? Source.LOCAL_OVERLAY : Source.REMOTE;
  }

  public boolean isRemote() {
    return source() == Source.REMOTE;
  }

  /**
   * Issuance feed URL of a remote model.
   *
   * @return feed URL, or empty for local overlays
   */
  public Optional<String> feedUrl() {
    return feedKey == null ? Optional.empty() : Optional.of(FEED_BASE + feedKey);
  }

  public Optional<UrlTemplate> template() {
    return Optional.ofNullable(template);
  }

  public Optional<StepResolver> resolver() {
    return Optional.ofNullable(resolver);
  }

  /**
   * Resolves the forecast step for a remote model.
   *
   * @param issuance issuance time
   * @param dayOffset forecast day
   * @return step token, or empty when no chart covers the day
   * @throws IllegalStateException for local overlay models
   */
  public Optional<String> resolveStep(IssuanceTime issuance, int dayOffset) {
    return requireRemote().resolver.resolve(issuance, dayOffset);
  }

  /**
   * Builds the image URL for a run and step.
   *
   * @param issuance issuance time
   * @param step resolved step token
   * @return image URL
   * @throws IllegalStateException for local overlay models
   */
  public String imageUrl(IssuanceTime issuance, String step) {
    return requireRemote().template.expand(issuance, step);
  }

  /**
   * Looks up a model by identifier, ignoring case.
   *
   * @param id identifier such as {@code gfs_fnv3}
   * @return matching model
   * @throws IllegalArgumentException when unknown
   */
  public static ForecastModel fromId(String id) {
    Objects.requireNonNull(id, "id");
    String normalized = id.trim().toLowerCase(Locale.ROOT);
    for (ForecastModel model : values()) {
      if (model.id.equals(normalized)) {
        return model;
      }
    }
    throw new IllegalArgumentException("Unknown forecast model: " + id);
  }

  private ForecastModel requireRemote() {
    if (template == null) {
      throw new IllegalStateException(id + " is not a remote model");
    }
    return this;
  }
}
