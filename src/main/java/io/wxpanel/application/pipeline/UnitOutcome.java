package io.wxpanel.application.pipeline;

/**
 * Final state of one unit after a run.
 *
 * @since 0.1.0
 */
public enum UnitOutcome {
  /** Chart was drawn onto its canvas. */
  COMPOSITED,
  /** No forecast step covers the unit's day for the current run; not an error. */
  SKIPPED_NO_STEP,
  /** No overlay has been rendered for the unit's day. */
  SKIPPED_NO_OVERLAY,
  /** Issuance feed could not be read. */
  ISSUANCE_FAILED,
  /** Chart could not be downloaded, decoded or read. */
  FETCH_FAILED,
  /** Chart could not be composited; canvas unchanged. */
  COMPOSITE_FAILED;

  public boolean isSkip() {
    return this == SKIPPED_NO_STEP || this == SKIPPED_NO_OVERLAY;
  }

  public boolean isFailure() {
    return this == ISSUANCE_FAILED || this == FETCH_FAILED || this == COMPOSITE_FAILED;
  }
}
