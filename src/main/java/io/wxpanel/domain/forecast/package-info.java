/**
 * Forecast models, issuance times, step resolution, and image URL templates.
 */
package io.wxpanel.domain.forecast;
