package io.wxpanel.application.port;

import java.util.Objects;

/**
 * Raised when an issuance feed or chart image cannot be retrieved or decoded.
 *
 * @since 0.1.0
 */
public final class FetchFailedException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String url;

  public FetchFailedException(String url, String message) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
  }

  public FetchFailedException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /** URL that failed. */
  public String url() {
    return url;
  }
}
