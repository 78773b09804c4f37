package io.wxpanel.domain.composite;

/**
 * Raised when a chart cannot be composited; the destination canvas is left unchanged.
 *
 * @since 0.1.0
 */
public final class CompositeFailedException extends Exception {
  private static final long serialVersionUID = 1L;

  public CompositeFailedException(String message) {
    super(message);
  }

  public CompositeFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
