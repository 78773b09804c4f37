package io.wxpanel.application.port;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raised at startup when a canvas background file is absent or unreadable.
 *
 * @since 0.1.0
 */
public final class MissingBackgroundException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient Path path;

  public MissingBackgroundException(Path path, String message, Throwable cause) {
    super(message, cause);
    this.path = Objects.requireNonNull(path, "path");
  }

  public Path path() {
    return path;
  }
}
