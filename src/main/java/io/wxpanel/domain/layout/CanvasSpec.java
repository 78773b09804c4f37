package io.wxpanel.domain.layout;

import java.util.Objects;

/**
 * Background canvas of a product: the file it is loaded from and the file it is saved to.
 *
 * @param id canvas identifier referenced by units
 * @param background background file name, relative to the background directory
 * @param output output file name, relative to the output directory
 * @since 0.1.0
 */
public record CanvasSpec(String id, String background, String output) {
  public CanvasSpec {
    id = requireText(id, "id");
    background = requireText(background, "background");
    output = requireText(output, "output");
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("canvas " + name + " must not be blank");
    }
    return trimmed;
  }
}
