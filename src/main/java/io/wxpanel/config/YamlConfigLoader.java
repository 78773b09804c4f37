package io.wxpanel.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads run settings from a YAML file with a {@code common} section and one section per product.
 *
 * <pre>{@code
 * common:
 *   backgroundDir: /srv/panels/backgrounds
 *   outDir: /srv/panels/out
 * seven-day:
 *   whiteThreshold: 225
 * }</pre>
 *
 * <p>The product section overrides {@code common}. Settings are scalars; an unknown top-level section is
 * rejected so that a misspelt product name does not silently drop its settings.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final Set<String> SECTIONS = Arrays.stream(Product.values())
      .map(Product::cliName)
      .collect(Collectors.toUnmodifiableSet());

  private YamlConfigLoader() {
    // Utility
  }

  /**
   * Reads {@code common} and the product's own section.
   *
   * @param path YAML file
   * @param product product whose section overrides {@code common}
   * @return settings, or empty when the file does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML is malformed, has an unknown section, or a setting is
   *     not a scalar
   */
  public static Optional<Map<String, String>> load(Path path, Product product) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(product, "product");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(path + " must map section names to settings");
    }

    Map<String, String> settings = new LinkedHashMap<>();
    for (Object name : root.keySet()) {
      String section = String.valueOf(name).strip();
      if (!section.equals(COMMON) && !SECTIONS.contains(section)) {
        throw new IllegalArgumentException("Unknown section '" + section + "' in " + path
            + "; expected common or one of " + SECTIONS);
      }
    }
    readSection(root.get(COMMON), COMMON, settings);
    readSection(root.get(product.cliName()), product.cliName(), settings);
    return Optional.of(Map.copyOf(settings));
  }

  private static void readSection(Object node, String section, Map<String, String> target) {
    if (node == null) {
      return;
    }
    if (!(node instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException("Section " + section + " must be a mapping");
    }
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      String key = String.valueOf(entry.getKey()).strip();
      if (key.isEmpty()) {
        throw new IllegalArgumentException("Section " + section + " contains a blank key");
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(section + "." + key + " must be a single value");
      }
      target.put(key, value == null ? "" : value.toString());
    }
  }
}
