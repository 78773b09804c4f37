package io.wxpanel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Product.TWO_DAY,
        Optional.of(Map.of("outDir", "/yaml/out", "fetchWorkers", "2")),
        Map.of("outDir", "/cli/out"),
        DefaultsForMode.asFlatMap(Product.TWO_DAY),
        warnings::add);

    assertEquals("/cli/out", merged.get("outDir"));
    assertEquals("2", merged.get("fetchWorkers"));
    assertEquals("15000", merged.get("fetchTimeoutMillis"));
    assertTrue(warnings.contains("CLI overrides YAML for key: outDir"));
  }

  @Test
  void unknownKeysAreDroppedWithWarning() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Product.AQI, Optional.empty(), Map.of("colour", "blue"), Map.of(), warnings::add);

    assertFalse(merged.containsKey("colour"));
    assertEquals(List.of("Ignoring unknown setting for aqi: colour"), warnings);
  }
}
