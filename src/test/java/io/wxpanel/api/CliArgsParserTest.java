package io.wxpanel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {" outDir = /tmp/out ", "whiteThreshold=200", ""});

    assertEquals("/tmp/out", map.get("outDir"));
    assertEquals("200", map.get("whiteThreshold"));
    assertEquals(2, map.size());
  }

  @Test
  void valuesMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=site=taipei,env=prod"});

    assertEquals("site=taipei,env=prod", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsBareWordsAndBadKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"two-day"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out dir=x"}));
  }

  @Test
  void lastDuplicateWins() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"fetchWorkers=2", "fetchWorkers=4"});

    assertEquals("4", map.get("fetchWorkers"));
  }

  @Test
  void cliInputSeparatesSwitchesFromSettings() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "outDir=/x", "-v"});

    assertTrue(input.dryRun());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertEquals(List.of("outDir=/x"), input.settings());
  }

  @Test
  void cliInputRejectsUnknownOption() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> CliInput.parse(new String[] {"--allow-overwrite"}));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
  }

  @Test
  void helpTokensAreCaseInsensitive() {
    assertTrue(CliInput.isHelp(" HELP "));
    assertTrue(CliInput.isHelp("-h"));
    assertFalse(CliInput.isHelp("two-day"));
    assertFalse(CliInput.isHelp(null));
  }
}
