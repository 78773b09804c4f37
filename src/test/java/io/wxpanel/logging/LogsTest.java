package io.wxpanel.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void excerptCollapsesLinesAndTruncates() {
    String payload = "<html>\n<body>" + "x".repeat(400) + "</body>\n</html>";

    String excerpt = Logs.excerpt(payload);

    assertTrue(excerpt.startsWith("<html> <body>"));
    assertTrue(excerpt.contains("truncated, " + Logs.PAYLOAD_EXCERPT_BYTES + " of"));
    assertFalse(excerpt.contains("\n"));
  }

  @Test
  void truncateLeavesShortValuesAlone() {
    assertEquals("short", Logs.truncate("short", 64));
  }
}
