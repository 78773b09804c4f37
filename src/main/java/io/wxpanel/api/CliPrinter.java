package io.wxpanel.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Console output for help text, dry-run plans and run summaries. Diagnostics go through SLF4J instead.
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter CONSOLE = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> TARGET = new AtomicReference<>(CONSOLE);

  private CliPrinter() {
    // Utility
  }

  /** Prints one line, or a multi-line block with trailing blank lines removed. */
  public static void println(String text) {
    PrintWriter out = TARGET.get();
    out.println(text == null ? "" : text.stripTrailing());
    out.flush();
  }

  /**
   * Prints a plan or report, one entry per line, and flushes once at the end.
   *
   * @param lines lines to print; {@code null} entries print as blank lines
   */
  public static void printLines(List<String> lines) {
    if (lines == null || lines.isEmpty()) {
      return;
    }
    PrintWriter out = TARGET.get();
    for (String line : lines) {
      out.println(line == null ? "" : line);
    }
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    TARGET.set(writer == null ? CONSOLE : writer);
  }

  static void clearTestWriter() {
    TARGET.set(CONSOLE);
  }
}
