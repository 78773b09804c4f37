package io.wxpanel.api;

import io.wxpanel.config.Product;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher: {@code wxpanel <product> [options]}.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: wxpanel <two-day|seven-day|aqi> [options]";
  private static final String HELP_TEXT = """
      wxpanel forecast infographic builder

      Usage:
        wxpanel <product> [options]

      Products:
        two-day     Four-model rain panels for tomorrow and the day after
        seven-day   ECMWF WRF rain panels for days 1 to 7
        aqi         Three-day air-quality panel from pre-rendered overlays

      Run 'wxpanel <product> --help' for product options.
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
      log.error("Missing product");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0].trim();
    if (CliInput.isHelp(command)) {
      CliPrinter.println(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    Product product;
    try {
      product = Product.fromCliName(command);
    } catch (IllegalArgumentException ex) {
      log.error("Unknown product: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return PanelCli.run(product, Arrays.copyOfRange(args, 1, args.length));
  }
}
