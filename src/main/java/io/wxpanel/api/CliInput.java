package io.wxpanel.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Raw product arguments split into {@code key=value} settings and the three switches the panel CLI
 * understands.
 *
 * @param settings {@code key=value} tokens in command-line order, trimmed
 * @param help {@code --help}, {@code -h} or {@code help} was given
 * @param verbose {@code --verbose}, {@code -v} or {@code --debug} was given
 * @param dryRun {@code --dry-run} was given
 * @since 0.1.0
 */
public record CliInput(List<String> settings, boolean help, boolean verbose, boolean dryRun) {
  private enum Switch { HELP, VERBOSE, DRY_RUN }

  private static final Map<String, Switch> SWITCHES = Map.of(
      "--help", Switch.HELP,
      "-h", Switch.HELP,
      "help", Switch.HELP,
      "--verbose", Switch.VERBOSE,
      "-v", Switch.VERBOSE,
      "--debug", Switch.VERBOSE,
      "--dry-run", Switch.DRY_RUN);

  public CliInput {
    settings = settings == null ? List.of() : List.copyOf(settings);
  }

  /**
   * Parses the arguments following the product name.
   *
   * @param args raw arguments; {@code null} and blank entries are ignored
   * @return parsed input
   * @throws IllegalArgumentException if a dash-prefixed token is not a known switch
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    boolean dryRun = false;
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.strip();
        if (arg.isEmpty()) {
          continue;
        }
        Switch flag = SWITCHES.get(arg.toLowerCase(Locale.ROOT));
        if (flag == null) {
          if (arg.startsWith("-") && arg.indexOf('=') < 0) {
            throw new IllegalArgumentException("unknown option " + arg);
          }
          settings.add(arg);
          continue;
        }
        switch (flag) {
          case HELP -> help = true;
          case VERBOSE -> verbose = true;
          case DRY_RUN -> dryRun = true;
        }
      }
    }
    return new CliInput(settings, help, verbose, dryRun);
  }

  /**
   * Reports whether a single token asks for help.
   *
   * @param token raw argument
   * @return {@code true} for {@code --help}, {@code -h} or {@code help}
   */
  public static boolean isHelp(String token) {
    return token != null && SWITCHES.get(token.strip().toLowerCase(Locale.ROOT)) == Switch.HELP;
  }

  /** Settings as an array for {@link CliArgsParser#toMap(String[])}. */
  public String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }
}
