package ca.gc.cra.sentinel.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Raw CLI arguments split into dash flags and the remaining {@code key=value} or positional tokens.
 *
 * <p>{@code -h} and {@code help} are stored as {@code --help}; {@code -v} and {@code --debug} as {@code --verbose}.
 * Any other flag is kept lower-cased.</p>
 *
 * @param tokens non-flag arguments, trimmed, in order
 * @param flags normalized flags
 */
public record CliInput(List<String> tokens, Set<String> flags) {

  public CliInput {
    tokens = List.copyOf(tokens);
    flags = Set.copyOf(flags);
  }

  /**
   * @param args raw CLI arguments (may be {@code null})
   * @return split arguments
   */
  public static CliInput parse(String[] args) {
    List<String> tokens = new ArrayList<>();
    Set<String> flags = new TreeSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String flag = normalizeFlag(arg);
      if (flag == null) {
        tokens.add(arg);
      } else {
        flags.add(flag);
      }
    }
    return new CliInput(tokens, flags);
  }

  private static String normalizeFlag(String arg) {
    String lower = arg.toLowerCase(Locale.ROOT);
    switch (lower) {
      case "help", "-h", "--help":
        return "--help";
      case "-v", "--verbose", "--debug":
        return "--verbose";
      default:
        return lower.startsWith("-") && lower.indexOf('=') < 0 ? lower : null;
    }
  }

  /**
   * @return the non-flag arguments as a fresh array
   */
  public String[] keyValueArgs() {
    return tokens.toArray(new String[0]);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * @param flag flag such as {@code --strict}, matched case-insensitively
   * @return whether it was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
