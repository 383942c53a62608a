package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SENTINEL CLI dispatcher. Flags before the command are global; everything after it is handed to the command
 * untouched.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sentinel [--verbose] replay [options]";
  private static final String HELP_TEXT = """
      SENTINEL threat and alert registry

      Usage:
        sentinel [--verbose] <command> [options]

      Commands:
        replay      Apply a JSON mutation log to a fresh registry and print statistics (replay --help)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before running the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex == safeArgs.length) {
      if (global.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] commandArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    if (command.equals("replay")) {
      return ReplayCli.run(commandArgs);
    }
    log.error("Unknown command: {}", command);
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return args.length;
  }
}
