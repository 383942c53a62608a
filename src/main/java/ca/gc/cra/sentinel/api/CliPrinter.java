package ca.gc.cra.sentinel.api;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Writes usage text and replay summaries to stdout; diagnostics go through SLF4J on stderr instead.
 */
public final class CliPrinter {
  private static final PrintWriter CONSOLE =
      new PrintWriter(new PrintStream(System.out, true, StandardCharsets.UTF_8), true);
  private static volatile PrintWriter captured;

  private CliPrinter() {
    // Utility
  }

  /**
   * @param message line to emit
   */
  public static void println(String message) {
    out().println(message);
  }

  /**
   * Prints {@code label: key=value key=value ...} using the map's iteration order.
   *
   * @param label leading summary label, for example {@code Threats}
   * @param fields ordered summary values
   */
  public static void printSummary(String label, Map<String, ?> fields) {
    StringJoiner line = new StringJoiner(" ", label + ": ", "");
    fields.forEach((key, value) -> line.add(key + "=" + value));
    out().println(line);
  }

  static void setWriterForTesting(PrintWriter writer) {
    captured = writer;
  }

  static void clearTestWriter() {
    captured = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = captured;
    return writer == null ? CONSOLE : writer;
  }
}
