package ca.gc.cra.sentinel.application.replay;

import ca.gc.cra.sentinel.application.registry.RegistryError;
import java.util.List;

/**
 * Outcome of replaying a mutation log.
 *
 * @param applied commands that committed
 * @param rejected commands refused by the engine or unreadable
 * @param rejections one entry per rejected command, in log order
 * @param halted whether strict mode stopped the replay at the first rejection
 * @since 0.1.0
 */
public record ReplayReport(long applied, long rejected, List<Rejection> rejections, boolean halted) {

  public ReplayReport {
    rejections = List.copyOf(rejections);
  }

  /**
   * One refused log line.
   *
   * @param lineNumber 1-based line number
   * @param op operation name, or {@code ?} when the line could not be parsed
   * @param kind error kind
   * @param message diagnostic message
   */
  public record Rejection(int lineNumber, String op, RegistryError kind, String message) {}
}
