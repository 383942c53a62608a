package ca.gc.cra.sentinel.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by the registries, configuration parsing, and CLI.
 * <p><strong>Why:</strong> Guards severity, confidence, pagination, and threshold parameters before any ledger
 * state is touched.
 * <p><strong>Role:</strong> Domain support utilities invoked by registries and configuration loaders.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive numeric bounds.</li>
 *   <li>Provide consistent error messaging for callers and CLI feedback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a numeric value is zero or positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is negative
   */
  public static long requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(label(name) + " must not be negative (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the value is missing, not numeric, or out of range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String value = Strings.requireNonBlank(name, raw);
    final int parsed;
    try {
      parsed = Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + value + ")", ex);
    }
    requireRange(name, parsed, min, max);
    return parsed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
