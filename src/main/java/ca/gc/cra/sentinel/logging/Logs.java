package ca.gc.cra.sentinel.logging;

import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * Keeps caller-supplied text out of log lines in bulk. Descriptions and messages are capped by UTF-8 size and
 * recipient contact details are replaced by placeholders.
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** UTF-8 byte budget applied to descriptions and messages in registry log lines. */
  public static final int DEFAULT_TEXT_BUDGET = 256;

  private Logs() {
    // Utility
  }

  /**
   * Cuts {@code value} to at most {@code maxBytes} UTF-8 bytes on a code point boundary and appends
   * {@code "... (truncated, kept of total)"}.
   *
   * @param value text to cap; {@code null} becomes {@code "<null>"}
   * @param maxBytes positive byte budget
   * @return {@code value} itself when it already fits
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return "<null>";
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int cp = value.codePointAt(end);
      int width = utf8Width(cp);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(cp);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + ")";
  }

  /**
   * @param value text to cap at {@link #DEFAULT_TEXT_BUDGET}
   * @return capped text
   */
  public static String truncate(String value) {
    return truncate(value, DEFAULT_TEXT_BUDGET);
  }

  /**
   * @param value sensitive value, never echoed
   * @return {@code [REDACTED]}
   */
  public static String redact(String value) {
    return "[REDACTED]";
  }

  /**
   * @param values sensitive values; {@code null} counts as empty
   * @return size-only placeholder such as {@code [REDACTED x3]}
   */
  public static String redactAll(Collection<?> values) {
    return "[REDACTED x" + (values == null ? 0 : values.size()) + "]";
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
