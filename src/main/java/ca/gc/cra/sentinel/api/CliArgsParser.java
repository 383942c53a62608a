package ca.gc.cra.sentinel.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects the {@code key=value} arguments of a replay invocation. Splits on the first {@code '='} so values such
 * as principals may themselves contain one.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {

  private CliArgsParser() {}

  /**
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order; a repeated key keeps its last value
   * @throws IllegalArgumentException on a missing key or value, a key outside {@code [A-Za-z0-9._-]}, or a value
   *     carrying control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> pairs = new LinkedHashMap<>();
    if (args == null) {
      return pairs;
    }
    for (String raw : args) {
      if (raw != null && !raw.isBlank()) {
        putPair(pairs, raw);
      }
    }
    return pairs;
  }

  private static void putPair(Map<String, String> pairs, String raw) {
    String arg = raw.strip();
    int split = arg.indexOf('=');
    String key = split < 0 ? arg : arg.substring(0, split).strip();
    String value = split < 0 ? "" : arg.substring(split + 1).strip();
    if (key.isEmpty() || value.isEmpty()) {
      throw new IllegalArgumentException("expected key=value but got '" + raw + "'");
    }
    if (!key.chars().allMatch(CliArgsParser::isKeyChar)) {
      throw new IllegalArgumentException("unsupported characters in argument name '" + key + "'");
    }
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException("value of " + key + " contains control characters");
    }
    pairs.put(key, value);
  }

  private static boolean isKeyChar(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
        || c == '.' || c == '_' || c == '-';
  }
}
