package ca.gc.cra.sentinel.validation;

import java.util.Objects;

/**
 * Checks for principal ids, free text and Kafka topic names. Failures raise {@link IllegalArgumentException},
 * which the registries report as invalid input.
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  /** Longest topic name Kafka accepts. */
  private static final int MAX_TOPIC_LENGTH = 249;

  private Strings() {
    // Utility
  }

  /**
   * Identifier-style check: no control characters anywhere, not blank once trimmed.
   *
   * @param name parameter name used in messages
   * @param value candidate; {@code null} throws {@link NullPointerException}
   * @return trimmed value
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Prose check for descriptions and messages. Line breaks are allowed and the value is returned as given.
   *
   * @param name parameter name used in messages
   * @param value candidate text
   * @param maxLength upper bound in {@code char}s
   * @return {@code value} unchanged
   * @throws IllegalArgumentException when {@code null}, blank or longer than {@code maxLength}
   */
  public static String requireText(String name, String value, int maxLength) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    if (value.length() > maxLength) {
      throw new IllegalArgumentException(
          label(name) + " is " + value.length() + " characters; limit is " + maxLength);
    }
    return value;
  }

  /**
   * @param name parameter name used in messages
   * @param topic candidate Kafka topic
   * @return trimmed topic made only of letters, digits, {@code .}, {@code _} and {@code -}
   */
  public static String sanitizeTopic(String name, String topic) {
    String trimmed = requireNonBlank(name, topic);
    if (trimmed.length() > MAX_TOPIC_LENGTH || !trimmed.chars().allMatch(Strings::isTopicChar)) {
      throw new IllegalArgumentException(
          label(name) + " must be at most " + MAX_TOPIC_LENGTH + " of [A-Za-z0-9._-] (was '" + trimmed + "')");
    }
    return trimmed;
  }

  private static boolean isTopicChar(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
        || c == '.' || c == '_' || c == '-';
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
