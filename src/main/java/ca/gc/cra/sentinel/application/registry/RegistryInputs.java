package ca.gc.cra.sentinel.application.registry;

import ca.gc.cra.sentinel.application.index.Pagination;
import ca.gc.cra.sentinel.validation.Numbers;
import ca.gc.cra.sentinel.validation.Strings;

/**
 * Translates generic validation failures into {@link RegistryError#INVALID_INPUT}.
 */
final class RegistryInputs {
  static final int MIN_SEVERITY = 1;
  static final int MAX_SEVERITY = 5;

  private RegistryInputs() {}

  static int range(String name, long value, long min, long max) {
    try {
      return (int) Numbers.requireRange(name, value, min, max);
    } catch (IllegalArgumentException ex) {
      throw new RegistryException(RegistryError.INVALID_INPUT, ex.getMessage(), ex);
    }
  }

  static int severity(int value) {
    return range("severity", value, MIN_SEVERITY, MAX_SEVERITY);
  }

  static long nonNegative(String name, long value) {
    try {
      return Numbers.requireNonNegative(name, value);
    } catch (IllegalArgumentException ex) {
      throw new RegistryException(RegistryError.INVALID_INPUT, ex.getMessage(), ex);
    }
  }

  static String text(String name, String value, int maxLength) {
    try {
      return Strings.requireText(name, value, maxLength);
    } catch (IllegalArgumentException ex) {
      throw new RegistryException(RegistryError.INVALID_INPUT, ex.getMessage(), ex);
    }
  }

  static <T> T present(String name, T value) {
    if (value == null) {
      throw RegistryException.invalidInput(name + " must not be null");
    }
    return value;
  }

  static void page(int offset, int limit) {
    if (offset < 0) {
      throw RegistryException.invalidInput("offset must not be negative (was " + offset + ")");
    }
    range("limit", limit, 1, Pagination.MAX_LIMIT);
  }
}
