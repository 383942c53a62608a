package ca.gc.cra.sentinel.config;

import java.util.Locale;

/**
 * Destination for committed registry events.
 *
 * @since 0.1.0
 */
public enum EventSink {
  /** Structured {@code registry.event} log lines. */
  LOG,
  /** JSON records published to a Kafka topic. */
  KAFKA,
  /** Events are dropped. */
  NONE;

  /**
   * Parses a case-insensitive sink name.
   *
   * @param value raw value; {@code null} or blank yields {@link #LOG}
   * @return parsed sink
   * @throws IllegalArgumentException if the value is not a known sink
   */
  public static EventSink fromString(String value) {
    if (value == null || value.isBlank()) {
      return LOG;
    }
    try {
      return EventSink.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("eventSink must be one of LOG, KAFKA, NONE (was " + value + ")", ex);
    }
  }
}
