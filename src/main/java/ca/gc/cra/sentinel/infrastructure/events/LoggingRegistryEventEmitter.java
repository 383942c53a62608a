package ca.gc.cra.sentinel.infrastructure.events;

import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every registry event as one structured {@code registry.event} log line.
 *
 * @since 0.1.0
 */
public final class LoggingRegistryEventEmitter implements RegistryEventEmitter {
  private static final Logger log = LoggerFactory.getLogger(LoggingRegistryEventEmitter.class);

  @Override
  public void emit(RegistryEvent event) {
    Objects.requireNonNull(event, "event");
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("type=" + event.type().eventName());
    if (event.recordId() != 0L) {
      joiner.add("id=" + event.recordId());
    }
    if (event.relatedId() != 0L) {
      joiner.add("related=" + event.relatedId());
    }
    joiner.add("actor=" + event.actor());
    joiner.add("at=" + event.timestamp());
    if (!event.attributes().isEmpty()) {
      joiner.add("attributes=" + formatAttributes(event.attributes()));
    }
    log.info("registry.event {}", joiner);
  }

  private static String formatAttributes(Map<String, String> attributes) {
    StringJoiner joiner = new StringJoiner(";", "[", "]");
    for (Map.Entry<String, String> entry : attributes.entrySet()) {
      joiner.add(entry.getKey() + '=' + entry.getValue());
    }
    return joiner.toString();
  }
}
