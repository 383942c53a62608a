package ca.gc.cra.sentinel.infrastructure.events;

import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Streams a {@link RegistryEvent} into a compact UTF-8 JSON document:
 * <pre>{"schemaVersion":1,"type":"AlertDelivered","recordId":7,"relatedId":3,
 *  "timestamp":"2024-05-01T12:00:00Z","actor":"sender-1","attributes":{"latencyMillis":"1500"}}</pre>
 *
 * @since 0.1.0
 */
final class RegistryEventJson {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();

  byte[] serialize(RegistryEvent event) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("type", event.type().eventName());
      gen.writeNumberField("recordId", event.recordId());
      if (event.relatedId() != 0L) {
        gen.writeNumberField("relatedId", event.relatedId());
      }
      gen.writeStringField("timestamp", event.timestamp().toString());
      gen.writeStringField("actor", event.actor().id());
      gen.writeObjectFieldStart("attributes");
      for (Map.Entry<String, String> entry : event.attributes().entrySet()) {
        gen.writeStringField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize " + event.type().eventName(), ex);
    }
    return out.toByteArray();
  }
}
