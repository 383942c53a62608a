package ca.gc.cra.sentinel.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import ca.gc.cra.sentinel.domain.events.RegistryEventType;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaRegistryEventEmitterTest {
  private static final Instant AT = Instant.parse("2024-06-01T12:00:00Z");

  @Test
  void publishesJsonKeyedByRecord() throws Exception {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    KafkaRegistryEventEmitter emitter = new KafkaRegistryEventEmitter(producer, "sentinel.registry.events");

    emitter.emit(new RegistryEvent(RegistryEventType.ALERT_DELIVERED, 7L, 3L, AT, Principal.of("sender-1"),
        Map.of("latencyMillis", "1500")));
    emitter.close();

    assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> record = producer.history().get(0);
    assertEquals("sentinel.registry.events", record.topic());
    assertEquals("alert:7", record.key());

    Map<String, String> fields = readFlat(record.value());
    assertEquals("1", fields.get("schemaVersion"));
    assertEquals("AlertDelivered", fields.get("type"));
    assertEquals("7", fields.get("recordId"));
    assertEquals("3", fields.get("relatedId"));
    assertEquals("2024-06-01T12:00:00Z", fields.get("timestamp"));
    assertEquals("sender-1", fields.get("actor"));
    assertEquals("1500", fields.get("attributes.latencyMillis"));
    assertTrue(producer.closed());
  }

  @Test
  void keysGroupEventsByRecordFamily() {
    Principal actor = Principal.of("owner");
    assertEquals("threat:4",
        KafkaRegistryEventEmitter.key(new RegistryEvent(RegistryEventType.THREAT_VERIFIED, 4L, 0L, AT, actor, null)));
    assertEquals("alert:2",
        KafkaRegistryEventEmitter.key(new RegistryEvent(RegistryEventType.EMERGENCY_ALERT, 2L, 1L, AT, actor, null)));
    assertEquals("access",
        KafkaRegistryEventEmitter.key(new RegistryEvent(RegistryEventType.ROLE_GRANTED, 0L, 0L, AT, actor, null)));
  }

  @Test
  void sendFailureIsReportedThroughCallbackOnly() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaRegistryEventEmitter emitter = new KafkaRegistryEventEmitter(producer, "events");

    emitter.emit(new RegistryEvent(RegistryEventType.THREAT_REGISTERED, 1L, 0L, AT, Principal.of("r"), null));

    assertTrue(producer.errorNext(new IllegalStateException("broker down")));
    assertEquals(1, producer.history().size());
  }

  @Test
  void rejectsInvalidTopic() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    assertThrows(IllegalArgumentException.class, () -> new KafkaRegistryEventEmitter(producer, "bad topic"));
    assertThrows(IllegalArgumentException.class, () -> new KafkaRegistryEventEmitter(producer, " "));
  }

  private static Map<String, String> readFlat(byte[] json) throws Exception {
    Map<String, String> fields = new LinkedHashMap<>();
    Map<Integer, String> prefixes = new HashMap<>();
    int depth = 0;
    String field = null;
    try (JsonParser parser = new JsonFactory().createParser(json)) {
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        switch (token) {
          case START_OBJECT -> {
            depth++;
            prefixes.put(depth, field == null ? "" : prefixes.getOrDefault(depth - 1, "") + field + ".");
          }
          case END_OBJECT -> depth--;
          case FIELD_NAME -> field = parser.currentName();
          default -> fields.put(prefixes.get(depth) + field, parser.getText());
        }
      }
    }
    return fields;
  }
}
