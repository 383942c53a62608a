package ca.gc.cra.sentinel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RegistryConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    RegistryConfig config = RegistryConfig.defaults();

    assertEquals("owner", config.owner());
    assertEquals(4, config.emergencyThreshold());
    assertEquals(1000, config.recentWindowCapacity());
    assertEquals(EventSink.LOG, config.eventSink());
    assertTrue(config.kafkaBootstrap().isEmpty());
    assertEquals("sentinel.registry.events", config.kafkaTopic());
    assertEquals("none", config.metricsExporter());
    assertEquals("http://localhost:4317", config.otlpEndpoint());
  }

  @Test
  void fromMapParsesValues() {
    RegistryConfig config = RegistryConfig.fromMap(Map.of(
        "owner", " coast-guard ",
        "emergencyThreshold", "2",
        "recentWindowCapacity", "50",
        "eventSink", "kafka",
        "kafkaBootstrap", "broker:9092",
        "kafkaTopic", "alerts.v1",
        "metricsExporter", "OTLP"));

    assertEquals("coast-guard", config.owner());
    assertEquals(2, config.emergencyThreshold());
    assertEquals(50, config.recentWindowCapacity());
    assertEquals(EventSink.KAFKA, config.eventSink());
    assertEquals(Optional.of("broker:9092"), config.kafkaBootstrap());
    assertEquals("alerts.v1", config.kafkaTopic());
    assertEquals("otlp", config.metricsExporter());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> RegistryConfig.fromMap(Map.of("emergencyThreshold", "6")));
    assertThrows(IllegalArgumentException.class,
        () -> RegistryConfig.fromMap(Map.of("recentWindowCapacity", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> RegistryConfig.fromMap(Map.of("eventSink", "syslog")));
    assertThrows(IllegalArgumentException.class,
        () -> RegistryConfig.fromMap(Map.of("metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class,
        () -> RegistryConfig.fromMap(Map.of("kafkaTopic", "bad topic")));
    assertThrows(IllegalArgumentException.class,
        () -> RegistryConfig.fromMap(Map.of("eventSink", "KAFKA", "kafkaBootstrap", " ")));
  }
}
