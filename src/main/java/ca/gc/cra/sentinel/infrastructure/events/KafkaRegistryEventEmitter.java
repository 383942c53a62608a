package ca.gc.cra.sentinel.infrastructure.events;

import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import ca.gc.cra.sentinel.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RegistryEventEmitter} that publishes JSON-encoded events to a Kafka topic.
 * <p><strong>Why:</strong> Lets an out-of-process notification dispatcher consume alerts and threat changes.</p>
 * <p><strong>Ordering:</strong> Records are keyed by {@code <eventType-family>:<recordId>} (for example
 * {@code alert:7}) so every change to one threat or alert lands on one partition in commit order.</p>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer} is
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class KafkaRegistryEventEmitter implements RegistryEventEmitter {
  private static final Logger log = LoggerFactory.getLogger(KafkaRegistryEventEmitter.class);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final RegistryEventJson json = new RegistryEventJson();

  /**
   * Creates an emitter with a new producer.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic destination topic; must not be blank
   * @throws IllegalArgumentException if any parameter is blank
   */
  public KafkaRegistryEventEmitter(String bootstrapServers, String topic) {
    this(createProducer(bootstrapServers), topic);
  }

  KafkaRegistryEventEmitter(Producer<String, byte[]> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("topic", topic);
  }

  /**
   * Sends the event asynchronously; send failures reported by the producer are logged.
   *
   * @param event event to publish
   */
  @Override
  public void emit(RegistryEvent event) {
    Objects.requireNonNull(event, "event");
    ProducerRecord<String, byte[]> message = new ProducerRecord<>(topic, key(event), json.serialize(event));
    producer.send(message, (metadata, ex) -> {
      if (ex != null) {
        log.warn("Kafka send failed for {} record {}", event.type().eventName(), event.recordId(), ex);
      }
    });
  }

  /**
   * Flushes pending messages and closes the producer.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  static String key(RegistryEvent event) {
    return switch (event.type()) {
      case THREAT_REGISTERED, THREAT_STATUS_UPDATED, THREAT_VERIFIED -> "threat:" + event.recordId();
      case ALERT_CREATED, ALERT_STATUS_UPDATED, ALERT_DELIVERED, EMERGENCY_ALERT -> "alert:" + event.recordId();
      default -> "access";
    };
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("bootstrapServers", bootstrapServers).trim();
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
