package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.validation.Numbers;
import ca.gc.cra.sentinel.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Resolved settings for one registry engine: owner, emergency threshold, recent-window
 * capacity, event sink, and metrics exporter.
 * <p><strong>Why:</strong> Gives {@link CompositionRoot} a validated, immutable view of the merged
 * defaults/YAML/CLI map.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param owner principal id of the initial owner
 * @param emergencyThreshold severity at or above which new alerts are emergencies, 1-5
 * @param recentWindowCapacity number of alert ids kept in the recent window
 * @param eventSink destination for registry events
 * @param kafkaBootstrap bootstrap servers; present whenever {@code eventSink} is {@link EventSink#KAFKA}
 * @param kafkaTopic topic receiving events when the Kafka sink is active
 * @param metricsExporter {@code none} or {@code otlp}
 * @param otlpEndpoint OTLP gRPC endpoint used when {@code metricsExporter=otlp}
 * @since 0.1.0
 */
public record RegistryConfig(
    String owner,
    int emergencyThreshold,
    int recentWindowCapacity,
    EventSink eventSink,
    Optional<String> kafkaBootstrap,
    String kafkaTopic,
    String metricsExporter,
    String otlpEndpoint) {
  /** Default owner principal id. */
  public static final String DEFAULT_OWNER = "owner";
  /** Default emergency threshold. */
  public static final int DEFAULT_EMERGENCY_THRESHOLD = 4;
  /** Default recent-window capacity. */
  public static final int DEFAULT_RECENT_WINDOW = 1000;
  /** Upper bound on the recent-window capacity. */
  public static final int MAX_RECENT_WINDOW = 100_000;
  /** Default Kafka topic for registry events. */
  public static final String DEFAULT_KAFKA_TOPIC = "sentinel.registry.events";
  /** Default OTLP endpoint. */
  public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

  /**
   * Validates ranges and cross-field requirements.
   */
  public RegistryConfig {
    owner = Strings.requireNonBlank("owner", owner);
    Numbers.requireRange("emergencyThreshold", emergencyThreshold, 1, 5);
    Numbers.requireRange("recentWindowCapacity", recentWindowCapacity, 1, MAX_RECENT_WINDOW);
    eventSink = Objects.requireNonNullElse(eventSink, EventSink.LOG);
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.<String>empty())
        .map(String::trim)
        .filter(value -> !value.isEmpty());
    kafkaTopic = Strings.sanitizeTopic("kafkaTopic", kafkaTopic == null ? DEFAULT_KAFKA_TOPIC : kafkaTopic);
    metricsExporter = normalizeExporter(metricsExporter);
    otlpEndpoint = otlpEndpoint == null || otlpEndpoint.isBlank() ? DEFAULT_OTLP_ENDPOINT : otlpEndpoint.trim();
    if (eventSink == EventSink.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when eventSink=KAFKA");
    }
  }

  /**
   * @return configuration with every default applied
   */
  public static RegistryConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Builds a configuration from flattened key/value pairs; absent keys take their defaults.
   *
   * @param values merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static RegistryConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    return new RegistryConfig(
        valueOr(values, "owner", DEFAULT_OWNER),
        Numbers.parseIntInRange("emergencyThreshold",
            valueOr(values, "emergencyThreshold", Integer.toString(DEFAULT_EMERGENCY_THRESHOLD)), 1, 5),
        Numbers.parseIntInRange("recentWindowCapacity",
            valueOr(values, "recentWindowCapacity", Integer.toString(DEFAULT_RECENT_WINDOW)),
            1, MAX_RECENT_WINDOW),
        EventSink.fromString(values.get("eventSink")),
        Optional.ofNullable(values.get("kafkaBootstrap")),
        valueOr(values, "kafkaTopic", DEFAULT_KAFKA_TOPIC),
        values.get("metricsExporter"),
        values.get("otlpEndpoint"));
  }

  /**
   * Flattened defaults, the lowest-precedence layer for {@link ConfigMerger}.
   *
   * @return unmodifiable default map
   */
  public static Map<String, String> defaultsAsFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("owner", DEFAULT_OWNER);
    map.put("emergencyThreshold", Integer.toString(DEFAULT_EMERGENCY_THRESHOLD));
    map.put("recentWindowCapacity", Integer.toString(DEFAULT_RECENT_WINDOW));
    map.put("eventSink", EventSink.LOG.name());
    map.put("kafkaTopic", DEFAULT_KAFKA_TOPIC);
    map.put("metricsExporter", "none");
    map.put("otlpEndpoint", DEFAULT_OTLP_ENDPOINT);
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static String valueOr(Map<String, String> values, String key, String fallback) {
    String value = values.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static String normalizeExporter(String raw) {
    if (raw == null || raw.isBlank()) {
      return "none";
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("none") && !normalized.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be none or otlp (was " + raw + ")");
    }
    return normalized;
  }
}
