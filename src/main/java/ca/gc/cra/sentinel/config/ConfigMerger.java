package ca.gc.cra.sentinel.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration layers with precedence CLI &gt; YAML &gt; defaults and checks cross-key requirements.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param defaults lowest-precedence values (may be {@code null})
   * @param yaml optional YAML-derived settings
   * @param cli command-line overrides (may be {@code null})
   * @param warn receives a message for every CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when {@code eventSink=KAFKA} lacks {@code kafkaBootstrap}
   */
  public static Map<String, String> buildEffectiveConfig(
      Map<String, String> defaults,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }

    requireBootstrapWhenKafka(merged);
    return Map.copyOf(merged);
  }

  private static void requireBootstrapWhenKafka(Map<String, String> effective) {
    String sink = effective.get("eventSink");
    if (sink != null && sink.trim().equalsIgnoreCase("kafka")) {
      String bootstrap = effective.get("kafkaBootstrap");
      if (bootstrap == null || bootstrap.isBlank()) {
        throw new IllegalArgumentException("kafkaBootstrap is required when eventSink=KAFKA");
      }
    }
  }
}
