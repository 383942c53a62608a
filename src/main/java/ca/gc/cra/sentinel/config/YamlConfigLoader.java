package ca.gc.cra.sentinel.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a SENTINEL YAML file into flat {@code key=value} pairs.
 *
 * <p>Only the {@code common} section and one named section are read, in that order, so the named section
 * overrides shared keys. Nested mappings become dotted keys ({@code kafka.topic}); an empty scalar becomes
 * {@code ""}. Section names match case-insensitively.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * @param path YAML file
   * @param section section name such as {@code replay}
   * @return flattened pairs, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException on malformed YAML, a non-mapping section, or a list value
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document = readDocument(path);
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Top level of " + path + " must be a mapping of sections");
    }

    Map<String, String> pairs = new LinkedHashMap<>();
    for (String wanted : List.of(COMMON_SECTION, section.trim().toLowerCase(Locale.ROOT))) {
      Object body = sectionNamed(root, wanted);
      if (body == null) {
        continue;
      }
      if (!(body instanceof Map<?, ?>)) {
        throw new IllegalArgumentException("Section '" + wanted + "' in " + path + " must be a mapping");
      }
      flattenInto(pairs, "", body);
    }
    return Optional.of(Map.copyOf(pairs));
  }

  private static Object readDocument(Path path) throws IOException {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return yaml.load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Object sectionNamed(Map<?, ?> root, String wanted) {
    return root.entrySet().stream()
        .filter(e -> e.getKey() instanceof String name && name.trim().toLowerCase(Locale.ROOT).equals(wanted))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static void flattenInto(Map<String, String> pairs, String key, Object node) {
    if (node instanceof Map<?, ?> mapping) {
      for (Map.Entry<?, ?> child : mapping.entrySet()) {
        if (!(child.getKey() instanceof String name) || name.isBlank()) {
          throw new IllegalArgumentException("Blank or non-string key under '" + key + "'");
        }
        flattenInto(pairs, key.isEmpty() ? name : key + '.' + name, child.getValue());
      }
    } else if (node instanceof Iterable<?>) {
      throw new IllegalArgumentException("Lists are not supported (key " + key + ")");
    } else {
      pairs.put(key, node == null ? "" : node.toString());
    }
  }
}
