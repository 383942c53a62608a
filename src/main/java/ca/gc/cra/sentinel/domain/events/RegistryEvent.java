package ca.gc.cra.sentinel.domain.events;

import ca.gc.cra.sentinel.domain.access.Principal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable notification describing one committed registry state change.
 *
 * <p><strong>Why:</strong> An external dispatcher fans these out to webhooks, e-mail, SMS, and push; the registry
 * only guarantees that each event follows its commit and is emitted exactly once.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param type event kind; never {@code null}
 * @param recordId identifier of the affected threat or alert; {@code 0} for access-control events
 * @param relatedId secondary identifier (the parent threat of an alert); {@code 0} when not applicable
 * @param timestamp commit time; never {@code null}
 * @param actor principal whose call produced the change; never {@code null}
 * @param attributes additional key/value details (statuses, latency); never {@code null}, insertion ordered
 * @since 0.1.0
 */
public record RegistryEvent(
    RegistryEventType type,
    long recordId,
    long relatedId,
    Instant timestamp,
    Principal actor,
    Map<String, String> attributes) {

  /**
   * Validates constructor invariants and defensively copies the attribute map.
   */
  public RegistryEvent {
    type = Objects.requireNonNull(type, "type");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    actor = Objects.requireNonNull(actor, "actor");
    attributes = attributes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Returns an attribute value or {@code null} when absent.
   *
   * @param key attribute name
   * @return value or {@code null}
   */
  public String attribute(String key) {
    return attributes.get(key);
  }
}
