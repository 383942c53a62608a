package ca.gc.cra.sentinel.application.events;

import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import ca.gc.cra.sentinel.domain.events.RegistryEventType;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands committed registry events to the configured {@link RegistryEventEmitter}.
 *
 * <p>Callers invoke {@link #publish} only after their mutation is applied. An emitter failure cannot undo a
 * committed change, so it is logged and counted ({@code registry.events.failed}) rather than propagated.</p>
 *
 * @since 0.1.0
 */
public final class RegistryEventPublisher {
  private static final Logger log = LoggerFactory.getLogger(RegistryEventPublisher.class);

  private final RegistryEventEmitter emitter;
  private final MetricsPort metrics;

  /**
   * @param emitter outbound emitter; {@code null} falls back to {@link RegistryEventEmitter#NO_OP}
   * @param metrics metrics port; {@code null} falls back to {@link MetricsPort#NO_OP}
   */
  public RegistryEventPublisher(RegistryEventEmitter emitter, MetricsPort metrics) {
    this.emitter = emitter == null ? RegistryEventEmitter.NO_OP : emitter;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Builds and emits one event.
   *
   * @param type event kind
   * @param recordId affected record; {@code 0} when not applicable
   * @param relatedId related record; {@code 0} when not applicable
   * @param at commit time
   * @param actor calling principal
   * @param attributes event details; may be empty
   * @return the emitted event
   */
  public RegistryEvent publish(
      RegistryEventType type,
      long recordId,
      long relatedId,
      Instant at,
      Principal actor,
      Map<String, String> attributes) {
    RegistryEvent event = new RegistryEvent(type, recordId, relatedId, at, actor, attributes);
    try {
      emitter.emit(event);
      metrics.increment("registry.events.emitted");
    } catch (RuntimeException ex) {
      metrics.increment("registry.events.failed");
      log.warn("Emitter failed for {} on record {}; state change stays committed",
          type.eventName(), recordId, ex);
    }
    return event;
  }

  /**
   * Convenience for events without a related record.
   *
   * @param type event kind
   * @param recordId affected record
   * @param clock time source
   * @param actor calling principal
   * @param attributes event details
   * @return the emitted event
   */
  public RegistryEvent publish(
      RegistryEventType type, long recordId, ClockPort clock, Principal actor, Map<String, String> attributes) {
    Objects.requireNonNull(clock, "clock");
    return publish(type, recordId, 0L, clock.now(), actor, attributes);
  }
}
