package ca.gc.cra.sentinel.infrastructure.events;

import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import ca.gc.cra.sentinel.domain.events.RegistryEventType;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory emitter used for tests and replay diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryRegistryEventEmitter implements RegistryEventEmitter {
  private final CopyOnWriteArrayList<RegistryEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void emit(RegistryEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * @return immutable snapshot in emission order
   */
  public List<RegistryEvent> snapshot() {
    return List.copyOf(events);
  }

  /**
   * @param type event kind to keep
   * @return emitted events of that kind, in emission order
   */
  public List<RegistryEvent> ofType(RegistryEventType type) {
    return events.stream().filter(event -> event.type() == type).toList();
  }

  /**
   * Clears the captured events.
   */
  public void clear() {
    events.clear();
  }
}
