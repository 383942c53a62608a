package ca.gc.cra.sentinel.infrastructure.events;

import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans each event out to several emitters in order. A failing delegate is logged and skipped so the remaining
 * delegates still see the event.
 *
 * @since 0.1.0
 */
public final class CompositeRegistryEventEmitter implements RegistryEventEmitter {
  private static final Logger log = LoggerFactory.getLogger(CompositeRegistryEventEmitter.class);

  private final List<RegistryEventEmitter> delegates;

  /**
   * @param delegates emitters in call order; never {@code null}
   */
  public CompositeRegistryEventEmitter(List<RegistryEventEmitter> delegates) {
    this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
  }

  @Override
  public void emit(RegistryEvent event) {
    RuntimeException first = null;
    for (RegistryEventEmitter delegate : delegates) {
      try {
        delegate.emit(event);
      } catch (RuntimeException ex) {
        log.warn("Event emitter {} failed for {}", delegate.getClass().getSimpleName(),
            event.type().eventName(), ex);
        if (first == null) {
          first = ex;
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  @Override
  public void close() {
    for (RegistryEventEmitter delegate : delegates) {
      try {
        delegate.close();
      } catch (Exception ex) {
        log.warn("Failed to close event emitter {}", delegate.getClass().getSimpleName(), ex);
      }
    }
  }
}
