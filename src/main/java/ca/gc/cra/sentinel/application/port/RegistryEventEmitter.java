package ca.gc.cra.sentinel.application.port;

import ca.gc.cra.sentinel.domain.events.RegistryEvent;

/**
 * <strong>What:</strong> Outbound port for handing committed registry events to a notification dispatcher.
 * <p><strong>Why:</strong> Keeps the registries decoupled from delivery transports (logging, Kafka, webhooks).</p>
 * <p><strong>Contract:</strong> Registries call {@link #emit(RegistryEvent)} synchronously, after the mutation is
 * applied and while still holding their write lock, once per state change. Delivery, retry, and channel fan-out
 * belong to the implementation.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from several registries at once.</p>
 *
 * @since 0.1.0
 */
public interface RegistryEventEmitter extends AutoCloseable {
  /**
   * Emits a structured registry event.
   *
   * @param event event payload; never {@code null}
   */
  void emit(RegistryEvent event);

  /**
   * Emitter that drops every event.
   */
  RegistryEventEmitter NO_OP = new RegistryEventEmitter() {
    @Override public void emit(RegistryEvent event) {}

    @Override public void close() {}
  };

  @Override
  default void close() {}
}
