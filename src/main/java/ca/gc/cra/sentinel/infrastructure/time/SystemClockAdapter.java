package ca.gc.cra.sentinel.infrastructure.time;

import ca.gc.cra.sentinel.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}; stamps threat creation, verification, and alert
 * delivery times in production wiring.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * @return current epoch milliseconds
   * @implNote No smoothing; wall-clock adjustments show up as-is in recorded latencies.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
