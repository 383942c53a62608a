package ca.gc.cra.sentinel.infrastructure.metrics;

import ca.gc.cra.sentinel.application.port.MetricsPort;

/**
 * Metrics adapter used when {@code metricsExporter=none}; drops every counter and observation.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /** Shared instance. */
  public static final NoOpMetricsAdapter INSTANCE = new NoOpMetricsAdapter();

  private NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {
    // disabled
  }

  @Override
  public void observe(String key, long value) {
    // disabled
  }
}
