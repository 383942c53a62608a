/**
 * Metrics adapters bridging {@link ca.gc.cra.sentinel.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are created lazily in concurrent maps and are safe for concurrent
 * updates from both registries.</p>
 * <p><strong>Naming:</strong> Dotted keys such as {@code alert.delivery.latencyMillis} are lower-cased and
 * sanitized into instrument names; the raw key is kept as the {@code sentinel.metric.key} attribute.</p>
 */
package ca.gc.cra.sentinel.infrastructure.metrics;
