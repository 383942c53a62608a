/**
 * <strong>Purpose:</strong> Outbound ports the registry engine calls into: time, metrics, and event emission.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.application.port;
