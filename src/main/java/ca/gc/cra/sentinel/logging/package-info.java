/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize registry text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Redaction helpers keep alert recipients out of operator logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.logging;
