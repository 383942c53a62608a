/**
 * <strong>Purpose:</strong> Input validation helpers shared by registries, configuration, and CLI parsing.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}s.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.validation;
