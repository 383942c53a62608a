/**
 * Clock adapters for the registries.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.sentinel.infrastructure.time;
