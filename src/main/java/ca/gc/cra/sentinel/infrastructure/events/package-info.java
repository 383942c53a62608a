/**
 * Registry event emitters: structured logging, Kafka JSON publishing, in-memory capture, and fan-out.
 * <p><strong>Concurrency:</strong> Emitters are invoked under a registry write lock and must not call back into
 * the registries.</p>
 */
package ca.gc.cra.sentinel.infrastructure.events;
