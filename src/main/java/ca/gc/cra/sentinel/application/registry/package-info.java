/**
 * <strong>Purpose:</strong> The threat and alert registries: indexed record ledgers whose counters and indices move
 * together with every mutation.
 * <p><strong>Concurrency:</strong> Each registry serializes writers behind its own read/write lock; reads share the
 * lock and observe only committed state.
 * <p><strong>Errors:</strong> {@link ca.gc.cra.sentinel.application.registry.RegistryException} is raised before any
 * state changes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.application.registry;
