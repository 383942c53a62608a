/**
 * <strong>Purpose:</strong> Derived-index primitives shared by the threat and alert registries.
 * <p><strong>Concurrency:</strong> Not thread-safe; every structure is owned and guarded by one registry lock.
 * <p><strong>Performance:</strong> Constant-time append and removal; pagination is proportional to the page.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.application.index;
