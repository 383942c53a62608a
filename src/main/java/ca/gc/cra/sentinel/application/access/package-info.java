/**
 * <strong>Purpose:</strong> Role-based write authorization shared by the threat and alert registries.
 * <p><strong>Concurrency:</strong> Internally locked; safe for concurrent checks and updates.
 * <p><strong>Security:</strong> Failed checks raise {@code UNAUTHORIZED} before any registry state changes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.application.access;
