/**
 * <strong>Purpose:</strong> Post-commit event publication shared by access control and both registries.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.application.events;
