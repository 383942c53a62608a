/**
 * <strong>Purpose:</strong> Structured registry events handed to outbound emitters after each commit.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.domain.events;
