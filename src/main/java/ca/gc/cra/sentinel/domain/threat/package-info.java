/**
 * <strong>Purpose:</strong> Threat records and their classification enums.
 * <p><strong>Concurrency:</strong> Immutable values; safe to share across threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.domain.threat;
