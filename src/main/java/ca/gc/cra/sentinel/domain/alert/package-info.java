/**
 * <strong>Purpose:</strong> Alert records, delivery channels, and delivery statuses.
 * <p><strong>Concurrency:</strong> Immutable values; safe to share across threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.domain.alert;
