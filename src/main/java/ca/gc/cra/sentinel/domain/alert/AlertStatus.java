package ca.gc.cra.sentinel.domain.alert;

/**
 * Delivery lifecycle of an alert. Any status may move to any other; re-setting the current value is rejected.
 *
 * @since 0.1.0
 */
public enum AlertStatus {
  PENDING,
  SENT,
  DELIVERED,
  FAILED
}
