package ca.gc.cra.sentinel.domain.alert;

/**
 * Delivery channel tags carried on an alert. Fan-out per channel is the dispatcher's job.
 *
 * @since 0.1.0
 */
public enum AlertChannel {
  WEB,
  EMAIL,
  SMS,
  PUSH
}
