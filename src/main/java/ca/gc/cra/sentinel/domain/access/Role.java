package ca.gc.cra.sentinel.domain.access;

/**
 * Write capabilities gated by {@code AccessControl}. The owner is implicitly a member of every role.
 *
 * @since 0.1.0
 */
public enum Role {
  /** May register threats and change their status. */
  REPORTER,
  /** May verify threats. */
  VERIFIER,
  /** May create alerts and change their delivery status. */
  SENDER
}
