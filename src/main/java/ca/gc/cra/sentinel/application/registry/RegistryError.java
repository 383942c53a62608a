package ca.gc.cra.sentinel.application.registry;

import java.util.Locale;

/**
 * Failure kinds raised by the registries. Every kind is detected before any state is touched.
 *
 * @since 0.1.0
 */
public enum RegistryError {
  /** Caller lacks the role the operation requires. */
  UNAUTHORIZED,
  /** Referenced threat or alert does not exist. */
  NOT_FOUND,
  /** Out-of-range number, blank required text, oversized or empty collection, bad pagination. */
  INVALID_INPUT,
  /** Status set to its current value. */
  NO_OP_REJECTED,
  /** Threat already carries a verification. */
  ALREADY_VERIFIED;

  /**
   * Metric suffix for this kind, e.g. {@code no_op_rejected}.
   *
   * @return lower-case name
   */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
