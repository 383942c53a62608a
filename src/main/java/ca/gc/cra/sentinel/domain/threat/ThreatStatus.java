package ca.gc.cra.sentinel.domain.threat;

/**
 * Lifecycle status of a threat.
 *
 * <p>Any status may move to any other status; only a transition to the current value is rejected.</p>
 *
 * @since 0.1.0
 */
public enum ThreatStatus {
  ACTIVE,
  INVESTIGATING,
  RESOLVED,
  FALSE_POSITIVE
}
