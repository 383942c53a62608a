package ca.gc.cra.sentinel.domain.threat;

/**
 * Fixed classification of environmental threats.
 *
 * @since 0.1.0
 */
public enum ThreatType {
  STORM,
  POLLUTION,
  EROSION,
  ALGAL_BLOOM,
  ILLEGAL_DUMPING,
  ANOMALY
}
