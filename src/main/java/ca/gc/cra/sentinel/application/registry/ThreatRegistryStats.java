package ca.gc.cra.sentinel.application.registry;

import ca.gc.cra.sentinel.domain.threat.ThreatStatus;
import ca.gc.cra.sentinel.domain.threat.ThreatType;
import java.util.Map;

/**
 * Counter snapshot of the threat registry.
 *
 * @param total registered threats
 * @param active threats currently {@link ThreatStatus#ACTIVE}
 * @param resolved threats currently {@link ThreatStatus#RESOLVED}
 * @param verified threats carrying a verification
 * @param critical threats registered with severity 4 or 5
 * @param byStatus count per status; sums to {@code total}
 * @param byType count per type; sums to {@code total}
 * @since 0.1.0
 */
public record ThreatRegistryStats(
    long total,
    long active,
    long resolved,
    long verified,
    long critical,
    Map<ThreatStatus, Long> byStatus,
    Map<ThreatType, Long> byType) {

  /**
   * Copies the per-status and per-type maps.
   */
  public ThreatRegistryStats {
    byStatus = Map.copyOf(byStatus);
    byType = Map.copyOf(byType);
  }
}
