package ca.gc.cra.sentinel.application.registry;

import ca.gc.cra.sentinel.domain.alert.AlertChannel;
import ca.gc.cra.sentinel.domain.alert.AlertStatus;
import java.time.Duration;
import java.util.Map;

/**
 * Counter snapshot of the alert registry.
 *
 * @param total created alerts
 * @param successful alerts currently {@link AlertStatus#DELIVERED}
 * @param failed alerts currently {@link AlertStatus#FAILED}
 * @param pending alerts currently {@link AlertStatus#PENDING}
 * @param emergencyCount alerts classified as emergencies at creation
 * @param averageDeliveryTime mean creation-to-delivery time over delivered alerts; zero when none
 * @param successRate delivered alerts as a percentage of all alerts; zero when empty
 * @param byStatus count per status; sums to {@code total}
 * @param byChannel alerts carrying each channel tag
 * @since 0.1.0
 */
public record AlertRegistryStats(
    long total,
    long successful,
    long failed,
    long pending,
    long emergencyCount,
    Duration averageDeliveryTime,
    double successRate,
    Map<AlertStatus, Long> byStatus,
    Map<AlertChannel, Long> byChannel) {

  /**
   * Copies the per-status and per-channel maps.
   */
  public AlertRegistryStats {
    byStatus = Map.copyOf(byStatus);
    byChannel = Map.copyOf(byChannel);
  }
}
