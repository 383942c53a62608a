package ca.gc.cra.sentinel.domain.events;

/**
 * Names of the structured events emitted after committed registry mutations.
 *
 * @since 0.1.0
 */
public enum RegistryEventType {
  THREAT_REGISTERED("ThreatRegistered"),
  THREAT_STATUS_UPDATED("ThreatStatusUpdated"),
  THREAT_VERIFIED("ThreatVerified"),
  ALERT_CREATED("AlertCreated"),
  ALERT_STATUS_UPDATED("AlertStatusUpdated"),
  ALERT_DELIVERED("AlertDelivered"),
  EMERGENCY_ALERT("EmergencyAlert"),
  EMERGENCY_THRESHOLD_UPDATED("EmergencyThresholdUpdated"),
  ROLE_GRANTED("RoleGranted"),
  ROLE_REVOKED("RoleRevoked"),
  OWNERSHIP_TRANSFERRED("OwnershipTransferred");

  private final String eventName;

  RegistryEventType(String eventName) {
    this.eventName = eventName;
  }

  /**
   * Wire name consumed by the notification dispatcher.
   *
   * @return event name such as {@code ThreatRegistered}
   */
  public String eventName() {
    return eventName;
  }
}
