package ca.gc.cra.sentinel.domain.alert;

import ca.gc.cra.sentinel.domain.access.Principal;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot of an alert issued for a threat.
 *
 * <p>{@code emergency} is decided once at creation from the threshold in force at that moment and is carried
 * unchanged by every later snapshot.</p>
 *
 * @param id registry-assigned identifier, starting at 1
 * @param threatId identifier of the threat the alert concerns; existence is the caller's responsibility
 * @param message alert text, 1-1000 characters
 * @param severity severity 1-5
 * @param channels non-empty delivery channel set
 * @param recipients non-empty recipient identifiers
 * @param sender principal that created the alert
 * @param createdAt creation time
 * @param status current delivery status
 * @param deliveredAt time of the latest transition into {@link AlertStatus#DELIVERED}; may be {@code null}
 * @param failureReason reason recorded on the latest transition into {@link AlertStatus#FAILED}; may be
 *     {@code null}
 * @param emergency whether severity met the emergency threshold at creation
 * @since 0.1.0
 */
public record Alert(
    long id,
    long threatId,
    String message,
    int severity,
    Set<AlertChannel> channels,
    List<String> recipients,
    Principal sender,
    Instant createdAt,
    AlertStatus status,
    Instant deliveredAt,
    String failureReason,
    boolean emergency) {

  /**
   * Validates non-null invariants and copies collections; channels iterate in declaration order.
   */
  public Alert {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(status, "status");
    EnumSet<AlertChannel> ordered = EnumSet.noneOf(AlertChannel.class);
    ordered.addAll(Objects.requireNonNull(channels, "channels"));
    channels = Collections.unmodifiableSet(ordered);
    recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
  }

  /**
   * Returns a copy carrying a new status and, when supplied, delivery or failure details.
   *
   * @param newStatus replacement status
   * @param newDeliveredAt delivery time to record; {@code null} keeps the current value
   * @param newFailureReason failure reason to record; {@code null} keeps the current value
   * @return updated snapshot
   */
  public Alert withStatus(AlertStatus newStatus, Instant newDeliveredAt, String newFailureReason) {
    return new Alert(id, threatId, message, severity, channels, recipients, sender, createdAt, newStatus,
        newDeliveredAt != null ? newDeliveredAt : deliveredAt,
        newFailureReason != null ? newFailureReason : failureReason,
        emergency);
  }

  /**
   * Time between creation and the recorded delivery.
   *
   * @return latency when a delivery time is recorded
   */
  public Optional<Duration> deliveryLatency() {
    return deliveredAt == null ? Optional.empty() : Optional.of(Duration.between(createdAt, deliveredAt));
  }
}
