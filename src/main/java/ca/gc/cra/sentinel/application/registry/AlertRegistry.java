package ca.gc.cra.sentinel.application.registry;

import ca.gc.cra.sentinel.application.access.AccessControl;
import ca.gc.cra.sentinel.application.events.RegistryEventPublisher;
import ca.gc.cra.sentinel.application.index.BoundedIdWindow;
import ca.gc.cra.sentinel.application.index.Pagination;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.domain.access.Role;
import ca.gc.cra.sentinel.domain.alert.Alert;
import ca.gc.cra.sentinel.domain.alert.AlertChannel;
import ca.gc.cra.sentinel.domain.alert.AlertStatus;
import ca.gc.cra.sentinel.domain.events.RegistryEventType;
import ca.gc.cra.sentinel.logging.Logs;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ledger of alerts issued for threats and their delivery lifecycle.
 * <p><strong>Why:</strong> The notification dispatcher delivers alerts; this registry is the record of what was
 * issued, to whom, how urgently, and how delivery went.</p>
 * <p><strong>Role:</strong> Application service owning its record store; consumes {@link AccessControl} and emits
 * {@code AlertCreated}, {@code EmergencyAlert}, {@code AlertStatusUpdated}, {@code AlertDelivered}, and
 * {@code EmergencyThresholdUpdated}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify alerts as emergencies once, at creation, against the threshold then in force.</li>
 *   <li>Maintain the emergency list, the bounded recent window, and the threat-to-alert adjacency.</li>
 *   <li>Track pending/sent/delivered/failed counters and delivery timestamps.</li>
 * </ul>
 * <p><strong>Ordering:</strong> {@link #listRecent}, {@link #listEmergency}, and {@link #listByStatus} return the
 * newest alerts first.</p>
 * <p><strong>Thread-safety:</strong> One read/write lock guards the store, indices, counters, and threshold.</p>
 *
 * @since 0.1.0
 */
public final class AlertRegistry {
  /** Maximum message length in characters. */
  public static final int MAX_MESSAGE_LENGTH = 1000;
  /** Maximum recipients per alert. */
  public static final int MAX_RECIPIENTS = 1000;
  /** Upper bound on a stored failure reason, in characters. */
  public static final int MAX_FAILURE_REASON_LENGTH = 1000;
  /** Emergency threshold used when none is configured. */
  public static final int DEFAULT_EMERGENCY_THRESHOLD = 4;
  /** Recent-window capacity used when none is configured. */
  public static final int DEFAULT_RECENT_CAPACITY = 1000;

  private static final Logger log = LoggerFactory.getLogger(AlertRegistry.class);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AccessControl access;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final RegistryEventPublisher events;

  // Alert with id N lives at index N - 1.
  private final List<Alert> alerts = new ArrayList<>();
  private final BoundedIdWindow recentIds;
  private final List<Long> emergencyIds = new ArrayList<>();
  private final Map<Long, List<Long>> alertsByThreat = new HashMap<>();
  private final Map<AlertStatus, Long> statusCounts = new EnumMap<>(AlertStatus.class);
  private final Map<AlertChannel, Long> channelCounts = new EnumMap<>(AlertChannel.class);
  private int emergencyThreshold;

  /**
   * Creates a registry with default threshold and window, without metrics or events.
   *
   * @param access shared access control
   * @param clock time source
   */
  public AlertRegistry(AccessControl access, ClockPort clock) {
    this(access, clock, MetricsPort.NO_OP, RegistryEventEmitter.NO_OP,
        DEFAULT_EMERGENCY_THRESHOLD, DEFAULT_RECENT_CAPACITY);
  }

  /**
   * Creates a registry.
   *
   * @param access shared access control; never {@code null}
   * @param clock time source; never {@code null}
   * @param metrics metrics port; {@code null} disables metrics
   * @param emitter event emitter; {@code null} disables events
   * @param emergencyThreshold initial threshold, 1-5
   * @param recentCapacity size of the recent window, positive
   */
  public AlertRegistry(
      AccessControl access,
      ClockPort clock,
      MetricsPort metrics,
      RegistryEventEmitter emitter,
      int emergencyThreshold,
      int recentCapacity) {
    this.access = Objects.requireNonNull(access, "access");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.events = new RegistryEventPublisher(emitter, this.metrics);
    this.emergencyThreshold = RegistryInputs.severity(emergencyThreshold);
    this.recentIds = new BoundedIdWindow(recentCapacity);
    for (AlertStatus status : AlertStatus.values()) {
      statusCounts.put(status, 0L);
    }
    for (AlertChannel channel : AlertChannel.values()) {
      channelCounts.put(channel, 0L);
    }
  }

  /**
   * Records a new alert in {@link AlertStatus#PENDING} status.
   *
   * @param caller principal holding {@link Role#SENDER}
   * @param draft alert values
   * @return the new alert identifier
   * @throws RegistryException {@code UNAUTHORIZED}, or {@code INVALID_INPUT} for a non-positive threat id, blank or
   *     over-long message, bad severity, empty channels, or an empty, oversized, or blank-entry recipient list
   */
  public long createAlert(Principal caller, AlertDraft draft) {
    Objects.requireNonNull(draft, "draft");
    lock.writeLock().lock();
    try {
      access.require(caller, Role.SENDER, "createAlert");
      if (draft.threatId() < 1) {
        throw RegistryException.invalidInput("threatId must be positive (was " + draft.threatId() + ")");
      }
      String message = RegistryInputs.text("message", draft.message(), MAX_MESSAGE_LENGTH);
      int severity = RegistryInputs.severity(draft.severity());
      if (draft.channels() == null || draft.channels().isEmpty()) {
        throw RegistryException.invalidInput("channels must not be empty");
      }
      for (AlertChannel channel : draft.channels()) {
        if (channel == null) {
          throw RegistryException.invalidInput("channels must not contain null");
        }
      }
      List<String> recipients = checkRecipients(draft.recipients());

      long id = alerts.size() + 1L;
      Instant now = clock.now();
      boolean emergency = severity >= emergencyThreshold;
      Alert alert = new Alert(id, draft.threatId(), message, severity, draft.channels(), recipients, caller,
          now, AlertStatus.PENDING, null, null, emergency);
      alerts.add(alert);
      alertsByThreat.computeIfAbsent(draft.threatId(), key -> new ArrayList<>()).add(id);
      long evicted = recentIds.append(id);
      if (emergency) {
        emergencyIds.add(id);
      }
      statusCounts.merge(AlertStatus.PENDING, 1L, Long::sum);
      for (AlertChannel channel : alert.channels()) {
        channelCounts.merge(channel, 1L, Long::sum);
      }

      metrics.increment("alert.created");
      log.info("Created alert {} for threat {} severity={} emergency={} channels={} recipients={} message={}",
          id, draft.threatId(), severity, emergency, alert.channels(), Logs.redactAll(recipients),
          Logs.truncate(message));
      if (evicted > 0) {
        log.debug("Recent window full; evicted alert {}", evicted);
      }
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put("severity", Integer.toString(severity));
      attributes.put("emergency", Boolean.toString(emergency));
      attributes.put("channels", channelList(alert));
      events.publish(RegistryEventType.ALERT_CREATED, id, draft.threatId(), now, caller, attributes);
      if (emergency) {
        metrics.increment("alert.emergency");
        events.publish(RegistryEventType.EMERGENCY_ALERT, id, draft.threatId(), now, caller,
            Map.of("severity", Integer.toString(severity)));
      }
      return id;
    } catch (RegistryException ex) {
      throw rejected("createAlert", caller, ex);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Moves an alert to another delivery status.
   *
   * <p>Entering {@link AlertStatus#DELIVERED} records the delivery time and emits {@code AlertDelivered} with the
   * creation-to-delivery latency. Entering {@link AlertStatus#FAILED} records {@code failureReason}.</p>
   *
   * @param caller principal holding {@link Role#SENDER}
   * @param alertId alert identifier
   * @param newStatus target status; must differ from the current one
   * @param failureReason reason stored when {@code newStatus} is {@link AlertStatus#FAILED}, at most
   *     {@value #MAX_FAILURE_REASON_LENGTH} characters; {@code null} is stored as {@code ""}. Ignored otherwise
   * @throws RegistryException {@code UNAUTHORIZED}, {@code NOT_FOUND}, {@code INVALID_INPUT} for a missing status
   *     or an over-long failure reason, or {@code NO_OP_REJECTED}
   */
  public void updateStatus(Principal caller, long alertId, AlertStatus newStatus, String failureReason) {
    lock.writeLock().lock();
    try {
      access.require(caller, Role.SENDER, "updateAlertStatus");
      Alert current = find(alertId);
      RegistryInputs.present("status", newStatus);
      AlertStatus oldStatus = current.status();
      if (oldStatus == newStatus) {
        throw RegistryException.noOp("alert", alertId, newStatus);
      }

      String reason = null;
      if (newStatus == AlertStatus.FAILED) {
        reason = failureReason == null ? "" : failureReason;
        if (reason.length() > MAX_FAILURE_REASON_LENGTH) {
          throw RegistryException.invalidInput("failureReason length must be <= " + MAX_FAILURE_REASON_LENGTH
              + " (was " + reason.length() + ")");
        }
      }

      Instant now = clock.now();
      Instant deliveredAt = newStatus == AlertStatus.DELIVERED ? now : null;
      Alert updated = current.withStatus(newStatus, deliveredAt, reason);
      alerts.set((int) (alertId - 1), updated);
      statusCounts.merge(oldStatus, -1L, Long::sum);
      statusCounts.merge(newStatus, 1L, Long::sum);

      metrics.increment("alert.status.updated");
      log.debug("Alert {} status {} -> {} by {}", alertId, oldStatus, newStatus, caller);
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put("oldStatus", oldStatus.name());
      attributes.put("newStatus", newStatus.name());
      if (reason != null) {
        attributes.put("failureReason", Logs.truncate(reason));
      }
      events.publish(RegistryEventType.ALERT_STATUS_UPDATED, alertId, current.threatId(), now, caller, attributes);
      if (deliveredAt != null) {
        long latencyMillis = Duration.between(current.createdAt(), deliveredAt).toMillis();
        metrics.increment("alert.delivered");
        metrics.observe("alert.delivery.latencyMillis", latencyMillis);
        events.publish(RegistryEventType.ALERT_DELIVERED, alertId, current.threatId(), now, caller,
            Map.of("latencyMillis", Long.toString(latencyMillis)));
      }
    } catch (RegistryException ex) {
      throw rejected("updateAlertStatus", caller, ex);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Changes the emergency threshold for alerts created from now on. Owner only.
   *
   * @param caller the owner
   * @param threshold new threshold, 1-5
   * @throws RegistryException {@code UNAUTHORIZED} or {@code INVALID_INPUT}
   */
  public void setEmergencyThreshold(Principal caller, int threshold) {
    lock.writeLock().lock();
    try {
      access.requireOwner(caller, "setEmergencyThreshold");
      int value = RegistryInputs.range("emergencyThreshold", threshold, 1, 5);
      int previous = emergencyThreshold;
      emergencyThreshold = value;
      log.info("Emergency threshold {} -> {} by {}", previous, value, caller);
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put("previous", Integer.toString(previous));
      attributes.put("threshold", Integer.toString(value));
      events.publish(RegistryEventType.EMERGENCY_THRESHOLD_UPDATED, 0L, clock, caller, attributes);
    } catch (RegistryException ex) {
      throw rejected("setEmergencyThreshold", caller, ex);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @return threshold applied to alerts created from now on
   */
  public int emergencyThreshold() {
    lock.readLock().lock();
    try {
      return emergencyThreshold;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Reads an alert snapshot.
   *
   * @param alertId alert identifier
   * @return current snapshot
   * @throws RegistryException {@code NOT_FOUND}
   */
  public Alert get(long alertId) {
    lock.readLock().lock();
    try {
      return find(alertId);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Every alert created against a threat, oldest first. Unknown threats yield an empty list.
   *
   * @param threatId threat identifier
   * @return immutable snapshot
   */
  public List<Long> alertsForThreat(long threatId) {
    lock.readLock().lock();
    try {
      List<Long> ids = alertsByThreat.get(threatId);
      return ids == null ? List.of() : List.copyOf(ids);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Pages through the recent window, newest first.
   *
   * @param offset number of newest alerts to skip
   * @param limit page size 1-100
   * @return identifiers
   * @throws RegistryException {@code INVALID_INPUT} for a bad offset or limit
   */
  public List<Long> listRecent(int offset, int limit) {
    RegistryInputs.page(offset, limit);
    lock.readLock().lock();
    try {
      return Pagination.reverse(recentIds.size(), recentIds::get, offset, limit);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Pages through emergency alerts, newest first.
   *
   * @param offset number of newest alerts to skip
   * @param limit page size 1-100
   * @return identifiers
   * @throws RegistryException {@code INVALID_INPUT} for a bad offset or limit
   */
  public List<Long> listEmergency(int offset, int limit) {
    RegistryInputs.page(offset, limit);
    lock.readLock().lock();
    try {
      return Pagination.reverse(emergencyIds, offset, limit);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Pages through alerts currently in a status, newest first.
   *
   * @param status status to match
   * @param offset number of newest matches to skip
   * @param limit page size 1-100
   * @return identifiers
   * @throws RegistryException {@code INVALID_INPUT} for a missing status or bad offset/limit
   */
  public List<Long> listByStatus(AlertStatus status, int offset, int limit) {
    RegistryInputs.present("status", status);
    RegistryInputs.page(offset, limit);
    lock.readLock().lock();
    try {
      List<Long> page = new ArrayList<>(Math.min(limit, alerts.size()));
      int matched = 0;
      for (int i = alerts.size() - 1; i >= 0 && page.size() < limit; i--) {
        Alert alert = alerts.get(i);
        if (alert.status() != status) {
          continue;
        }
        if (matched++ >= offset) {
          page.add(alert.id());
        }
      }
      return List.copyOf(page);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return number of created alerts
   */
  public long totalAlerts() {
    lock.readLock().lock();
    try {
      return alerts.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return how many alerts {@link #listRecent(int, int)} can reach
   */
  public int recentWindowCapacity() {
    return recentIds.capacity();
  }

  /**
   * Reads every counter in one consistent snapshot. The average delivery time scans delivered alerts.
   *
   * @return counters
   */
  public AlertRegistryStats stats() {
    lock.readLock().lock();
    try {
      long total = alerts.size();
      long delivered = statusCounts.get(AlertStatus.DELIVERED);
      long latencySum = 0L;
      long latencyCount = 0L;
      for (Alert alert : alerts) {
        if (alert.status() == AlertStatus.DELIVERED && alert.deliveredAt() != null) {
          latencySum += Duration.between(alert.createdAt(), alert.deliveredAt()).toMillis();
          latencyCount++;
        }
      }
      Duration average = latencyCount == 0 ? Duration.ZERO : Duration.ofMillis(latencySum / latencyCount);
      double successRate = total == 0 ? 0.0 : delivered * 100.0 / total;
      return new AlertRegistryStats(
          total,
          delivered,
          statusCounts.get(AlertStatus.FAILED),
          statusCounts.get(AlertStatus.PENDING),
          emergencyIds.size(),
          average,
          successRate,
          statusCounts,
          channelCounts);
    } finally {
      lock.readLock().unlock();
    }
  }

  private List<String> checkRecipients(List<String> recipients) {
    if (recipients == null || recipients.isEmpty()) {
      throw RegistryException.invalidInput("recipients must not be empty");
    }
    if (recipients.size() > MAX_RECIPIENTS) {
      throw RegistryException.invalidInput(
          "recipients must have at most " + MAX_RECIPIENTS + " entries (was " + recipients.size() + ")");
    }
    for (String recipient : recipients) {
      if (recipient == null || recipient.isBlank()) {
        throw RegistryException.invalidInput("recipients must not contain blank entries");
      }
    }
    return recipients;
  }

  private static String channelList(Alert alert) {
    StringBuilder out = new StringBuilder();
    for (AlertChannel channel : alert.channels()) {
      if (out.length() > 0) {
        out.append(',');
      }
      out.append(channel.name());
    }
    return out.toString();
  }

  private Alert find(long alertId) {
    if (alertId < 1 || alertId > alerts.size()) {
      throw RegistryException.notFound("alert", alertId);
    }
    return alerts.get((int) (alertId - 1));
  }

  private RegistryException rejected(String operation, Principal caller, RegistryException ex) {
    metrics.increment("registry.rejected." + ex.kind().metricName());
    log.warn("Rejected {} by {}: {} ({})", operation, caller, ex.kind(), ex.getMessage());
    return ex;
  }
}
