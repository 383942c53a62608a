package ca.gc.cra.sentinel.application.registry;

import ca.gc.cra.sentinel.application.access.AccessControl;
import ca.gc.cra.sentinel.application.events.RegistryEventPublisher;
import ca.gc.cra.sentinel.application.index.IndexedIdSet;
import ca.gc.cra.sentinel.application.index.Pagination;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.domain.access.Role;
import ca.gc.cra.sentinel.domain.events.RegistryEventType;
import ca.gc.cra.sentinel.domain.threat.ContentHash;
import ca.gc.cra.sentinel.domain.threat.GeoPoint;
import ca.gc.cra.sentinel.domain.threat.Threat;
import ca.gc.cra.sentinel.domain.threat.ThreatStatus;
import ca.gc.cra.sentinel.domain.threat.ThreatType;
import ca.gc.cra.sentinel.logging.Logs;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ledger of environmental threat reports with status and verification tracking.
 * <p><strong>Why:</strong> Detection runs elsewhere; this registry records its results, classifies them, and keeps
 * the derived indices (status counters, type counters, active set) consistent with every change.</p>
 * <p><strong>Role:</strong> Application service owning its record store; consumes {@link AccessControl} for
 * authorization and emits {@code ThreatRegistered}, {@code ThreatStatusUpdated}, and {@code ThreatVerified}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Assign identifiers from 1 upward and store immutable report snapshots.</li>
 *   <li>Apply status transitions: any status to any other status, never to itself.</li>
 *   <li>Accept exactly one verification per threat.</li>
 *   <li>Serve paginated lookups by active state, type, and minimum severity.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One read/write lock guards the store and every index. Mutations run under the
 * write lock: all checks first, then the record, counters, and indices, then event emission. Reads take the read
 * lock and never observe a partial write.</p>
 * <p><strong>Performance:</strong> Registration, transitions, and {@link #listActive} are O(1) amortized per item;
 * {@link #listByType} and {@link #listBySeverity} scan every threat in registration order.</p>
 *
 * @since 0.1.0
 */
public final class ThreatRegistry {
  static final int CRITICAL_SEVERITY = 4;

  private static final Logger log = LoggerFactory.getLogger(ThreatRegistry.class);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AccessControl access;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final RegistryEventPublisher events;

  // Threat with id N lives at index N - 1; list order is registration order.
  private final List<Threat> threats = new ArrayList<>();
  private final IndexedIdSet activeIds = new IndexedIdSet();
  private final Map<ThreatStatus, Long> statusCounts = new EnumMap<>(ThreatStatus.class);
  private final Map<ThreatType, Long> typeCounts = new EnumMap<>(ThreatType.class);
  private long verifiedCount;
  private long criticalCount;

  /**
   * Creates a registry without metrics or event emission.
   *
   * @param access shared access control
   * @param clock time source
   */
  public ThreatRegistry(AccessControl access, ClockPort clock) {
    this(access, clock, MetricsPort.NO_OP, RegistryEventEmitter.NO_OP);
  }

  /**
   * Creates a registry.
   *
   * @param access shared access control; never {@code null}
   * @param clock time source; never {@code null}
   * @param metrics metrics port; {@code null} disables metrics
   * @param emitter event emitter; {@code null} disables events
   */
  public ThreatRegistry(
      AccessControl access, ClockPort clock, MetricsPort metrics, RegistryEventEmitter emitter) {
    this.access = Objects.requireNonNull(access, "access");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.events = new RegistryEventPublisher(emitter, this.metrics);
    for (ThreatStatus status : ThreatStatus.values()) {
      statusCounts.put(status, 0L);
    }
    for (ThreatType type : ThreatType.values()) {
      typeCounts.put(type, 0L);
    }
  }

  /**
   * Records a new threat in {@link ThreatStatus#ACTIVE} status.
   *
   * @param caller principal holding {@link Role#REPORTER}
   * @param submission report values
   * @return the new threat identifier
   * @throws RegistryException {@code UNAUTHORIZED}, or {@code INVALID_INPUT} for an out-of-range severity or
   *     confidence, blank description, zero or missing data hash, negative population, missing type, or a location
   *     outside [-90, 90] latitude and [-180, 180] longitude
   */
  public long registerThreat(Principal caller, ThreatSubmission submission) {
    Objects.requireNonNull(submission, "submission");
    lock.writeLock().lock();
    try {
      access.require(caller, Role.REPORTER, "registerThreat");
      ThreatType type = RegistryInputs.present("type", submission.type());
      int severity = RegistryInputs.severity(submission.severity());
      int confidence = RegistryInputs.range("confidence", submission.confidence(), 0, 100);
      String description = RegistryInputs.text("description", submission.description(), Integer.MAX_VALUE);
      ContentHash dataHash = RegistryInputs.present("dataHash", submission.dataHash());
      if (dataHash.isZero()) {
        throw RegistryException.invalidInput("dataHash must not be zero");
      }
      long population = RegistryInputs.nonNegative("affectedPopulation", submission.affectedPopulation());
      GeoPoint location = RegistryInputs.present("location", submission.location());
      RegistryInputs.range("latitude", location.latitudeMicros(), -90 * GeoPoint.SCALE, 90 * GeoPoint.SCALE);
      RegistryInputs.range("longitude", location.longitudeMicros(), -180 * GeoPoint.SCALE, 180 * GeoPoint.SCALE);

      long id = threats.size() + 1L;
      Instant now = clock.now();
      Threat threat = new Threat(id, type, severity, confidence, location, description,
          caller, now, ThreatStatus.ACTIVE, dataHash, population, false, null, null);
      threats.add(threat);
      activeIds.add(id);
      statusCounts.merge(ThreatStatus.ACTIVE, 1L, Long::sum);
      typeCounts.merge(type, 1L, Long::sum);
      if (severity >= CRITICAL_SEVERITY) {
        criticalCount++;
      }

      metrics.increment("threat.registered");
      log.info("Registered threat {} type={} severity={} confidence={} reporter={} description={}",
          id, type, severity, confidence, caller, Logs.truncate(description));
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put("type", type.name());
      attributes.put("severity", Integer.toString(severity));
      attributes.put("confidence", Integer.toString(confidence));
      events.publish(RegistryEventType.THREAT_REGISTERED, id, 0L, now, caller, attributes);
      return id;
    } catch (RegistryException ex) {
      throw rejected("registerThreat", caller, ex);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Moves a threat to another status.
   *
   * @param caller principal holding {@link Role#REPORTER}
   * @param threatId threat identifier
   * @param newStatus target status; must differ from the current one
   * @throws RegistryException {@code UNAUTHORIZED}, {@code NOT_FOUND}, {@code INVALID_INPUT} for a missing status,
   *     or {@code NO_OP_REJECTED}
   */
  public void updateStatus(Principal caller, long threatId, ThreatStatus newStatus) {
    lock.writeLock().lock();
    try {
      access.require(caller, Role.REPORTER, "updateThreatStatus");
      Threat current = find(threatId);
      RegistryInputs.present("status", newStatus);
      if (current.status() == newStatus) {
        throw RegistryException.noOp("threat", threatId, newStatus);
      }
      applyStatus(current, newStatus, caller, clock.now());
    } catch (RegistryException ex) {
      throw rejected("updateThreatStatus", caller, ex);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Records the single human review of a threat.
   *
   * <p>An illegitimate verdict moves the threat to {@link ThreatStatus#FALSE_POSITIVE} only when it is currently
   * {@link ThreatStatus#ACTIVE}; threats in any other status keep their status and only gain the verification.</p>
   *
   * @param caller principal holding {@link Role#VERIFIER}
   * @param threatId threat identifier
   * @param legitimate reviewer's verdict
   * @throws RegistryException {@code UNAUTHORIZED}, {@code NOT_FOUND}, or {@code ALREADY_VERIFIED}
   */
  public void verifyThreat(Principal caller, long threatId, boolean legitimate) {
    lock.writeLock().lock();
    try {
      access.require(caller, Role.VERIFIER, "verifyThreat");
      Threat current = find(threatId);
      if (current.verified()) {
        throw new RegistryException(RegistryError.ALREADY_VERIFIED,
            "threat " + threatId + " was already verified by " + current.verifier());
      }

      Instant now = clock.now();
      Threat verified = current.withVerification(caller, now);
      store(verified);
      verifiedCount++;
      metrics.increment("threat.verified");
      log.info("Threat {} verified by {} legitimate={}", threatId, caller, legitimate);
      if (!legitimate && verified.status() == ThreatStatus.ACTIVE) {
        applyStatus(verified, ThreatStatus.FALSE_POSITIVE, caller, now);
      }
      events.publish(RegistryEventType.THREAT_VERIFIED, threatId, 0L, now, caller,
          Map.of("legitimate", Boolean.toString(legitimate)));
    } catch (RegistryException ex) {
      throw rejected("verifyThreat", caller, ex);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Reads a threat snapshot.
   *
   * @param threatId threat identifier
   * @return current snapshot
   * @throws RegistryException {@code NOT_FOUND}
   */
  public Threat get(long threatId) {
    lock.readLock().lock();
    try {
      return find(threatId);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Pages through active threat identifiers in active-set order: registration order until the first threat
   * leaves the set, after which the last entry takes the vacated slot.
   *
   * @param offset first position, non-negative
   * @param limit page size 1-100
   * @return identifiers; empty when {@code offset} is past the end
   * @throws RegistryException {@code INVALID_INPUT} for a bad offset or limit
   */
  public List<Long> listActive(int offset, int limit) {
    RegistryInputs.page(offset, limit);
    lock.readLock().lock();
    try {
      return Pagination.forward(activeIds.size(), activeIds::get, offset, limit);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Pages through threats of one type in registration order.
   *
   * @param type threat type
   * @param offset first matching position, non-negative
   * @param limit page size 1-100
   * @return identifiers
   * @throws RegistryException {@code INVALID_INPUT} for a missing type or bad offset/limit
   */
  public List<Long> listByType(ThreatType type, int offset, int limit) {
    RegistryInputs.present("type", type);
    RegistryInputs.page(offset, limit);
    return scan(threat -> threat.type() == type, offset, limit);
  }

  /**
   * Pages through threats at or above a severity in registration order.
   *
   * @param minSeverity lowest severity to include, 1-5
   * @param offset first matching position, non-negative
   * @param limit page size 1-100
   * @return identifiers
   * @throws RegistryException {@code INVALID_INPUT} for a bad severity, offset, or limit
   */
  public List<Long> listBySeverity(int minSeverity, int offset, int limit) {
    RegistryInputs.severity(minSeverity);
    RegistryInputs.page(offset, limit);
    return scan(threat -> threat.severity() >= minSeverity, offset, limit);
  }

  /**
   * Every active identifier in active-set order.
   *
   * @return immutable snapshot
   */
  public List<Long> activeThreatIds() {
    lock.readLock().lock();
    try {
      return activeIds.toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return number of registered threats
   */
  public long totalThreats() {
    lock.readLock().lock();
    try {
      return threats.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Reads every counter in one consistent snapshot.
   *
   * @return counters
   */
  public ThreatRegistryStats stats() {
    lock.readLock().lock();
    try {
      return new ThreatRegistryStats(
          threats.size(),
          statusCounts.get(ThreatStatus.ACTIVE),
          statusCounts.get(ThreatStatus.RESOLVED),
          verifiedCount,
          criticalCount,
          statusCounts,
          typeCounts);
    } finally {
      lock.readLock().unlock();
    }
  }

  private List<Long> scan(Predicate<Threat> filter, int offset, int limit) {
    lock.readLock().lock();
    try {
      List<Long> page = new ArrayList<>(Math.min(limit, threats.size()));
      int matched = 0;
      for (Threat threat : threats) {
        if (!filter.test(threat)) {
          continue;
        }
        if (matched++ < offset) {
          continue;
        }
        page.add(threat.id());
        if (page.size() == limit) {
          break;
        }
      }
      return List.copyOf(page);
    } finally {
      lock.readLock().unlock();
    }
  }

  private void applyStatus(Threat current, ThreatStatus newStatus, Principal caller, Instant now) {
    ThreatStatus oldStatus = current.status();
    long id = current.id();
    store(current.withStatus(newStatus));
    statusCounts.merge(oldStatus, -1L, Long::sum);
    statusCounts.merge(newStatus, 1L, Long::sum);
    if (current.isActive()) {
      activeIds.remove(id);
    } else if (newStatus == ThreatStatus.ACTIVE) {
      activeIds.add(id);
    }

    metrics.increment("threat.status.updated");
    log.debug("Threat {} status {} -> {} by {} (active={})", id, oldStatus, newStatus, caller, activeIds.size());
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("oldStatus", oldStatus.name());
    attributes.put("newStatus", newStatus.name());
    events.publish(RegistryEventType.THREAT_STATUS_UPDATED, id, 0L, now, caller, attributes);
  }

  private Threat find(long threatId) {
    if (threatId < 1 || threatId > threats.size()) {
      throw RegistryException.notFound("threat", threatId);
    }
    return threats.get((int) (threatId - 1));
  }

  private void store(Threat threat) {
    threats.set((int) (threat.id() - 1), threat);
  }

  private RegistryException rejected(String operation, Principal caller, RegistryException ex) {
    metrics.increment("registry.rejected." + ex.kind().metricName());
    log.warn("Rejected {} by {}: {} ({})", operation, caller, ex.kind(), ex.getMessage());
    return ex;
  }
}
