package ca.gc.cra.sentinel.application.registry;

import static ca.gc.cra.sentinel.testing.Fixtures.OWNER;
import static ca.gc.cra.sentinel.testing.Fixtures.REPORTER;
import static ca.gc.cra.sentinel.testing.Fixtures.SENDER;
import static ca.gc.cra.sentinel.testing.Fixtures.VERIFIER;
import static ca.gc.cra.sentinel.testing.Fixtures.storm;
import static ca.gc.cra.sentinel.testing.Fixtures.threat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.access.AccessControl;
import ca.gc.cra.sentinel.domain.access.Role;
import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import ca.gc.cra.sentinel.domain.events.RegistryEventType;
import ca.gc.cra.sentinel.domain.threat.ContentHash;
import ca.gc.cra.sentinel.domain.threat.GeoPoint;
import ca.gc.cra.sentinel.domain.threat.Threat;
import ca.gc.cra.sentinel.domain.threat.ThreatStatus;
import ca.gc.cra.sentinel.domain.threat.ThreatType;
import ca.gc.cra.sentinel.infrastructure.events.InMemoryRegistryEventEmitter;
import ca.gc.cra.sentinel.testing.Fixtures;
import ca.gc.cra.sentinel.testing.MutableClock;
import ca.gc.cra.sentinel.testing.RecordingMetricsPort;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ThreatRegistryTest {
  private MutableClock clock;
  private RecordingMetricsPort metrics;
  private InMemoryRegistryEventEmitter events;
  private ThreatRegistry registry;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    metrics = new RecordingMetricsPort();
    events = new InMemoryRegistryEventEmitter();
    AccessControl access = new AccessControl(OWNER, clock, metrics, events);
    access.grant(OWNER, Role.REPORTER, REPORTER);
    access.grant(OWNER, Role.VERIFIER, VERIFIER);
    access.grant(OWNER, Role.SENDER, SENDER);
    events.clear();
    registry = new ThreatRegistry(access, clock, metrics, events);
  }

  @Test
  void registerAssignsSequentialIdsAndStoresSnapshot() {
    long first = registry.registerThreat(REPORTER, storm(3));
    clock.advance(Duration.ofSeconds(5));
    long second = registry.registerThreat(REPORTER, threat(ThreatType.POLLUTION, 2));

    assertEquals(1L, first);
    assertEquals(2L, second);
    Threat stored = registry.get(second);
    assertEquals(ThreatType.POLLUTION, stored.type());
    assertEquals(ThreatStatus.ACTIVE, stored.status());
    assertEquals(REPORTER, stored.reporter());
    assertEquals(clock.now(), stored.createdAt());
    assertFalse(stored.verified());
    assertNull(stored.verifier());
    assertEquals(List.of(1L, 2L), registry.activeThreatIds());
    assertEquals(2L, metrics.count("threat.registered"));

    RegistryEvent event = events.ofType(RegistryEventType.THREAT_REGISTERED).get(1);
    assertEquals(2L, event.recordId());
    assertEquals("POLLUTION", event.attribute("type"));
    assertEquals("2", event.attribute("severity"));
  }

  @Test
  void registerRequiresReporterRole() {
    RegistryException ex = assertThrows(RegistryException.class, () -> registry.registerThreat(SENDER, storm(3)));

    assertEquals(RegistryError.UNAUTHORIZED, ex.kind());
    assertEquals(0L, registry.totalThreats());
    assertTrue(events.snapshot().isEmpty());
    assertEquals(1L, metrics.count("registry.rejected.unauthorized"));
  }

  @Test
  void ownerMayRegisterWithoutExplicitGrant() {
    assertEquals(1L, registry.registerThreat(OWNER, storm(1)));
  }

  @Test
  void registerRejectsInvalidSubmissions() {
    GeoPoint here = GeoPoint.ofDegrees(1, 1);
    List<ThreatSubmission> invalid = List.of(
        new ThreatSubmission(ThreatType.STORM, 0, 50, here, "x", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 6, 50, here, "x", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 101, here, "x", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 3, -1, here, "x", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 50, here, "  ", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 50, here, "x", ContentHash.ZERO, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 50, here, "x", null, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 50, here, "x", Fixtures.EVIDENCE, -5),
        new ThreatSubmission(null, 3, 50, here, "x", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 50, null, "x", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 50, GeoPoint.ofDegrees(90.000001, 0), "x", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 50, GeoPoint.ofDegrees(0, -180.000001), "x", Fixtures.EVIDENCE, 0),
        new ThreatSubmission(ThreatType.STORM, 3, 50, new GeoPoint(1_000_000_000L, 0), "x", Fixtures.EVIDENCE, 0));

    for (ThreatSubmission submission : invalid) {
      RegistryException ex = assertThrows(RegistryException.class,
          () -> registry.registerThreat(REPORTER, submission), submission::toString);
      assertEquals(RegistryError.INVALID_INPUT, ex.kind());
    }
    assertEquals(0L, registry.totalThreats());
    assertEquals(invalid.size(), metrics.count("registry.rejected.invalid_input"));
  }

  @Test
  void boundaryValuesAreAccepted() {
    registry.registerThreat(REPORTER, new ThreatSubmission(ThreatType.ANOMALY, 1, 0,
        GeoPoint.ofDegrees(-90, -180), "d", Fixtures.EVIDENCE, 0));
    registry.registerThreat(REPORTER, new ThreatSubmission(ThreatType.ANOMALY, 5, 100,
        GeoPoint.ofDegrees(90, 180), "d", Fixtures.EVIDENCE, Long.MAX_VALUE));

    assertEquals(2L, registry.totalThreats());
    assertEquals(1L, registry.stats().critical());
  }

  @Test
  void statusUpdateMaintainsCountersAndActiveSet() {
    registry.registerThreat(REPORTER, storm(3));
    registry.registerThreat(REPORTER, storm(4));
    registry.registerThreat(REPORTER, storm(5));

    registry.updateStatus(REPORTER, 1, ThreatStatus.RESOLVED);

    assertEquals(List.of(3L, 2L), registry.activeThreatIds());
    ThreatRegistryStats stats = registry.stats();
    assertEquals(2L, stats.active());
    assertEquals(1L, stats.resolved());
    assertEquals(3L, stats.total());

    registry.updateStatus(REPORTER, 1, ThreatStatus.ACTIVE);
    assertEquals(List.of(3L, 2L, 1L), registry.activeThreatIds());

    RegistryEvent last = events.ofType(RegistryEventType.THREAT_STATUS_UPDATED).get(1);
    assertEquals("RESOLVED", last.attribute("oldStatus"));
    assertEquals("ACTIVE", last.attribute("newStatus"));
  }

  @Test
  void nonActiveTransitionsKeepActiveSetUntouched() {
    registry.registerThreat(REPORTER, storm(3));
    registry.updateStatus(REPORTER, 1, ThreatStatus.INVESTIGATING);
    registry.updateStatus(REPORTER, 1, ThreatStatus.FALSE_POSITIVE);

    assertTrue(registry.activeThreatIds().isEmpty());
    assertEquals(1L, registry.stats().byStatus().get(ThreatStatus.FALSE_POSITIVE));
    assertEquals(0L, registry.stats().byStatus().get(ThreatStatus.INVESTIGATING));
  }

  @Test
  void sameStatusIsRejectedAsNoOp() {
    registry.registerThreat(REPORTER, storm(3));

    RegistryException ex = assertThrows(RegistryException.class,
        () -> registry.updateStatus(REPORTER, 1, ThreatStatus.ACTIVE));

    assertEquals(RegistryError.NO_OP_REJECTED, ex.kind());
    assertTrue(events.ofType(RegistryEventType.THREAT_STATUS_UPDATED).isEmpty());
  }

  @Test
  void rejectedMutationsLeaveStateUntouched() {
    registry.registerThreat(REPORTER, storm(3));
    registry.registerThreat(REPORTER, threat(ThreatType.POLLUTION, 5));
    registry.registerThreat(REPORTER, storm(2));
    registry.updateStatus(REPORTER, 1, ThreatStatus.RESOLVED);
    registry.verifyThreat(VERIFIER, 2, true);
    ThreatRegistryStats statsBefore = registry.stats();
    List<Long> activeBefore = registry.activeThreatIds();
    List<Long> stormsBefore = registry.listByType(ThreatType.STORM, 0, 100);
    List<Long> severeBefore = registry.listBySeverity(2, 0, 100);
    List<Threat> recordsBefore = List.of(registry.get(1), registry.get(2), registry.get(3));
    int eventsBefore = events.snapshot().size();

    assertEquals(RegistryError.NO_OP_REJECTED, assertThrows(RegistryException.class,
        () -> registry.updateStatus(REPORTER, 1, ThreatStatus.RESOLVED)).kind());
    assertEquals(RegistryError.ALREADY_VERIFIED, assertThrows(RegistryException.class,
        () -> registry.verifyThreat(VERIFIER, 2, false)).kind());
    assertEquals(RegistryError.NOT_FOUND, assertThrows(RegistryException.class,
        () -> registry.updateStatus(REPORTER, 4, ThreatStatus.ACTIVE)).kind());
    assertEquals(RegistryError.NOT_FOUND, assertThrows(RegistryException.class,
        () -> registry.verifyThreat(VERIFIER, 4, false)).kind());
    assertEquals(RegistryError.INVALID_INPUT, assertThrows(RegistryException.class,
        () -> registry.updateStatus(REPORTER, 3, null)).kind());
    assertEquals(RegistryError.INVALID_INPUT, assertThrows(RegistryException.class,
        () -> registry.registerThreat(REPORTER, new ThreatSubmission(ThreatType.STORM, 9, 50,
            GeoPoint.ofDegrees(1, 1), "x", Fixtures.EVIDENCE, 0))).kind());
    assertEquals(RegistryError.UNAUTHORIZED, assertThrows(RegistryException.class,
        () -> registry.updateStatus(SENDER, 3, ThreatStatus.RESOLVED)).kind());

    assertEquals(statsBefore, registry.stats());
    assertEquals(activeBefore, registry.activeThreatIds());
    assertEquals(stormsBefore, registry.listByType(ThreatType.STORM, 0, 100));
    assertEquals(severeBefore, registry.listBySeverity(2, 0, 100));
    assertEquals(recordsBefore, List.of(registry.get(1), registry.get(2), registry.get(3)));
    assertEquals(3L, registry.totalThreats());
    assertEquals(eventsBefore, events.snapshot().size());
  }

  @Test
  void unknownThreatIsNotFound() {
    assertEquals(RegistryError.NOT_FOUND,
        assertThrows(RegistryException.class, () -> registry.get(1)).kind());
    assertEquals(RegistryError.NOT_FOUND,
        assertThrows(RegistryException.class, () -> registry.updateStatus(REPORTER, 0, ThreatStatus.RESOLVED)).kind());
    assertEquals(RegistryError.NOT_FOUND,
        assertThrows(RegistryException.class, () -> registry.verifyThreat(VERIFIER, 9, true)).kind());
  }

  @Test
  void legitimateVerificationKeepsStatus() {
    registry.registerThreat(REPORTER, storm(3));
    clock.advance(Duration.ofMinutes(2));

    registry.verifyThreat(VERIFIER, 1, true);

    Threat threat = registry.get(1);
    assertTrue(threat.verified());
    assertEquals(VERIFIER, threat.verifier());
    assertEquals(clock.now(), threat.verifiedAt());
    assertEquals(ThreatStatus.ACTIVE, threat.status());
    assertEquals(1L, registry.stats().verified());
    assertEquals("true", events.ofType(RegistryEventType.THREAT_VERIFIED).get(0).attribute("legitimate"));
  }

  @Test
  void illegitimateVerificationOfActiveThreatMarksFalsePositive() {
    registry.registerThreat(REPORTER, storm(3));
    events.clear();

    registry.verifyThreat(VERIFIER, 1, false);

    assertEquals(ThreatStatus.FALSE_POSITIVE, registry.get(1).status());
    assertTrue(registry.activeThreatIds().isEmpty());
    List<RegistryEvent> emitted = events.snapshot();
    assertEquals(2, emitted.size());
    assertEquals(RegistryEventType.THREAT_STATUS_UPDATED, emitted.get(0).type());
    assertEquals(RegistryEventType.THREAT_VERIFIED, emitted.get(1).type());
  }

  @Test
  void illegitimateVerificationOfResolvedThreatOnlyRecordsVerification() {
    registry.registerThreat(REPORTER, storm(3));
    registry.updateStatus(REPORTER, 1, ThreatStatus.RESOLVED);
    events.clear();

    registry.verifyThreat(VERIFIER, 1, false);

    assertEquals(ThreatStatus.RESOLVED, registry.get(1).status());
    assertTrue(registry.get(1).verified());
    assertEquals(1, events.snapshot().size());
  }

  @Test
  void illegitimateVerificationOfInvestigatingThreatOnlyRecordsVerification() {
    registry.registerThreat(REPORTER, storm(3));
    registry.updateStatus(REPORTER, 1, ThreatStatus.INVESTIGATING);
    ThreatRegistryStats before = registry.stats();
    events.clear();

    registry.verifyThreat(VERIFIER, 1, false);

    // Only an ACTIVE threat is moved to FALSE_POSITIVE; an investigation in progress keeps its status.
    Threat threat = registry.get(1);
    assertEquals(ThreatStatus.INVESTIGATING, threat.status());
    assertTrue(threat.verified());
    assertEquals(VERIFIER, threat.verifier());
    assertEquals(before.byStatus(), registry.stats().byStatus());
    assertEquals(1L, registry.stats().verified());
    assertTrue(registry.activeThreatIds().isEmpty());
    List<RegistryEvent> emitted = events.snapshot();
    assertEquals(1, emitted.size());
    assertEquals(RegistryEventType.THREAT_VERIFIED, emitted.get(0).type());
  }

  @Test
  void secondVerificationIsRejected() {
    registry.registerThreat(REPORTER, storm(3));
    registry.verifyThreat(VERIFIER, 1, true);
    Instant firstVerifiedAt = registry.get(1).verifiedAt();
    clock.advance(Duration.ofHours(1));

    RegistryException ex = assertThrows(RegistryException.class, () -> registry.verifyThreat(OWNER, 1, false));

    assertEquals(RegistryError.ALREADY_VERIFIED, ex.kind());
    assertEquals(VERIFIER, registry.get(1).verifier());
    assertEquals(firstVerifiedAt, registry.get(1).verifiedAt());
    assertEquals(ThreatStatus.ACTIVE, registry.get(1).status());
    assertEquals(1L, registry.stats().verified());
  }

  @Test
  void verifyRequiresVerifierRole() {
    registry.registerThreat(REPORTER, storm(3));
    assertEquals(RegistryError.UNAUTHORIZED,
        assertThrows(RegistryException.class, () -> registry.verifyThreat(REPORTER, 1, true)).kind());
  }

  @Test
  void listByTypeAndSeverityFollowRegistrationOrder() {
    registry.registerThreat(REPORTER, storm(2));
    registry.registerThreat(REPORTER, threat(ThreatType.EROSION, 5));
    registry.registerThreat(REPORTER, storm(4));
    registry.registerThreat(REPORTER, threat(ThreatType.ALGAL_BLOOM, 4));
    registry.registerThreat(REPORTER, storm(5));

    assertEquals(List.of(1L, 3L, 5L), registry.listByType(ThreatType.STORM, 0, 10));
    assertEquals(List.of(3L, 5L), registry.listByType(ThreatType.STORM, 1, 10));
    assertEquals(List.of(1L), registry.listByType(ThreatType.STORM, 0, 1));
    assertTrue(registry.listByType(ThreatType.ANOMALY, 0, 10).isEmpty());
    assertEquals(List.of(2L, 3L, 4L, 5L), registry.listBySeverity(4, 0, 10));
    assertEquals(List.of(4L, 5L), registry.listBySeverity(4, 2, 100));
    assertTrue(registry.listBySeverity(4, 50, 10).isEmpty());
    assertEquals(3L, registry.stats().byType().get(ThreatType.STORM));
    assertEquals(4L, registry.stats().critical());
  }

  @Test
  void paginationArgumentsAreValidated() {
    registry.registerThreat(REPORTER, storm(2));

    assertEquals(RegistryError.INVALID_INPUT,
        assertThrows(RegistryException.class, () -> registry.listActive(-1, 10)).kind());
    assertEquals(RegistryError.INVALID_INPUT,
        assertThrows(RegistryException.class, () -> registry.listActive(0, 0)).kind());
    assertEquals(RegistryError.INVALID_INPUT,
        assertThrows(RegistryException.class, () -> registry.listActive(0, 101)).kind());
    assertEquals(RegistryError.INVALID_INPUT,
        assertThrows(RegistryException.class, () -> registry.listBySeverity(0, 0, 10)).kind());
    assertEquals(List.of(1L), registry.listActive(0, 100));
    assertTrue(registry.listActive(1, 100).isEmpty());
  }

  @Test
  void listActivePagesThroughActiveSet() {
    for (int i = 0; i < 7; i++) {
      registry.registerThreat(REPORTER, storm(1 + i % 5));
    }
    registry.updateStatus(REPORTER, 2, ThreatStatus.RESOLVED);

    assertEquals(List.of(1L, 7L, 3L), registry.listActive(0, 3));
    assertEquals(List.of(4L, 5L, 6L), registry.listActive(3, 3));
    assertTrue(registry.listActive(6, 3).isEmpty());
  }

  @Test
  void statsCountsSumToTotal() {
    registry.registerThreat(REPORTER, storm(2));
    registry.registerThreat(REPORTER, threat(ThreatType.ILLEGAL_DUMPING, 4));
    registry.updateStatus(REPORTER, 2, ThreatStatus.INVESTIGATING);

    ThreatRegistryStats stats = registry.stats();
    long byStatus = stats.byStatus().values().stream().mapToLong(Long::longValue).sum();
    long byType = stats.byType().values().stream().mapToLong(Long::longValue).sum();
    assertEquals(stats.total(), byStatus);
    assertEquals(stats.total(), byType);
  }
}
