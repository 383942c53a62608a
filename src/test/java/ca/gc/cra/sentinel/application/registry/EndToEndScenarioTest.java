package ca.gc.cra.sentinel.application.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.access.AccessControl;
import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.domain.access.Role;
import ca.gc.cra.sentinel.domain.alert.AlertChannel;
import ca.gc.cra.sentinel.domain.alert.AlertStatus;
import ca.gc.cra.sentinel.domain.events.RegistryEvent;
import ca.gc.cra.sentinel.domain.events.RegistryEventType;
import ca.gc.cra.sentinel.domain.threat.ContentHash;
import ca.gc.cra.sentinel.domain.threat.GeoPoint;
import ca.gc.cra.sentinel.domain.threat.ThreatStatus;
import ca.gc.cra.sentinel.domain.threat.ThreatType;
import ca.gc.cra.sentinel.infrastructure.events.InMemoryRegistryEventEmitter;
import ca.gc.cra.sentinel.testing.MutableClock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class EndToEndScenarioTest {

  @Test
  void hurricaneReportFlowsThroughBothRegistries() {
    Principal owner = Principal.of("coast-guard");
    Principal station = Principal.of("station-miami");
    MutableClock clock = new MutableClock();
    InMemoryRegistryEventEmitter events = new InMemoryRegistryEventEmitter();
    AccessControl access = new AccessControl(owner, clock, null, events);
    access.grant(owner, Role.REPORTER, station);
    access.grant(owner, Role.SENDER, station);
    ThreatRegistry threats = new ThreatRegistry(access, clock, null, events);
    AlertRegistry alerts = new AlertRegistry(access, clock, null, events, 4, 1000);

    long threatId = threats.registerThreat(station, new ThreatSubmission(ThreatType.STORM, 5, 90,
        new GeoPoint(25_760_000L, -80_190_000L), "hurricane", ContentHash.fromHex("ab".repeat(32)),
        2_500_000L));

    assertEquals(1L, threatId);
    assertEquals(ThreatStatus.ACTIVE, threats.get(1).status());
    assertEquals(25.76, threats.get(1).location().latitude(), 1e-9);
    assertEquals(1L, threats.stats().total());
    assertEquals(1L, threats.stats().active());

    long alertId = alerts.createAlert(station, new AlertDraft(1, "evacuate", 5,
        EnumSet.of(AlertChannel.WEB, AlertChannel.SMS), List.of("a@x.com")));

    assertEquals(1L, alertId);
    assertTrue(alerts.get(1).emergency());
    assertEquals(List.of(1L), alerts.listEmergency(0, 10));

    clock.advance(Duration.ofSeconds(42));
    alerts.updateStatus(station, 1, AlertStatus.DELIVERED, null);

    assertNotNull(alerts.get(1).deliveredAt());
    assertEquals(1L, alerts.stats().successful());
    assertEquals(Duration.ofSeconds(42), alerts.stats().averageDeliveryTime());

    threats.updateStatus(station, 1, ThreatStatus.FALSE_POSITIVE);

    assertTrue(threats.activeThreatIds().isEmpty());
    assertEquals(0L, threats.stats().byStatus().get(ThreatStatus.ACTIVE));
    assertEquals(1L, threats.stats().byStatus().get(ThreatStatus.FALSE_POSITIVE));

    List<RegistryEventType> order = events.snapshot().stream().map(RegistryEvent::type).toList();
    assertEquals(List.of(
        RegistryEventType.ROLE_GRANTED,
        RegistryEventType.ROLE_GRANTED,
        RegistryEventType.THREAT_REGISTERED,
        RegistryEventType.ALERT_CREATED,
        RegistryEventType.EMERGENCY_ALERT,
        RegistryEventType.ALERT_STATUS_UPDATED,
        RegistryEventType.ALERT_DELIVERED,
        RegistryEventType.THREAT_STATUS_UPDATED), order);
  }
}
