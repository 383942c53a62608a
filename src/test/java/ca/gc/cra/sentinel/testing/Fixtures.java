package ca.gc.cra.sentinel.testing;

import ca.gc.cra.sentinel.application.registry.AlertDraft;
import ca.gc.cra.sentinel.application.registry.ThreatSubmission;
import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.domain.alert.AlertChannel;
import ca.gc.cra.sentinel.domain.threat.ContentHash;
import ca.gc.cra.sentinel.domain.threat.GeoPoint;
import ca.gc.cra.sentinel.domain.threat.ThreatType;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Shared principals and well-formed inputs for registry tests.
 */
public final class Fixtures {
  public static final Principal OWNER = Principal.of("owner");
  public static final Principal REPORTER = Principal.of("reporter-1");
  public static final Principal VERIFIER = Principal.of("verifier-1");
  public static final Principal SENDER = Principal.of("sender-1");
  public static final Principal STRANGER = Principal.of("stranger");

  public static final ContentHash EVIDENCE = ContentHash.sha256("buoy-42 telemetry".getBytes(StandardCharsets.UTF_8));

  private Fixtures() {}

  public static ThreatSubmission threat(ThreatType type, int severity) {
    return new ThreatSubmission(type, severity, 80, GeoPoint.ofDegrees(44.65, -63.57),
        "Observed " + type.name().toLowerCase(Locale.ROOT), EVIDENCE, 1200);
  }

  public static ThreatSubmission storm(int severity) {
    return threat(ThreatType.STORM, severity);
  }

  public static AlertDraft alert(long threatId, int severity) {
    return new AlertDraft(threatId, "Shelter in place", severity,
        EnumSet.of(AlertChannel.WEB, AlertChannel.SMS), List.of("a@x.com"));
  }
}
