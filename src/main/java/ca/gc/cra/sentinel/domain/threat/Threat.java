package ca.gc.cra.sentinel.domain.threat;

import ca.gc.cra.sentinel.domain.access.Principal;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a recorded environmental threat.
 *
 * <p>The report fields are fixed at registration. Status and verification change only through the threat
 * registry, which replaces the stored snapshot via {@link #withStatus(ThreatStatus)} and
 * {@link #withVerification(Principal, Instant)}; snapshots handed to callers never change.</p>
 *
 * @param id registry-assigned identifier, starting at 1
 * @param type threat classification
 * @param severity severity 1-5
 * @param confidence detection confidence percentage 0-100
 * @param location fixed-point coordinates
 * @param description non-blank description
 * @param reporter principal that registered the threat
 * @param createdAt registration time
 * @param status current lifecycle status
 * @param dataHash non-zero fingerprint of supporting evidence
 * @param affectedPopulation estimated affected population, non-negative
 * @param verified whether a verifier has reviewed the threat
 * @param verifier reviewing principal; {@code null} until verified
 * @param verifiedAt review time; {@code null} until verified
 * @since 0.1.0
 */
public record Threat(
    long id,
    ThreatType type,
    int severity,
    int confidence,
    GeoPoint location,
    String description,
    Principal reporter,
    Instant createdAt,
    ThreatStatus status,
    ContentHash dataHash,
    long affectedPopulation,
    boolean verified,
    Principal verifier,
    Instant verifiedAt) {

  /**
   * Validates non-null invariants.
   */
  public Threat {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(reporter, "reporter");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(dataHash, "dataHash");
    if (verified && (verifier == null || verifiedAt == null)) {
      throw new IllegalArgumentException("verified threats require verifier and verifiedAt");
    }
  }

  /**
   * Returns a copy carrying a new status.
   *
   * @param newStatus replacement status
   * @return updated snapshot
   */
  public Threat withStatus(ThreatStatus newStatus) {
    return new Threat(id, type, severity, confidence, location, description, reporter, createdAt,
        newStatus, dataHash, affectedPopulation, verified, verifier, verifiedAt);
  }

  /**
   * Returns a copy marked as verified.
   *
   * @param by verifying principal
   * @param at verification time
   * @return updated snapshot
   */
  public Threat withVerification(Principal by, Instant at) {
    return new Threat(id, type, severity, confidence, location, description, reporter, createdAt,
        status, dataHash, affectedPopulation, true, by, at);
  }

  /**
   * @return {@code true} when the threat is in {@link ThreatStatus#ACTIVE}
   */
  public boolean isActive() {
    return status == ThreatStatus.ACTIVE;
  }
}
