package ca.gc.cra.sentinel.application.registry;

import ca.gc.cra.sentinel.domain.threat.ContentHash;
import ca.gc.cra.sentinel.domain.threat.GeoPoint;
import ca.gc.cra.sentinel.domain.threat.ThreatType;

/**
 * Caller-supplied threat report awaiting registration. Values are validated by
 * {@link ThreatRegistry#registerThreat}, not here, so malformed reports surface as
 * {@link RegistryError#INVALID_INPUT}.
 *
 * @param type threat classification
 * @param severity expected 1-5
 * @param confidence expected 0-100
 * @param location fixed-point coordinates
 * @param description expected non-blank
 * @param dataHash expected non-zero
 * @param affectedPopulation expected non-negative
 * @since 0.1.0
 */
public record ThreatSubmission(
    ThreatType type,
    int severity,
    int confidence,
    GeoPoint location,
    String description,
    ContentHash dataHash,
    long affectedPopulation) {}
