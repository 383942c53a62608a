package ca.gc.cra.sentinel.domain.threat;

/**
 * Fixed-point coordinate pair stored as micro-degrees (degrees scaled by {@value #SCALE}).
 *
 * @param latitudeMicros latitude in micro-degrees
 * @param longitudeMicros longitude in micro-degrees
 * @since 0.1.0
 */
public record GeoPoint(long latitudeMicros, long longitudeMicros) {
  /** Scale between degrees and stored integers. */
  public static final long SCALE = 1_000_000L;

  /**
   * Builds a point from decimal degrees, rounding to the nearest micro-degree. Range checks belong to the
   * registry, which rejects points outside [-90, 90] and [-180, 180].
   *
   * @param latitude latitude in degrees
   * @param longitude longitude in degrees
   * @return fixed-point coordinate
   * @throws IllegalArgumentException if either value is NaN or infinite
   */
  public static GeoPoint ofDegrees(double latitude, double longitude) {
    if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
      throw new IllegalArgumentException(
          "coordinates must be finite (latitude=" + latitude + ", longitude=" + longitude + ")");
    }
    return new GeoPoint(Math.round(latitude * SCALE), Math.round(longitude * SCALE));
  }

  /**
   * @return latitude in decimal degrees
   */
  public double latitude() {
    return (double) latitudeMicros / SCALE;
  }

  /**
   * @return longitude in decimal degrees
   */
  public double longitude() {
    return (double) longitudeMicros / SCALE;
  }
}
