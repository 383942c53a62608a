package ca.gc.cra.sentinel.domain.threat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class GeoPointTest {

  @Test
  void ofDegreesRoundsToMicroDegrees() {
    GeoPoint point = GeoPoint.ofDegrees(25.7617004, -80.1917996);

    assertEquals(25_761_700L, point.latitudeMicros());
    assertEquals(-80_191_800L, point.longitudeMicros());
    assertEquals(25.7617, point.latitude(), 1e-9);
  }

  @Test
  void ofDegreesRejectsNonFiniteValues() {
    assertThrows(IllegalArgumentException.class, () -> GeoPoint.ofDegrees(1000.0, Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> GeoPoint.ofDegrees(Double.NaN, 0));
    assertThrows(IllegalArgumentException.class, () -> GeoPoint.ofDegrees(0, Double.POSITIVE_INFINITY));
    assertThrows(IllegalArgumentException.class, () -> GeoPoint.ofDegrees(Double.NEGATIVE_INFINITY, 0));
  }
}
