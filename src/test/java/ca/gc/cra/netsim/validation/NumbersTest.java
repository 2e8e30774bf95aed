package ca.gc.cra.netsim.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(255, Numbers.requireRange("ttl", 255, 1, 255));
  }

  @Test
  void requireRangeReportsBoundsAndValue() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("ttl", 0, 1, 255));
    assertEquals("ttl must be between 1 and 255 (was 0)", ex.getMessage());
  }

  @Test
  void requireRangeRejectsLongAboveMaximum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("timeout", 3_000_000L, 1L, 2_147_483L));
  }

  @Test
  void parseLongRejectsNonNumericText() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("routers", "three"));
    assertEquals("routers must be an integer (was 'three')", ex.getMessage());
  }

  @Test
  void parseLongTrimsWhitespace() {
    assertEquals(42L, Numbers.parseLong("seconds", " 42 "));
  }

  @Test
  void requirePositiveRejectsZero() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("capacity", 0));
  }
}
