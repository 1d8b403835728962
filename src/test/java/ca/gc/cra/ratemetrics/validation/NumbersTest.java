package ca.gc.cra.ratemetrics.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(9090, Numbers.requireRange("port", 9090, 0, 65_535));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("port", -1, 0, 65_535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("port", 65_536, 0, 65_535));
  }

  @Test
  void requirePositiveRejectsZeroAndNegatives() {
    assertEquals(3, Numbers.requirePositive("interval", 3));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("interval", 0));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("interval", -2));
    assertTrue(ex.getMessage().startsWith("interval must be positive"));
  }

  @Test
  void requirePositiveFiniteRejectsUnusableDenominators() {
    assertEquals(0.5d, Numbers.requirePositiveFinite("intervalSecs", 0.5d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositiveFinite("intervalSecs", 0.0d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositiveFinite("intervalSecs", -1.0d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositiveFinite("intervalSecs", Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requirePositiveFinite("intervalSecs", Double.POSITIVE_INFINITY));
  }
}
