package ca.gc.cra.haplotree.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseIntAcceptsValuesWithinBounds() {
    assertEquals(10, Numbers.parseInt("topN", " 10 ", 1, 100));
  }

  @Test
  void parseIntRejectsOutOfRangeAndGarbage() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("topN", "0", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("topN", "ten", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("topN", "", 1, 100));
  }

  @Test
  void parseDoubleRejectsNonFiniteValues() {
    assertEquals(0.5, Numbers.parseDouble("cap", "0.5", 0, 1));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("cap", "NaN", 0, 1));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("cap", "Infinity", 0, 1));
  }

  @Test
  void requireRangeRejectsValuesAboveMaximum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("depth", 65, 1, 64));
  }
}
