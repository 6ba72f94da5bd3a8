package br.rio.confere.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeIsInclusive() {
    assertEquals(2000, Numbers.requireRange("filterYear", 2000, 2000, 2100));
    assertEquals(2100, Numbers.requireRange("filterYear", 2100, 2000, 2100));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("filterYear", 1999, 2000, 2100));
    assertEquals("filterYear must be between 2000 and 2100 (was 1999)", ex.getMessage());
  }

  @Test
  void parseIntTrimsAndValidates() {
    assertEquals(5, Numbers.parseInt("max", " 5 ", 0, 10));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("max", "five", 0, 10));
    assertTrue(ex.getMessage().contains("must be an integer"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("max", "11", 0, 10));
  }

  @Test
  void parseDoubleRejectsNanAndOutOfRange() {
    assertEquals(0.25, Numbers.parseDouble("retryJitter", "0.25", 0.0, 0.99));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("retryJitter", "NaN", 0.0, 0.99));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("retryJitter", "1.5", 0.0, 0.99));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("retryJitter", "", 0.0, 0.99));
  }
}
