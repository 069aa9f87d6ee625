package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {
  @Test
  void rangeIsInclusive() {
    assertEquals(1L, Numbers.requireRange("n", 1, 1, 10));
    assertEquals(10L, Numbers.requireRange("n", 10, 1, 10));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("moreLikeLimit", 0, 1, 100));
    assertEquals("moreLikeLimit must be between 1 and 100 (was 0)", ex.getMessage());
  }

  @Test
  void parseIntInRangeValidatesSyntaxAndBounds() {
    assertEquals(5, Numbers.parseIntInRange("fanOutThreads", " 5 ", 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("fanOutThreads", "five", 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("fanOutThreads", "65", 1, 64));
  }
}
