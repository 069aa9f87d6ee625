package ca.gc.cra.warden.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {
  @Test
  void shortValuesAreFlattenedButKept() {
    assertEquals("engine use  in blitz", Logs.truncate("engine use\r\nin blitz", 120));
  }

  @Test
  void longValuesAreCutAtByteBudget() {
    assertEquals("abcde... (truncated, 5 of 10)", Logs.truncate("abcdefghij", 5));
  }

  @Test
  void multiByteCharactersAreNotSplit() {
    // each 'é' is two bytes; a three-byte budget keeps only the first
    assertEquals("é... (truncated, 3 of 6)", Logs.truncate("ééé", 3));
  }

  @Test
  void nullAndInvalidBudget() {
    assertEquals("<null>", Logs.truncate(null, 10));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
