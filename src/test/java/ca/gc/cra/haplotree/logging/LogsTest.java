package ca.gc.cra.haplotree.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("Not Found", Logs.truncate("Not Found", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void longValuesAreCutAtByteBudget() {
    String truncated = Logs.truncate("a".repeat(100), 10);

    assertTrue(truncated.startsWith("aaaaaaaaaa..."));
    assertTrue(truncated.endsWith("(truncated, 10 of 100 bytes)"));
  }

  @Test
  void multiByteCharactersAreNotSplit() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."));
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
