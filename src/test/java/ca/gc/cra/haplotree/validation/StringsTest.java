package ca.gc.cra.haplotree.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("GRCh38", Strings.requireNonBlank("build", "  GRCh38 "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("build", "  "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("build", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("build", "GRC\nh38"));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("env=test", Strings.requirePrintableAscii("attrs", "env=test", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "x".repeat(17), 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 16));
  }

  @Test
  void trimToEmptyHandlesNull() {
    assertEquals("", Strings.trimToEmpty(null));
    assertEquals("a", Strings.trimToEmpty(" a "));
  }
}
