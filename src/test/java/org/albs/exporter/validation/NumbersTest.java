package org.albs.exporter.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1, Numbers.requireRange("workers", 1, 1, 64));
    assertEquals(64, Numbers.requireRange("workers", 64, 1, 64));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65, 1, 64));
    assertEquals("workers must be between 1 and 64 (was 65)", ex.getMessage());
  }

  @Test
  void parseInRangeParsesTrimmedText() {
    assertEquals(300, Numbers.parseInRange("http.timeoutSeconds", " 300 ", 1, 86_400));
  }

  @Test
  void parseInRangeRejectsNonNumeric() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("export.workers", "four", 1, 64));
    assertEquals("export.workers must be numeric (was four)", ex.getMessage());
  }
}
