package org.albs.exporter.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("pulp.user", "   "));
    assertEquals("pulp.user must not be blank", ex.getMessage());
  }

  @Test
  void requireAccountNameAcceptsServiceAccounts() {
    assertEquals("pulp", Strings.requireAccountName("owner", "pulp"));
    assertEquals("build_user-1", Strings.requireAccountName("owner", "build_user-1"));
  }

  @Test
  void requireAccountNameRejectsShellMetacharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireAccountName("owner", "root:root"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireAccountName("owner", "Admin"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireAccountName("owner", "-rf"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("user", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("user", "abc", 2));
  }
}
