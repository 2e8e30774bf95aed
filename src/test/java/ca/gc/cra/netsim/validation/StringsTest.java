package ca.gc.cra.netsim.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("R1", Strings.requireNonBlank("device", "  R1  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("device", "R\u00011"));
  }

  @Test
  void requireIdentifierAcceptsInterfaceNames() {
    assertEquals("GigabitEthernet0/1", Strings.requireIdentifier("interface", "GigabitEthernet0/1"));
    assertEquals("BLOCK_WEB", Strings.requireIdentifier("acl", "BLOCK_WEB"));
  }

  @Test
  void requireIdentifierRejectsSpaces() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("acl", "BLOCK WEB"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("service", "n☃t", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("service", "abc", 2));
  }
}
