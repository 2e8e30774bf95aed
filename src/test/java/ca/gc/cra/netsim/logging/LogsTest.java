package ca.gc.cra.netsim.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("Loading -> Full", Logs.truncate("Loading -> Full", 64));
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void truncateAppendsLengthMetadata() {
    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void hexStopsAtLimit() {
    assertEquals("4500", Logs.hex(new byte[] {0x45, 0x00}, 4));
    assertEquals("4500... (3 bytes)", Logs.hex(new byte[] {0x45, 0x00, 0x00}, 2));
    assertThrows(IllegalArgumentException.class, () -> Logs.hex(new byte[0], 0));
  }
}
