package ca.gc.cra.netsim.domain.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MacAddressTest {

  @Test
  void parsesCommonNotations() {
    MacAddress expected = new MacAddress(0x001A2B3C4D5EL);
    assertEquals(expected, MacAddress.parse("00:1a:2b:3c:4d:5e"));
    assertEquals(expected, MacAddress.parse("00-1A-2B-3C-4D-5E"));
    assertEquals(expected, MacAddress.parse("001a.2b3c.4d5e"));
    assertEquals("00:1A:2B:3C:4D:5E", expected.toString());
  }

  @Test
  void rejectsGarbage() {
    assertThrows(IllegalArgumentException.class, () -> MacAddress.parse("00:1a:2b"));
    assertThrows(IllegalArgumentException.class, () -> MacAddress.parse("zz:zz:zz:zz:zz:zz"));
  }

  @Test
  void mapsOspfGroupsToEthernetMulticast() {
    assertEquals(MacAddress.parse("01:00:5e:00:00:05"), MacAddress.ipv4Multicast(Ipv4Address.parse("224.0.0.5")));
    assertThrows(IllegalArgumentException.class, () -> MacAddress.ipv4Multicast(Ipv4Address.parse("10.0.0.5")));
  }

  @Test
  void classifiesGroupBit() {
    assertTrue(MacAddress.BROADCAST.isBroadcast());
    assertTrue(MacAddress.BROADCAST.isMulticast());
    assertTrue(MacAddress.parse("01:00:5e:00:00:06").isMulticast());
    assertFalse(MacAddress.parse("02:00:00:00:00:01").isMulticast());
  }
}
