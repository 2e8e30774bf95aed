package ca.gc.cra.netsim.domain.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class Ipv4AddressTest {

  @Test
  void parsesAndRendersDottedQuad() {
    Ipv4Address address = Ipv4Address.parse("10.1.2.254");
    assertEquals("10.1.2.254", address.toString());
    assertEquals(Ipv4Address.of(10, 1, 2, 254), address);
    assertEquals("255.255.255.255", Ipv4Address.BROADCAST.toString());
  }

  @Test
  void rejectsMalformedLiterals() {
    assertThrows(IllegalArgumentException.class, () -> Ipv4Address.parse("256.1.1.1"));
    assertThrows(IllegalArgumentException.class, () -> Ipv4Address.parse("1.2.3"));
    assertThrows(IllegalArgumentException.class, () -> Ipv4Address.parse("a.b.c.d"));
  }

  @Test
  void appliesMasks() {
    SubnetMask mask = SubnetMask.ofPrefix(24);
    Ipv4Address host = Ipv4Address.parse("172.16.5.77");

    assertEquals(Ipv4Address.parse("172.16.5.0"), host.network(mask));
    assertTrue(host.sameSubnet(Ipv4Address.parse("172.16.5.1"), mask));
    assertFalse(host.sameSubnet(Ipv4Address.parse("172.16.6.1"), mask));
    assertEquals(24, SubnetMask.parse("255.255.255.0").prefixLength());
    assertEquals(Ipv4Address.parse("0.0.0.255"), mask.wildcard());
  }

  @Test
  void ordersUnsigned() {
    assertTrue(Ipv4Address.parse("200.0.0.1").compareTo(Ipv4Address.parse("10.0.0.1")) > 0);
    assertEquals(Ipv4Address.parse("10.0.1.0"), Ipv4Address.parse("10.0.0.255").plus(1));
  }

  @Test
  void classifiesMulticast() {
    assertTrue(Ipv4Address.parse("224.0.0.5").isMulticast());
    assertFalse(Ipv4Address.parse("223.255.255.255").isMulticast());
    assertTrue(Ipv4Address.ANY.isUnspecified());
  }
}
