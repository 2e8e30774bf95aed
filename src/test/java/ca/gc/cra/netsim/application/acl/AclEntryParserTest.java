package ca.gc.cra.netsim.application.acl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.domain.acl.AclAction;
import ca.gc.cra.netsim.domain.acl.AclRule;
import ca.gc.cra.netsim.domain.acl.PortOperator;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.List;
import org.junit.jupiter.api.Test;

class AclEntryParserTest {

  @Test
  void parsesStandardHostAndWildcard() {
    AclRule host = AclEntryParser.parseStandard(List.of("deny", "host", "10.0.1.2"));
    AclRule net = AclEntryParser.parseStandard(List.of("permit", "10.0.1.0", "0.0.0.255", "log"));

    assertEquals(AclAction.DENY, host.action());
    assertTrue(host.source().isHost());
    assertEquals(Ipv4Address.parse("0.0.0.255"), net.source().wildcard());
    assertTrue(net.log());
  }

  @Test
  void bareAddressIsAHostMatch() {
    AclRule rule = AclEntryParser.parseStandard(List.of("permit", "192.168.1.1"));
    assertTrue(rule.source().isHost());
  }

  @Test
  void parsesExtendedPortOperators() {
    AclRule rule = AclEntryParser.parseExtended(
        List.of("permit", "udp", "any", "range", "1000", "2000", "any", "eq", "domain"));

    assertEquals(17, rule.protocol());
    assertEquals(PortOperator.RANGE, rule.sourcePort().operator());
    assertEquals(2000, rule.sourcePort().portEnd());
    assertEquals(53, rule.destinationPort().port());
  }

  @Test
  void portlessProtocolsTakeNoPortConditions() {
    AclRule rule = AclEntryParser.parseExtended(List.of("deny", "icmp", "any", "any"));
    assertNull(rule.sourcePort());
    assertNull(rule.destinationPort());
  }

  @Test
  void rejectsMalformedEntries() {
    assertThrows(IllegalArgumentException.class, () -> AclEntryParser.parseStandard(List.of("allow", "any")));
    assertThrows(IllegalArgumentException.class,
        () -> AclEntryParser.parseExtended(List.of("permit", "udp", "any", "any", "established")));
    assertThrows(IllegalArgumentException.class, () -> AclEntryParser.parseExtended(List.of("permit", "tcp")));
    assertThrows(IllegalArgumentException.class, () -> AclEntryParser.parseStandard(List.of("permit", "any", "x")));
  }

  @Test
  void resolvesNamedProtocolsAndPorts() {
    assertEquals(89, AclEntryParser.parseProtocol("OSPF"));
    assertEquals(443, AclEntryParser.parsePort("https"));
    assertEquals(8080, AclEntryParser.parsePort("8080"));
    assertThrows(IllegalArgumentException.class, () -> AclEntryParser.parsePort("70000"));
  }
}
