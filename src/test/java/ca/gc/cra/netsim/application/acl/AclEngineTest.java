package ca.gc.cra.netsim.application.acl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.domain.acl.AclAction;
import ca.gc.cra.netsim.domain.acl.AclDirection;
import ca.gc.cra.netsim.domain.acl.AclEntry;
import ca.gc.cra.netsim.domain.acl.AclId;
import ca.gc.cra.netsim.domain.acl.AclRule;
import ca.gc.cra.netsim.domain.acl.AclType;
import ca.gc.cra.netsim.domain.acl.AddressMatch;
import ca.gc.cra.netsim.domain.net.FiveTuple;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.PacketFactory;
import ca.gc.cra.netsim.domain.net.TcpFlags;
import ca.gc.cra.netsim.domain.net.TcpSegment;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AclEngineTest {
  private AclEngine engine;

  @BeforeEach
  void setUp() {
    engine = new AclEngine("R1");
  }

  @Test
  void firstMatchWinsInStandardList() {
    engine.addNumberedEntry(10, AclRule.standard(AclAction.DENY, AddressMatch.host(ip("10.0.1.2"))));
    engine.addNumberedEntry(10, AclRule.standard(AclAction.PERMIT,
        new AddressMatch(ip("10.0.1.0"), ip("0.0.0.255"))));

    assertEquals(AclAction.DENY, engine.evaluate(AclId.of(10), FiveTuple.sourceOnly(ip("10.0.1.2"))));
    assertEquals(AclAction.PERMIT, engine.evaluate(AclId.of(10), FiveTuple.sourceOnly(ip("10.0.1.3"))));
  }

  @Test
  void implicitDenyWhenNothingMatches() {
    engine.addNumberedEntry(10, AclRule.standard(AclAction.PERMIT, AddressMatch.host(ip("10.0.1.2"))));

    assertEquals(AclAction.DENY, engine.evaluate(AclId.of(10), FiveTuple.sourceOnly(ip("192.168.1.1"))));
  }

  @Test
  void unknownListPermits() {
    assertEquals(AclAction.PERMIT, engine.evaluate(AclId.of(99), FiveTuple.sourceOnly(ip("10.0.0.1"))));
    assertEquals(AclAction.PERMIT, engine.evaluate(AclId.named("MISSING"), FiveTuple.sourceOnly(ip("10.0.0.1"))));
  }

  @Test
  void numberedSequencesAdvanceByTenAndCountHits() {
    AclEntry first = engine.addNumberedEntry(1, AclRule.standard(AclAction.DENY, AddressMatch.host(ip("1.1.1.1"))));
    AclEntry second = engine.addNumberedEntry(1, AclRule.standard(AclAction.PERMIT, AddressMatch.ANY));

    assertEquals(10, first.sequence());
    assertEquals(20, second.sequence());
    engine.evaluate(AclId.of(1), FiveTuple.sourceOnly(ip("1.1.1.1")));
    engine.evaluate(AclId.of(1), FiveTuple.sourceOnly(ip("2.2.2.2")));
    engine.evaluate(AclId.of(1), FiveTuple.sourceOnly(ip("3.3.3.3")));
    assertEquals(1, first.hits());
    assertEquals(2, second.hits());

    engine.clearCounters();
    assertEquals(0, second.hits());
  }

  @Test
  void rejectsNumbersOutsideKnownRanges() {
    assertThrows(IllegalArgumentException.class,
        () -> engine.addNumberedEntry(1000, AclRule.standard(AclAction.PERMIT, AddressMatch.ANY)));
  }

  @Test
  void extendedListMatchesProtocolAndPorts() {
    AclRule denyWeb = AclEntryParser.parseExtended(List.of("deny", "tcp", "any", "host", "10.0.0.80", "eq", "www"));
    engine.addNumberedEntry(101, denyWeb);
    engine.addNumberedEntry(101, AclEntryParser.parseExtended(List.of("permit", "ip", "any", "any")));

    Ipv4Packet web = tcp("192.168.1.5", "10.0.0.80", 40_000, 80);
    Ipv4Packet ssh = tcp("192.168.1.5", "10.0.0.80", 40_000, 22);

    assertFalse(engine.permits(AclId.of(101), web));
    assertTrue(engine.permits(AclId.of(101), ssh));
  }

  @Test
  void namedListsAcceptExplicitSequences() {
    engine.addNamedEntry("EDGE", AclType.EXTENDED, AclEntryParser.parseExtended(List.of("permit", "icmp", "any", "any")),
        null);
    engine.addNamedEntry("EDGE", AclType.EXTENDED, AclEntryParser.parseExtended(List.of("deny", "ip", "any", "any")),
        5);

    List<AclEntry> entries = engine.getAcl(AclId.named("EDGE")).orElseThrow().entries();
    assertEquals(5, entries.get(0).sequence());
    assertEquals(10, entries.get(1).sequence());
    Ipv4Packet ping = PacketFactory.echoRequest(ip("1.1.1.1"), ip("2.2.2.2"), 64, 1, 1);
    assertFalse(engine.permits(AclId.named("EDGE"), ping));
  }

  @Test
  void checkPacketUsesBindingPerDirection() {
    engine.addNumberedEntry(1, AclRule.standard(AclAction.DENY, AddressMatch.ANY));
    engine.bindToInterface("GigabitEthernet0/0", AclId.of(1), AclDirection.IN);
    Ipv4Packet packet = tcp("10.0.0.1", "10.0.0.2", 1024, 80);

    assertFalse(engine.checkPacket("GigabitEthernet0/0", AclDirection.IN, packet));
    assertTrue(engine.checkPacket("GigabitEthernet0/0", AclDirection.OUT, packet));
    assertTrue(engine.checkPacket("GigabitEthernet0/1", AclDirection.IN, packet));

    assertTrue(engine.unbindFromInterface("GigabitEthernet0/0", AclDirection.IN));
    assertTrue(engine.checkPacket("GigabitEthernet0/0", AclDirection.IN, packet));
  }

  @Test
  void deletedListLeavesBindingThatPermits() {
    engine.addNumberedEntry(1, AclRule.standard(AclAction.DENY, AddressMatch.ANY));
    engine.bindToInterface("GigabitEthernet0/0", AclId.of(1), AclDirection.IN);

    assertTrue(engine.deleteAcl(AclId.of(1)));
    assertEquals(1, engine.getBindings().size());
    assertTrue(engine.checkPacket("GigabitEthernet0/0", AclDirection.IN, tcp("10.0.0.1", "10.0.0.2", 1, 2)));
  }

  @Test
  void formatsEntriesInIosSyntax() {
    AclEntry entry = engine.addNumberedEntry(110, AclEntryParser.parseExtended(
        List.of("permit", "tcp", "10.1.0.0", "0.0.255.255", "host", "10.0.0.1", "eq", "80", "established")));

    assertEquals("10 permit tcp 10.1.0.0 0.0.255.255 host 10.0.0.1 eq www established",
        engine.formatEntry(entry, AclType.EXTENDED));
  }

  @Test
  void statisticsSummarizeListsAndBindings() {
    engine.addNumberedEntry(1, AclRule.standard(AclAction.PERMIT, AddressMatch.ANY));
    engine.addNamedEntry("X", AclType.STANDARD, AclRule.standard(AclAction.DENY, AddressMatch.ANY), null);
    engine.bindToInterface("GigabitEthernet0/0", AclId.of(1), AclDirection.OUT);

    assertEquals(2, engine.getStatistics().totalAcls());
    assertEquals(1, engine.getStatistics().numberedAcls());
    assertEquals(1, engine.getStatistics().namedAcls());
    assertEquals(2, engine.getStatistics().totalEntries());
    assertEquals(1, engine.getStatistics().interfaceBindings());
  }

  private static Ipv4Packet tcp(String src, String dst, int sport, int dport) {
    return PacketFactory.createIpv4Packet(ip(src), ip(dst), 64, TcpSegment.of(sport, dport, TcpFlags.SYN, 0));
  }

  private static Ipv4Address ip(String text) {
    return Ipv4Address.parse(text);
  }
}
