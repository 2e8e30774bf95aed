package ca.gc.cra.netsim.application.nat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.application.acl.AclEngine;
import ca.gc.cra.netsim.domain.acl.AclAction;
import ca.gc.cra.netsim.domain.acl.AclId;
import ca.gc.cra.netsim.domain.acl.AclRule;
import ca.gc.cra.netsim.domain.acl.AddressMatch;
import ca.gc.cra.netsim.domain.nat.NatBinding;
import ca.gc.cra.netsim.domain.nat.NatPool;
import ca.gc.cra.netsim.domain.nat.NatResult;
import ca.gc.cra.netsim.domain.nat.NatStatistics;
import ca.gc.cra.netsim.domain.nat.NatStatus;
import ca.gc.cra.netsim.domain.nat.NatTranslation;
import ca.gc.cra.netsim.domain.nat.NatType;
import ca.gc.cra.netsim.domain.net.IpProtocol;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.PacketFactory;
import ca.gc.cra.netsim.domain.net.RawPayload;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.net.TcpFlags;
import ca.gc.cra.netsim.domain.net.TcpSegment;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NatEngineTest {
  private static final String INSIDE = "GigabitEthernet0/0";
  private static final String OUTSIDE = "GigabitEthernet0/1";
  private static final Ipv4Address OUTSIDE_ADDRESS = ip("203.0.113.1");
  private static final Ipv4Address SERVER = ip("198.51.100.80");

  private AclEngine acl;
  private NatEngine nat;
  private long now;

  @BeforeEach
  void setUp() {
    now = 0;
    acl = new AclEngine("R1");
    acl.addNumberedEntry(1, AclRule.standard(AclAction.PERMIT,
        new AddressMatch(ip("10.0.0.0"), ip("0.0.0.255"))));
    nat = new NatEngine("R1", acl, () -> now,
        name -> OUTSIDE.equals(name) ? Optional.of(OUTSIDE_ADDRESS) : Optional.empty(), 60);
    nat.setInsideInterface(INSIDE);
    nat.setOutsideInterface(OUTSIDE);
  }

  @Test
  void staticTranslationRewritesBothDirections() {
    nat.addStaticNat(ip("10.0.0.5"), ip("203.0.113.5"));

    NatResult out = nat.translateOutgoing(tcp("10.0.0.5", SERVER.toString(), 40000, 80), INSIDE, OUTSIDE_ADDRESS);
    assertEquals(NatStatus.TRANSLATED, out.status());
    assertEquals(ip("203.0.113.5"), out.packet().source());
    assertTrue(PacketFactory.verifyChecksum(out.packet()));

    NatResult in = nat.translateIncoming(tcp(SERVER.toString(), "203.0.113.5", 80, 40000), OUTSIDE);
    assertTrue(in.isTranslated());
    assertEquals(ip("10.0.0.5"), in.packet().destination());
    assertEquals(NatType.STATIC, in.usedTranslation().orElseThrow().type());
  }

  @Test
  void staticGlobalAddressCannotBeSharedBetweenInsideHosts() {
    nat.addStaticNat(ip("10.0.0.5"), ip("203.0.113.5"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> nat.addStaticNat(ip("10.0.0.6"), ip("203.0.113.5")));
    assertTrue(ex.getMessage().contains("already mapped to 10.0.0.5"));
  }

  @Test
  void packetsFromNonInsideInterfacesAreNotTranslated() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));

    NatResult result = nat.translateOutgoing(tcp("10.0.0.5", SERVER.toString(), 40000, 80), OUTSIDE, OUTSIDE_ADDRESS);

    assertEquals(NatStatus.NOT_MATCHED, result.status());
    assertTrue(nat.getTranslations().isEmpty());
  }

  @Test
  void overloadGivesDistinctHostsDistinctPortsOnOneAddress() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    Set<Integer> ports = new HashSet<>();

    for (int host = 1; host <= 20; host++) {
      NatResult result = nat.translateOutgoing(tcp("10.0.0." + host, SERVER.toString(), 40000, 80), INSIDE, null);
      assertEquals(NatStatus.TRANSLATED, result.status());
      assertEquals(OUTSIDE_ADDRESS, result.packet().source());
      ports.add(((TcpSegment) result.packet().payload()).sourcePort());
    }

    assertEquals(20, ports.size());
    assertTrue(ports.stream().allMatch(p -> p >= NatEngine.PAT_FIRST_PORT));
    assertEquals(20, nat.getStatistics().patTranslations());
  }

  @Test
  void overloadReplyIsMappedBackToInsideHostAndPort() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    Ipv4Packet first = nat.translateOutgoing(tcp("10.0.0.7", SERVER.toString(), 51000, 443), INSIDE, null).packet();
    int translatedPort = ((TcpSegment) first.payload()).sourcePort();

    NatResult reply = nat.translateIncoming(tcp(SERVER.toString(), OUTSIDE_ADDRESS.toString(), 443, translatedPort),
        OUTSIDE);

    assertTrue(reply.isTranslated());
    assertEquals(ip("10.0.0.7"), reply.packet().destination());
    assertEquals(51000, ((TcpSegment) reply.packet().payload()).destinationPort());
    assertTrue(PacketFactory.verifyChecksum(reply.packet()));
  }

  @Test
  void portRewriteKeepsDeclaredTotalLength() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    Ipv4Packet large = PacketFactory.createIpv4Packet(ip("10.0.0.5"), SERVER, IpProtocol.TCP, 64,
        TcpSegment.of(40000, 80, TcpFlags.SYN, 0), 1000);

    Ipv4Packet out = nat.translateOutgoing(large, INSIDE, null).packet();
    int translatedPort = ((TcpSegment) out.payload()).sourcePort();
    Ipv4Packet reply = nat.translateIncoming(PacketFactory.createIpv4Packet(SERVER, OUTSIDE_ADDRESS, IpProtocol.TCP,
        64, TcpSegment.of(80, translatedPort, TcpFlags.ACK, 0), 1000), OUTSIDE).packet();

    assertEquals(1020, out.totalLength());
    assertNotEquals(40000, translatedPort);
    assertTrue(PacketFactory.verifyChecksum(out));
    assertEquals(1020, reply.totalLength());
    assertEquals(40000, ((TcpSegment) reply.payload()).destinationPort());
    assertTrue(PacketFactory.verifyChecksum(reply));
  }

  @Test
  void portlessProtocolIsOverloadedForOneInsideHostOnly() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));

    NatResult first = nat.translateOutgoing(gre("10.0.0.5", SERVER.toString()), INSIDE, null);
    NatResult again = nat.translateOutgoing(gre("10.0.0.5", SERVER.toString()), INSIDE, null);
    NatResult second = nat.translateOutgoing(gre("10.0.0.6", SERVER.toString()), INSIDE, null);

    assertEquals(NatStatus.TRANSLATED, first.status());
    assertEquals(OUTSIDE_ADDRESS, first.packet().source());
    assertEquals(NatStatus.TRANSLATED, again.status());
    assertEquals(NatStatus.EXHAUSTED, second.status());
    assertEquals(ip("10.0.0.6"), second.packet().source());
    assertEquals(1, nat.getStatistics().patTranslations());
    assertEquals(1, nat.getStatistics().exhausted());

    NatResult reply = nat.translateIncoming(gre(SERVER.toString(), OUTSIDE_ADDRESS.toString()), OUTSIDE);
    assertEquals(ip("10.0.0.5"), reply.packet().destination());
  }

  @Test
  void portlessOverloadPassesToNextHostOnceIdle() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    nat.translateOutgoing(gre("10.0.0.5", SERVER.toString()), INSIDE, null);

    now = 61_000;
    NatResult second = nat.translateOutgoing(gre("10.0.0.6", SERVER.toString()), INSIDE, null);

    assertEquals(NatStatus.TRANSLATED, second.status());
    NatResult reply = nat.translateIncoming(gre(SERVER.toString(), OUTSIDE_ADDRESS.toString()), OUTSIDE);
    assertEquals(ip("10.0.0.6"), reply.packet().destination());
  }

  @Test
  void fullPortRangeReclaimsExpiredTranslationsBeforeGivingUp() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    int span = NatEngine.PAT_LAST_PORT - NatEngine.PAT_FIRST_PORT + 1;
    for (int port = 1; port <= span; port++) {
      assertTrue(nat.translateOutgoing(tcp("10.0.0.5", SERVER.toString(), port, 80), INSIDE, null).isTranslated());
    }

    NatResult full = nat.translateOutgoing(tcp("10.0.0.6", SERVER.toString(), 40000, 80), INSIDE, null);
    assertEquals(NatStatus.EXHAUSTED, full.status());

    now = 61_000;
    NatResult reclaimed = nat.translateOutgoing(tcp("10.0.0.6", SERVER.toString(), 40000, 80), INSIDE, null);
    assertEquals(NatStatus.TRANSLATED, reclaimed.status());
    assertEquals(1, nat.getStatistics().patTranslations());
    assertEquals(span, nat.getStatistics().expired());
  }

  @Test
  void sameFlowReusesItsTranslation() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    nat.translateOutgoing(tcp("10.0.0.7", SERVER.toString(), 51000, 443), INSIDE, null);
    nat.translateOutgoing(tcp("10.0.0.7", SERVER.toString(), 51000, 443), INSIDE, null);

    String key = NatTranslation.key(NatType.PAT, ip("10.0.0.7"), 51000, 6);
    assertEquals(1, nat.getTranslations().size());
    assertEquals(2, nat.getTranslation(key).orElseThrow().hits());
  }

  @Test
  void dynamicPoolExhaustsWhenEveryAddressIsTaken() {
    nat.addPool(new NatPool("PUBLIC", ip("203.0.113.10"), ip("203.0.113.11"), SubnetMask.ofPrefix(24),
        NatPool.Type.POOL));
    nat.bindAccessList(NatBinding.pool(AclId.of(1), "PUBLIC", false));

    Ipv4Address first = nat.translateOutgoing(tcp("10.0.0.1", SERVER.toString(), 1000, 80), INSIDE, null)
        .packet().source();
    Ipv4Address second = nat.translateOutgoing(tcp("10.0.0.2", SERVER.toString(), 1000, 80), INSIDE, null)
        .packet().source();
    NatResult third = nat.translateOutgoing(tcp("10.0.0.3", SERVER.toString(), 1000, 80), INSIDE, null);

    assertNotEquals(first, second);
    assertEquals(NatStatus.EXHAUSTED, third.status());
    assertEquals(ip("10.0.0.3"), third.packet().source());
    assertEquals(1, nat.getStatistics().exhausted());
  }

  @Test
  void expiredTranslationsAreRemovedAndNotResurrected() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    Ipv4Packet out = nat.translateOutgoing(tcp("10.0.0.7", SERVER.toString(), 51000, 443), INSIDE, null).packet();
    int translatedPort = ((TcpSegment) out.payload()).sourcePort();

    now = 61_000;
    assertEquals(1, nat.cleanupExpired(now));
    assertTrue(nat.getTranslations().isEmpty());

    NatResult lateReply = nat.translateIncoming(
        tcp(SERVER.toString(), OUTSIDE_ADDRESS.toString(), 443, translatedPort), OUTSIDE);
    assertEquals(NatStatus.NOT_MATCHED, lateReply.status());
    assertTrue(nat.getTranslations().isEmpty());
    assertEquals(1, nat.getStatistics().expired());
  }

  @Test
  void idleTimeoutIsMeasuredFromLastUse() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    nat.translateOutgoing(tcp("10.0.0.7", SERVER.toString(), 51000, 443), INSIDE, null);
    now = 50_000;
    nat.translateOutgoing(tcp("10.0.0.7", SERVER.toString(), 51000, 443), INSIDE, null);

    now = 100_000;
    assertEquals(0, nat.cleanupExpired(now));
    now = 110_001;
    assertEquals(1, nat.cleanupExpired(now));
  }

  @Test
  void bindingWithMissingListMatchesNothing() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(50), OUTSIDE));

    NatResult result = nat.translateOutgoing(tcp("10.0.0.7", SERVER.toString(), 51000, 443), INSIDE, null);

    assertEquals(NatStatus.NOT_MATCHED, result.status());
    assertEquals(1, nat.getStatistics().misses());
  }

  @Test
  void deniedSourcesPassUntranslated() {
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));

    NatResult result = nat.translateOutgoing(tcp("172.16.0.9", SERVER.toString(), 51000, 443), INSIDE, null);

    assertFalse(result.isTranslated());
    assertEquals(ip("172.16.0.9"), result.packet().source());
  }

  @Test
  void clearDynamicKeepsStaticEntries() {
    nat.addStaticNat(ip("10.0.0.5"), ip("203.0.113.5"));
    nat.bindAccessList(NatBinding.interfaceOverload(AclId.of(1), OUTSIDE));
    nat.translateOutgoing(tcp("10.0.0.7", SERVER.toString(), 51000, 443), INSIDE, null);

    nat.clearDynamic();

    NatStatistics stats = nat.getStatistics();
    assertEquals(1, stats.totalTranslations());
    assertEquals(1, stats.staticTranslations());
    assertEquals(0, stats.patTranslations());
  }

  private static Ipv4Packet tcp(String src, String dst, int sport, int dport) {
    return PacketFactory.createIpv4Packet(ip(src), ip(dst), 64, TcpSegment.of(sport, dport, TcpFlags.SYN, 0));
  }

  private static Ipv4Packet gre(String src, String dst) {
    return PacketFactory.createIpv4Packet(ip(src), ip(dst), 47, 64, RawPayload.ofSize(24), 24);
  }

  private static Ipv4Address ip(String text) {
    return Ipv4Address.parse(text);
  }
}
