package ca.gc.cra.netsim.application.device;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.application.sim.SimulationContext;
import ca.gc.cra.netsim.domain.acl.AclAction;
import ca.gc.cra.netsim.domain.acl.AclDirection;
import ca.gc.cra.netsim.domain.acl.AclId;
import ca.gc.cra.netsim.domain.acl.AclRule;
import ca.gc.cra.netsim.domain.acl.AddressMatch;
import ca.gc.cra.netsim.domain.nat.NatBinding;
import ca.gc.cra.netsim.domain.net.IcmpMessage;
import ca.gc.cra.netsim.domain.net.IcmpType;
import ca.gc.cra.netsim.domain.net.IpProtocol;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.PacketFactory;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.routing.RouteSource;
import ca.gc.cra.netsim.testutil.RecordingMetricsPort;
import ca.gc.cra.netsim.testutil.SimFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * hostA - R1 - R2 - hostB with static routes.
 */
class RouterTest {
  private static final String G0 = "GigabitEthernet0/0";
  private static final String G1 = "GigabitEthernet0/1";
  private static final SubnetMask LAN = SubnetMask.ofPrefix(24);

  private SimulationContext context;
  private RecordingMetricsPort metrics;
  private Host hostA;
  private Host hostB;
  private Router r1;
  private Router r2;

  @BeforeEach
  void setUp() {
    SimFixtures.Sim sim = SimFixtures.sim();
    context = sim.context();
    metrics = sim.metrics();
    hostA = context.register(new Host("hostA", context));
    hostB = context.register(new Host("hostB", context));
    r1 = context.register(new Router("R1", context));
    r2 = context.register(new Router("R2", context));
    context.connect("hostA", Host.NIC, "R1", G0);
    context.connect("R1", G1, "R2", G0);
    context.connect("R2", G1, "hostB", Host.NIC);

    hostA.configure(ip("192.168.1.10"), LAN, ip("192.168.1.1"));
    hostB.configure(ip("192.168.2.10"), LAN, ip("192.168.2.1"));
    r1.configureInterface(G0, "192.168.1.1", "255.255.255.0");
    r1.configureInterface(G1, "10.0.12.1", "255.255.255.252");
    r2.configureInterface(G0, "10.0.12.2", "255.255.255.252");
    r2.configureInterface(G1, "192.168.2.1", "255.255.255.0");
  }

  private void addStaticRoutes() {
    r1.addStaticRoute(ip("192.168.2.0"), LAN, ip("10.0.12.2"));
    r2.addStaticRoute(ip("192.168.1.0"), LAN, ip("10.0.12.1"));
  }

  @Test
  void configuringInterfacesInstallsConnectedRoutes() {
    assertEquals(2, r1.getRoutingTable().routes(RouteSource.CONNECTED).size());
    assertEquals(G1, r1.getRoutingTable().lookup(ip("10.0.12.2")).orElseThrow().interfaceName());
  }

  @Test
  void pingAcrossTwoRoutersDecrementsTtlTwice() {
    addStaticRoutes();

    hostA.ping(ip("192.168.2.10"));

    List<Ipv4Packet> requests = hostB.received(IcmpType.ECHO_REQUEST);
    assertEquals(1, requests.size());
    assertEquals(62, requests.get(0).ttl());
    List<Ipv4Packet> replies = hostA.received(IcmpType.ECHO_REPLY);
    assertEquals(1, replies.size());
    assertEquals(ip("192.168.2.10"), replies.get(0).source());
    assertEquals(62, replies.get(0).ttl());
    assertEquals(4, metrics.count("netsim.router.forwarded"));
  }

  @Test
  void arpLearnsNextHopsOnTheWay() {
    addStaticRoutes();

    hostA.ping(ip("192.168.2.10"));

    assertTrue(hostA.arpCache().lookup(ip("192.168.1.1")).isPresent());
    assertTrue(r1.arpCache().lookup(ip("10.0.12.2")).isPresent());
    assertTrue(r2.arpCache().lookup(ip("192.168.2.10")).isPresent());
    assertEquals(0, r1.arpCache().pendingCount());
  }

  @Test
  void ttlOneIsAnsweredWithTimeExceededFromIngressAddress() {
    addStaticRoutes();

    hostA.ping(ip("192.168.2.10"), 1);

    assertTrue(hostB.inbox().isEmpty());
    List<Ipv4Packet> errors = hostA.received(IcmpType.TIME_EXCEEDED);
    assertEquals(1, errors.size());
    assertEquals(ip("192.168.1.1"), errors.get(0).source());
    assertEquals(1, metrics.count("netsim.router.drop.ttl"));
    assertEquals(1, metrics.count("netsim.router.icmp.timeExceeded"));
  }

  @Test
  void ttlExpiringAtSecondHopIsReportedBySecondRouter() {
    addStaticRoutes();

    hostA.ping(ip("192.168.2.10"), 2);

    List<Ipv4Packet> errors = hostA.received(IcmpType.TIME_EXCEEDED);
    assertEquals(1, errors.size());
    assertEquals(ip("10.0.12.2"), errors.get(0).source());
    assertEquals(IpProtocol.ICMP, errors.get(0).protocol());
    assertTrue(hostB.inbox().isEmpty());
  }

  @Test
  void missingRouteIsAnsweredWithDestinationUnreachable() {
    hostA.ping(ip("8.8.8.8"));

    List<Ipv4Packet> errors = hostA.received(IcmpType.DESTINATION_UNREACHABLE);
    assertEquals(1, errors.size());
    assertEquals(ip("192.168.1.1"), errors.get(0).source());
    assertEquals(1, metrics.count("netsim.router.drop.noRoute"));
  }

  @Test
  void errorsAreNotReportedAboutErrors() {
    addStaticRoutes();
    Ipv4Packet offending = hostA.ping(ip("192.168.2.10"), 1);
    hostA.clearInbox();
    metrics.clear();

    Ipv4Packet errorWithTtlOne = PacketFactory.createIpv4Packet(ip("192.168.1.10"), ip("192.168.2.10"), 1,
        IcmpMessage.error(IcmpType.DESTINATION_UNREACHABLE, 1, offending));
    hostA.send(errorWithTtlOne);

    assertEquals(1, metrics.count("netsim.router.drop.ttl"));
    assertFalse(metrics.hasCounter("netsim.router.icmp.timeExceeded"));
    assertTrue(hostA.inbox().isEmpty());
  }

  @Test
  void inboundAclDropsDeniedTraffic() {
    addStaticRoutes();
    r1.acl().addNumberedEntry(101, AclRule.extended(AclAction.DENY, IpProtocol.ICMP, AddressMatch.ANY,
        AddressMatch.host(ip("192.168.2.10"))));
    r1.acl().addNumberedEntry(101, AclRule.extended(AclAction.PERMIT, 0, AddressMatch.ANY, AddressMatch.ANY));
    r1.acl().bindToInterface(G0, AclId.of(101), AclDirection.IN);

    hostA.ping(ip("192.168.2.10"));

    assertTrue(hostB.inbox().isEmpty());
    assertTrue(hostA.received(IcmpType.ECHO_REPLY).isEmpty());
    assertEquals(1, metrics.count("netsim.router.drop.acl"));
  }

  @Test
  void outboundAclIsCheckedOnEgress() {
    addStaticRoutes();
    r2.acl().addNumberedEntry(10, AclRule.standard(AclAction.DENY, AddressMatch.host(ip("192.168.1.10"))));
    r2.acl().bindToInterface(G1, AclId.of(10), AclDirection.OUT);

    hostA.ping(ip("192.168.2.10"));

    assertTrue(hostB.inbox().isEmpty());
    assertEquals(1, metrics.count("netsim.router.drop.acl"));
  }

  @Test
  void routerAnswersPingsToItsOwnAddresses() {
    addStaticRoutes();

    hostA.ping(ip("10.0.12.2"));

    List<Ipv4Packet> replies = hostA.received(IcmpType.ECHO_REPLY);
    assertEquals(1, replies.size());
    assertEquals(ip("10.0.12.2"), replies.get(0).source());
  }

  @Test
  void overloadNatHidesInsideHostsBehindOutsideAddress() {
    r1.acl().addNumberedEntry(1, AclRule.standard(AclAction.PERMIT,
        new AddressMatch(ip("192.168.1.0"), ip("0.0.0.255"))));
    r1.nat().setInsideInterface(G0);
    r1.nat().setOutsideInterface(G1);
    r1.nat().bindAccessList(NatBinding.interfaceOverload(AclId.of(1), G1));
    r1.addStaticRoute(ip("192.168.2.0"), LAN, ip("10.0.12.2"));

    Ipv4Packet request = hostA.ping(ip("192.168.2.10"));

    Ipv4Packet seenByB = hostB.received(IcmpType.ECHO_REQUEST).get(0);
    assertEquals(ip("10.0.12.1"), seenByB.source());
    List<Ipv4Packet> replies = hostA.received(IcmpType.ECHO_REPLY);
    assertEquals(1, replies.size());
    assertEquals(ip("192.168.2.10"), replies.get(0).source());
    assertEquals(((IcmpMessage) request.payload()).identifier(),
        ((IcmpMessage) replies.get(0).payload()).identifier());
    assertEquals(1, r1.nat().getStatistics().patTranslations());
  }

  @Test
  void shutdownRemovesConnectedRouteAndEnableRestoresIt() {
    r1.shutdownInterface(G1);
    assertTrue(r1.getRoutingTable().lookup(ip("10.0.12.2")).isEmpty());

    r1.enableInterface(G1);
    assertEquals(G1, r1.getRoutingTable().lookup(ip("10.0.12.2")).orElseThrow().interfaceName());
  }

  @Test
  void staticRouteNeedsOnLinkNextHop() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> r1.addStaticRoute(ip("172.16.0.0"), SubnetMask.ofPrefix(16), ip("10.99.0.1")));
    assertTrue(ex.getMessage().contains("not on a connected subnet"));
  }

  @Test
  void rejectsMulticastInterfaceAddress() {
    assertThrows(IllegalArgumentException.class,
        () -> r1.configureInterface(G0, ip("224.0.0.5"), LAN));
  }

  private static Ipv4Address ip(String text) {
    return Ipv4Address.parse(text);
  }
}
