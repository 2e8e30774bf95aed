package ca.gc.cra.netsim.application.ospf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.ospf.InterfaceState;
import ca.gc.cra.netsim.domain.ospf.LsaKey;
import ca.gc.cra.netsim.domain.ospf.NeighborState;
import ca.gc.cra.netsim.domain.ospf.OspfConstants;
import ca.gc.cra.netsim.domain.ospf.OspfDatabaseDescription;
import ca.gc.cra.netsim.domain.ospf.OspfHello;
import ca.gc.cra.netsim.domain.ospf.OspfLinkStateRequest;
import ca.gc.cra.netsim.domain.ospf.OspfPacket;
import ca.gc.cra.netsim.infrastructure.time.VirtualClock;
import ca.gc.cra.netsim.testutil.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OspfEngineTest {
  private static final OspfSettings FAST = new OspfSettings(1, 4, 2, 100, "netsim");
  private static final Ipv4Address AREA = OspfConstants.BACKBONE_AREA;
  private static final Ipv4Address RID1 = Ipv4Address.parse("1.1.1.1");
  private static final Ipv4Address RID2 = Ipv4Address.parse("2.2.2.2");

  private VirtualClock clock;
  private RecordingMetricsPort metrics;
  private Segment segment;

  @BeforeEach
  void setUp() {
    clock = new VirtualClock();
    metrics = new RecordingMetricsPort();
    segment = new Segment();
  }

  private OspfEngine join(String rid, String address, int prefix, InterfaceOptions options) {
    OspfEngine engine = new OspfEngine("R" + rid.charAt(0), Ipv4Address.parse(rid), FAST, clock, clock, metrics,
        segment::deliver);
    segment.members.add(new Member(engine, "eth0", Ipv4Address.parse(address)));
    engine.activateInterface("eth0", Ipv4Address.parse(address), SubnetMask.ofPrefix(prefix), AREA, options);
    return engine;
  }

  @Test
  void pointToPointPairReachesFull() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    OspfEngine r2 = join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());

    clock.advanceBy(10_000);

    OspfNeighbor seenByR1 = r1.getNeighbor("eth0", RID2).orElseThrow();
    OspfNeighbor seenByR2 = r2.getNeighbor("eth0", RID1).orElseThrow();
    assertEquals(NeighborState.FULL, seenByR1.state());
    assertEquals(NeighborState.FULL, seenByR2.state());
    assertFalse(seenByR1.isMaster());
    assertTrue(seenByR2.isMaster());
    assertEquals(Ipv4Address.parse("10.0.12.2"), seenByR1.address());
    assertEquals(InterfaceState.POINT_TO_POINT, r1.getInterface("eth0").orElseThrow().state());
    assertEquals(2, r1.getLinkStateDatabase().lsas(AREA).size());
  }

  @Test
  void neighborTransitionsFollowTheAdjacencyOrder() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());

    clock.advanceBy(10_000);

    List<String> lines = r1.getEventLog().stream().filter(l -> l.startsWith("Neighbor 2.2.2.2 (eth0)")).toList();
    assertEquals("Neighbor 2.2.2.2 (eth0): Down -> Init (HelloReceived)", lines.get(0));
    int init = indexOf(lines, "Init -> ExStart");
    int exchange = indexOf(lines, "ExStart -> Exchange (NegotiationDone)");
    int full = indexOf(lines, "-> Full");
    assertTrue(init > 0, lines.toString());
    assertTrue(exchange > init, lines.toString());
    assertTrue(full > exchange, lines.toString());
  }

  @Test
  void exchangeWithMissingLsasPassesThroughLoading() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    OspfEngine r2 = join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());

    clock.advanceBy(10_000);

    List<String> log = new ArrayList<>(r1.getEventLog());
    log.addAll(r2.getEventLog());
    int loading = indexOf(log, "Exchange -> Loading (ExchangeDone)");
    assertTrue(loading >= 0, log.toString());
    assertTrue(indexOf(log.subList(loading, log.size()), "Loading -> Full (LoadingDone)") >= 0, log.toString());
  }

  @Test
  void unexpectedDatabaseDescriptionInFullRestartsExchange() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    clock.advanceBy(10_000);
    assertEquals(NeighborState.FULL, r1.getNeighbor("eth0", RID2).orElseThrow().state());

    int flags = OspfConstants.DD_FLAG_INIT | OspfConstants.DD_FLAG_MORE | OspfConstants.DD_FLAG_MASTER;
    r1.processDatabaseDescription("eth0", Ipv4Address.parse("10.0.12.2"),
        new OspfDatabaseDescription(RID2, AREA, OspfConstants.DEFAULT_MTU, OspfConstants.OPTIONS_E, flags, 777,
            List.of()));

    assertTrue(r1.getEventLog().contains("Neighbor 2.2.2.2 (eth0): Full -> ExStart (SeqNumberMismatch)"),
        r1.getEventLog().toString());
    clock.advanceBy(10_000);
    assertEquals(NeighborState.FULL, r1.getNeighbor("eth0", RID2).orElseThrow().state());
  }

  @Test
  void requestForUnknownLsaInFullRestartsExchange() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    clock.advanceBy(10_000);

    Ipv4Address ghost = Ipv4Address.parse("9.9.9.9");
    r1.processLinkStateRequest("eth0", Ipv4Address.parse("10.0.12.2"),
        new OspfLinkStateRequest(RID2, AREA, List.of(new LsaKey(1, ghost, ghost))));

    assertTrue(r1.getEventLog().contains("Neighbor 2.2.2.2 (eth0): Full -> ExStart (BadLSReq)"),
        r1.getEventLog().toString());
    clock.advanceBy(10_000);
    assertEquals(NeighborState.FULL, r1.getNeighbor("eth0", RID2).orElseThrow().state());
  }

  @Test
  void helloWithoutOurRouterIdDropsNeighborToInit() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    clock.advanceBy(10_000);

    r1.processHello("eth0", Ipv4Address.parse("10.0.12.2"), hello(RID2, List.of()));

    OspfNeighbor neighbor = r1.getNeighbor("eth0", RID2).orElseThrow();
    assertEquals(NeighborState.INIT, neighbor.state());
    assertTrue(neighbor.requestList().isEmpty());
    assertTrue(neighbor.retransmissionList().isEmpty());
    assertTrue(r1.getEventLog().contains("Neighbor 2.2.2.2 (eth0): Full -> Init (OneWay)"),
        r1.getEventLog().toString());
    clock.advanceBy(10_000);
    assertEquals(NeighborState.FULL, r1.getNeighbor("eth0", RID2).orElseThrow().state());
  }

  @Test
  void retransmissionStopsOnceNeighborIsFull() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    segment.drop = packet -> packet instanceof OspfLinkStateRequest;
    clock.advanceBy(9_000);
    OspfNeighbor loading = r1.getNeighbor("eth0", RID2).orElseThrow();
    assertEquals(NeighborState.LOADING, loading.state());
    assertTrue(loading.lsrRetransmissions() > 0);

    segment.drop = packet -> false;
    clock.advanceBy(10_000);
    OspfNeighbor full = r1.getNeighbor("eth0", RID2).orElseThrow();
    assertEquals(NeighborState.FULL, full.state());
    assertTrue(full.retransmissionList().isEmpty());
    int lsr = metrics.count("netsim.ospf.retransmit.lsr");
    int lsu = metrics.count("netsim.ospf.retransmit.lsu");
    int dd = metrics.count("netsim.ospf.retransmit.dd");

    clock.advanceBy(30_000);

    assertEquals(lsr, metrics.count("netsim.ospf.retransmit.lsr"));
    assertEquals(lsu, metrics.count("netsim.ospf.retransmit.lsu"));
    assertEquals(dd, metrics.count("netsim.ospf.retransmit.dd"));
    assertEquals(NeighborState.FULL, full.state());
  }

  @Test
  void eventLogKeepsOnlyMostRecentTransitions() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    int total = OspfEngine.EVENT_LOG_CAPACITY + 10;

    for (int i = 0; i < total; i++) {
      Ipv4Address rid = Ipv4Address.parse("10.1." + (i / 250) + "." + (i % 250 + 1));
      r1.processHello("eth0", Ipv4Address.parse("10.0.12.2"), hello(rid, List.of()));
    }

    List<String> log = r1.getEventLog();
    assertEquals(OspfEngine.EVENT_LOG_CAPACITY, log.size());
    assertEquals("Neighbor 10.1.4.34 (eth0): Down -> Init (HelloReceived)", log.get(log.size() - 1));
    assertFalse(log.stream().anyMatch(line -> line.startsWith("Neighbor 10.1.0.1 ")));
  }

  @Test
  void spfInstallsRemoteSubnetsThroughListener() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    OspfEngine r2 = new OspfEngine("R2", RID2, FAST, clock, clock, metrics, segment::deliver);
    segment.members.add(new Member(r2, "eth0", Ipv4Address.parse("10.0.12.2")));
    r2.activateInterface("eth0", Ipv4Address.parse("10.0.12.2"), SubnetMask.ofPrefix(30), AREA,
        InterfaceOptions.pointToPoint());
    r2.activateInterface("lan0", Ipv4Address.parse("192.168.2.1"), SubnetMask.ofPrefix(24), AREA,
        InterfaceOptions.defaults().withPassive(true));
    List<List<OspfRoute>> published = new ArrayList<>();
    r1.setRouteListener(published::add);

    clock.advanceBy(10_000);

    OspfRoute lan = r1.getRoutes().stream()
        .filter(r -> r.network().equals(Ipv4Address.parse("192.168.2.0")))
        .findFirst()
        .orElseThrow();
    assertEquals(Ipv4Address.parse("10.0.12.2"), lan.nextHop());
    assertEquals("eth0", lan.interfaceName());
    assertFalse(published.isEmpty());
    assertTrue(metrics.count("netsim.ospf.spf.runs") > 0);
  }

  @Test
  void silentNeighborIsRemovedByDeadTimerAndStaysGone() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    clock.advanceBy(10_000);
    assertEquals(1, r1.fullNeighborCount());

    segment.drop = packet -> true;
    clock.advanceBy(5_000);

    assertTrue(r1.getNeighbor("eth0", RID2).isEmpty());
    assertTrue(r1.getEventLog().stream().anyMatch(l -> l.endsWith("-> Down (InactivityTimer)")));
    clock.advanceBy(30_000);
    assertTrue(r1.getNeighbor("eth0", RID2).isEmpty());
    assertEquals(0, r1.neighborCount());
  }

  @Test
  void lostDatabaseDescriptionsAreRetransmitted() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    segment.drop = packet -> packet instanceof OspfDatabaseDescription;

    clock.advanceBy(9_000);

    OspfNeighbor neighbor = r1.getNeighbor("eth0", RID2).orElseThrow();
    assertEquals(NeighborState.EXSTART, neighbor.state());
    assertTrue(neighbor.ddRetransmissions() > 0);
    assertTrue(metrics.count("netsim.ospf.retransmit.dd") > 0);

    segment.drop = packet -> false;
    clock.advanceBy(10_000);
    assertEquals(NeighborState.FULL, r1.getNeighbor("eth0", RID2).orElseThrow().state());
  }

  @Test
  void broadcastSegmentElectsDesignatedRouters() {
    OspfEngine r1 = join("1.1.1.1", "10.0.0.1", 24, InterfaceOptions.defaults());
    OspfEngine r2 = join("2.2.2.2", "10.0.0.2", 24, InterfaceOptions.defaults());
    OspfEngine r3 = join("3.3.3.3", "10.0.0.3", 24, InterfaceOptions.defaults().withPriority(0));

    clock.advanceBy(20_000);

    for (OspfEngine engine : List.of(r1, r2, r3)) {
      OspfInterface iface = engine.getInterface("eth0").orElseThrow();
      assertEquals(Ipv4Address.parse("10.0.0.2"), iface.designatedRouter(), engine.routerId().toString());
      assertEquals(Ipv4Address.parse("10.0.0.1"), iface.backupDesignatedRouter(), engine.routerId().toString());
    }
    assertEquals(InterfaceState.DR, r2.getInterface("eth0").orElseThrow().state());
    assertEquals(InterfaceState.BACKUP, r1.getInterface("eth0").orElseThrow().state());
    assertEquals(InterfaceState.DR_OTHER, r3.getInterface("eth0").orElseThrow().state());
    assertEquals(2, r3.fullNeighborCount());
  }

  @Test
  void latecomerDoesNotPreemptDesignatedRouter() {
    join("1.1.1.1", "10.0.0.1", 24, InterfaceOptions.defaults());
    OspfEngine r2 = join("2.2.2.2", "10.0.0.2", 24, InterfaceOptions.defaults());
    OspfEngine r3 = join("3.3.3.3", "10.0.0.3", 24, InterfaceOptions.defaults().withPriority(0));
    clock.advanceBy(20_000);

    OspfEngine r9 = join("9.9.9.9", "10.0.0.9", 24, InterfaceOptions.defaults().withPriority(100));
    clock.advanceBy(20_000);

    OspfInterface late = r9.getInterface("eth0").orElseThrow();
    assertEquals(Ipv4Address.parse("10.0.0.2"), late.designatedRouter());
    assertEquals(InterfaceState.DR_OTHER, late.state());
    assertEquals(InterfaceState.DR, r2.getInterface("eth0").orElseThrow().state());
    assertEquals(NeighborState.TWO_WAY,
        r9.getNeighbor("eth0", Ipv4Address.parse("3.3.3.3")).orElseThrow().state());
    assertEquals(NeighborState.FULL, r9.getNeighbor("eth0", RID2).orElseThrow().state());
    assertEquals(NeighborState.TWO_WAY,
        r3.getNeighbor("eth0", Ipv4Address.parse("9.9.9.9")).orElseThrow().state());
  }

  @Test
  void passiveInterfaceSendsNothing() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint().withPassive(true));
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());

    clock.advanceBy(10_000);

    assertEquals(0, r1.neighborCount());
    assertEquals(0, segment.sentBy(RID1));
  }

  @Test
  void mismatchedHelloIntervalIsRejected() {
    join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    OspfEngine r2 = join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint().withTimers(2, 8));

    clock.advanceBy(10_000);

    assertEquals(0, r2.neighborCount());
    assertTrue(metrics.count("netsim.ospf.hello.rejected") > 0);
  }

  @Test
  void deactivatingInterfaceDropsItsNeighbors() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    clock.advanceBy(10_000);

    assertTrue(r1.deactivateInterface("eth0"));

    assertEquals(0, r1.neighborCount());
    assertTrue(r1.getInterface("eth0").isEmpty());
    assertFalse(r1.deactivateInterface("eth0"));
  }

  @Test
  void killNeighborResetsAdjacencyWhichThenReforms() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    clock.advanceBy(10_000);

    assertTrue(r1.killNeighbor("eth0", RID2));
    assertTrue(r1.getNeighbor("eth0", RID2).isEmpty());

    clock.advanceBy(10_000);
    assertEquals(NeighborState.FULL, r1.getNeighbor("eth0", RID2).orElseThrow().state());
  }

  @Test
  void rejectsUnspecifiedRouterIdAndBadTimers() {
    assertThrows(IllegalArgumentException.class,
        () -> new OspfEngine("R0", Ipv4Address.ANY, FAST, clock, clock, metrics, segment::deliver));
    OspfEngine r1 = new OspfEngine("R1", RID1, FAST, clock, clock, metrics, segment::deliver);
    assertThrows(IllegalArgumentException.class, () -> r1.activateInterface("eth0",
        Ipv4Address.parse("10.0.0.1"), SubnetMask.ofPrefix(24), AREA, InterfaceOptions.defaults().withTimers(10, 10)));
  }

  @Test
  void shutdownStopsTimers() {
    OspfEngine r1 = join("1.1.1.1", "10.0.12.1", 30, InterfaceOptions.pointToPoint());
    OspfEngine r2 = join("2.2.2.2", "10.0.12.2", 30, InterfaceOptions.pointToPoint());
    clock.advanceBy(10_000);

    r1.shutdown();
    r2.shutdown();
    int sent = segment.sentBy(RID1);
    clock.advanceBy(30_000);

    assertEquals(sent, segment.sentBy(RID1));
    assertEquals(0, r1.neighborCount());
  }

  private static OspfHello hello(Ipv4Address routerId, List<Ipv4Address> neighbors) {
    return new OspfHello(routerId, AREA, SubnetMask.ofPrefix(30), FAST.helloIntervalSeconds(),
        OspfConstants.OPTIONS_E, 1, FAST.deadIntervalSeconds(), Ipv4Address.ANY, Ipv4Address.ANY, neighbors);
  }

  private static int indexOf(List<String> lines, String fragment) {
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).contains(fragment)) {
        return i;
      }
    }
    return -1;
  }

  private record Member(OspfEngine engine, String interfaceName, Ipv4Address address) {}

  /** One shared segment: multicasts reach every other member, unicasts the owner of the address. */
  private static final class Segment {
    private final List<Member> members = new ArrayList<>();
    private final List<Ipv4Address> senders = new ArrayList<>();
    private Predicate<OspfPacket> drop = packet -> false;

    void deliver(String interfaceName, OspfPacket packet, Ipv4Address destination) {
      senders.add(packet.routerId());
      if (drop.test(packet)) {
        return;
      }
      Optional<Member> from = members.stream().filter(m -> m.engine().routerId().equals(packet.routerId()))
          .findFirst();
      if (from.isEmpty()) {
        return;
      }
      for (Member member : List.copyOf(members)) {
        if (member == from.get()) {
          continue;
        }
        if (destination.isMulticast() || destination.equals(member.address())) {
          member.engine().processPacket(member.interfaceName(), from.get().address(), packet);
        }
      }
    }

    int sentBy(Ipv4Address routerId) {
      return (int) senders.stream().filter(routerId::equals).count();
    }
  }
}
