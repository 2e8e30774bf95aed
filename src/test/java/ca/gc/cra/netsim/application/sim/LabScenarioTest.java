package ca.gc.cra.netsim.application.sim;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.application.device.Router;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.ospf.NeighborState;
import ca.gc.cra.netsim.domain.routing.Route;
import ca.gc.cra.netsim.domain.routing.RouteSource;
import ca.gc.cra.netsim.infrastructure.time.VirtualClock;
import ca.gc.cra.netsim.testutil.SimFixtures;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LabScenarioTest {
  private LabScenario lab;

  @AfterEach
  void tearDown() {
    if (lab != null) {
      lab.shutdown();
    }
  }

  @Test
  void threeRouterChainConvergesAndCarriesPing() {
    SimFixtures.Sim sim = SimFixtures.sim();
    lab = LabScenario.chain(sim.context(), 3);
    assertFalse(lab.converged());

    sim.clock().advanceBy(60_000);

    assertTrue(lab.converged());
    LabReport.PingOutcome ping = lab.pingAcross();
    assertTrue(ping.replied(), ping.summary());
    assertEquals(61, ping.replyTtl());
    assertEquals("reply from 192.168.2.10 ttl=61", ping.summary());

    LabReport report = lab.report(ping);
    assertTrue(report.converged());
    assertEquals(3, report.routerCount());
    assertEquals(60_000, report.elapsedMillis());
    assertEquals(4, report.neighbors().size());
    assertTrue(report.neighbors().stream().allMatch(row -> row.state() == NeighborState.FULL));
    assertEquals(List.of("R1", "R2", "R3"), List.copyOf(report.routingTables().keySet()));
    assertFalse(report.events().isEmpty());
  }

  @Test
  void firstRouterLearnsFarLanThroughOspf() {
    SimFixtures.Sim sim = SimFixtures.sim();
    lab = LabScenario.chain(sim.context(), 3);
    sim.clock().advanceBy(60_000);

    Router r1 = lab.routers().get(0);
    Route far = r1.getRoutingTable().lookup(Ipv4Address.parse("192.168.2.10")).orElseThrow();

    assertEquals(RouteSource.OSPF, far.source());
    assertEquals(Ipv4Address.parse("10.0.1.2"), far.gateway().orElseThrow());
    assertEquals(LabScenario.RIGHT_PORT, far.interfaceName());
    assertEquals(Ipv4Address.parse("1.1.1.1"), r1.ospf().routerId());
  }

  @Test
  void pingBeforeConvergenceReportsUnreachable() {
    SimFixtures.Sim sim = SimFixtures.sim();
    lab = LabScenario.chain(sim.context(), 2);

    LabReport.PingOutcome ping = lab.pingAcross();

    assertFalse(ping.replied());
    assertEquals(-1, ping.replyTtl());
    assertTrue(ping.summary().contains("192.168.2.10"), ping.summary());
  }

  @Test
  void singleRouterNeedsNoAdjacency() {
    SimFixtures.Sim sim = SimFixtures.sim();
    lab = LabScenario.chain(sim.context(), 1);
    VirtualClock clock = sim.clock();
    clock.advanceBy(1_000);

    assertTrue(lab.converged());
    assertTrue(lab.pingAcross().replied());
    assertEquals(0, lab.report(lab.pingAcross()).neighbors().size());
  }

  @Test
  void rejectsRouterCountOutsideAddressingPlan() {
    SimFixtures.Sim sim = SimFixtures.sim();

    assertThrows(IllegalArgumentException.class, () -> LabScenario.chain(sim.context(), 0));
    assertThrows(IllegalArgumentException.class,
        () -> LabScenario.chain(sim.context(), LabScenario.MAX_ROUTERS + 1));
  }
}
