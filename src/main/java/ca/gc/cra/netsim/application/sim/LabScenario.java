package ca.gc.cra.netsim.application.sim;

import ca.gc.cra.netsim.application.device.Host;
import ca.gc.cra.netsim.application.device.Router;
import ca.gc.cra.netsim.application.ospf.InterfaceOptions;
import ca.gc.cra.netsim.application.ospf.OspfNeighbor;
import ca.gc.cra.netsim.domain.net.IcmpMessage;
import ca.gc.cra.netsim.domain.net.IcmpType;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.ospf.OspfConstants;
import ca.gc.cra.netsim.domain.routing.Route;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds a linear OSPF lab: {@code hostA - R1 - R2 - ... - Rn - hostB}.
 * <p><strong>Why:</strong> Gives the CLI and end-to-end tests one reproducible topology that exercises ARP,
 * forwarding, TTL handling and OSPF convergence together.</p>
 * <p><strong>Role:</strong> Application service; wires devices into a {@link SimulationContext}. Time is driven by
 * whoever owns the context's clock.</p>
 *
 * <p>Addressing: the left LAN is {@code 192.168.1.0/24}, the right LAN {@code 192.168.2.0/24}, hosts use
 * {@code .10} and the router {@code .1}. Router {@code i} links to router {@code i+1} over
 * {@code 10.0.i.0/30} ({@code .1} and {@code .2}) on {@code GigabitEthernet0/1} and {@code GigabitEthernet0/0}.
 * Router IDs are {@code i.i.i.i}. LAN interfaces are passive; transit links are point-to-point.</p>
 *
 * @since 0.1.0
 */
public final class LabScenario {
  private static final Logger log = LoggerFactory.getLogger(LabScenario.class);
  /** Largest chain the addressing plan supports. */
  public static final int MAX_ROUTERS = 254;
  static final String LEFT_PORT = "GigabitEthernet0/0";
  static final String RIGHT_PORT = "GigabitEthernet0/1";
  private static final SubnetMask LAN_MASK = SubnetMask.ofPrefix(24);
  private static final SubnetMask LINK_MASK = SubnetMask.ofPrefix(30);

  private final SimulationContext context;
  private final List<Router> routers;
  private final Host left;
  private final Host right;
  private final long startedAtMillis;

  private LabScenario(SimulationContext context, List<Router> routers, Host left, Host right) {
    this.context = context;
    this.routers = List.copyOf(routers);
    this.left = left;
    this.right = right;
    this.startedAtMillis = context.clock().nowMillis();
  }

  /**
   * Builds and cables the chain, then starts OSPF on every router.
   *
   * @param context empty simulation context
   * @param routerCount routers in the chain, 1-254
   * @return the scenario
   */
  public static LabScenario chain(SimulationContext context, int routerCount) {
    Objects.requireNonNull(context, "context");
    Numbers.requireRange("routers", routerCount, 1, MAX_ROUTERS);

    Host left = context.register(new Host("hostA", context));
    Host right = context.register(new Host("hostB", context));
    List<Router> routers = new ArrayList<>(routerCount);
    for (int i = 1; i <= routerCount; i++) {
      routers.add(context.register(new Router("R" + i, context)));
    }

    context.connect(left.name(), Host.NIC, routers.get(0).name(), LEFT_PORT);
    for (int i = 0; i + 1 < routerCount; i++) {
      context.connect(routers.get(i).name(), RIGHT_PORT, routers.get(i + 1).name(), LEFT_PORT);
    }
    context.connect(routers.get(routerCount - 1).name(), RIGHT_PORT, right.name(), Host.NIC);

    left.configure(Ipv4Address.of(192, 168, 1, 10), LAN_MASK, Ipv4Address.of(192, 168, 1, 1));
    right.configure(Ipv4Address.of(192, 168, 2, 10), LAN_MASK, Ipv4Address.of(192, 168, 2, 1));

    for (int i = 1; i <= routerCount; i++) {
      Router router = routers.get(i - 1);
      if (i == 1) {
        router.configureInterface(LEFT_PORT, Ipv4Address.of(192, 168, 1, 1), LAN_MASK);
      } else {
        router.configureInterface(LEFT_PORT, Ipv4Address.of(10, 0, i - 1, 2), LINK_MASK);
      }
      if (i == routerCount) {
        router.configureInterface(RIGHT_PORT, Ipv4Address.of(192, 168, 2, 1), LAN_MASK);
      } else {
        router.configureInterface(RIGHT_PORT, Ipv4Address.of(10, 0, i, 1), LINK_MASK);
      }
    }

    for (int i = 1; i <= routerCount; i++) {
      Router router = routers.get(i - 1);
      router.enableOspf(Ipv4Address.of(i, i, i, i));
      router.enableOspfInterface(LEFT_PORT, OspfConstants.BACKBONE_AREA, optionsFor(i == 1));
      router.enableOspfInterface(RIGHT_PORT, OspfConstants.BACKBONE_AREA, optionsFor(i == routerCount));
    }
    log.info("Lab built: {} router(s) between {} and {}", routerCount, left.name(), right.name());
    return new LabScenario(context, routers, left, right);
  }

  private static InterfaceOptions optionsFor(boolean lan) {
    return lan ? InterfaceOptions.defaults().withPassive(true) : InterfaceOptions.pointToPoint();
  }

  public SimulationContext context() {
    return context;
  }

  public List<Router> routers() {
    return routers;
  }

  public Host left() {
    return left;
  }

  public Host right() {
    return right;
  }

  /** @return {@code true} once every transit adjacency is Full */
  public boolean converged() {
    for (int i = 0; i < routers.size(); i++) {
      int expected = (i > 0 ? 1 : 0) + (i + 1 < routers.size() ? 1 : 0);
      if (routers.get(i).ospf().fullNeighborCount() != expected) {
        return false;
      }
    }
    return true;
  }

  /**
   * Pings the right host from the left host. Delivery is synchronous, so the reply (if any) is in the left host's
   * inbox when this returns.
   *
   * @return outcome
   */
  public LabReport.PingOutcome pingAcross() {
    Ipv4Address source = left.address().orElseThrow();
    Ipv4Address destination = right.address().orElseThrow();
    left.clearInbox();
    left.ping(destination);
    for (Ipv4Packet packet : left.inbox()) {
      if (!(packet.payload() instanceof IcmpMessage icmp)) {
        continue;
      }
      if (icmp.type() == IcmpType.ECHO_REPLY && packet.source().equals(destination)) {
        log.info("Lab ping {} -> {}: reply ttl {}", source, destination, packet.ttl());
        return new LabReport.PingOutcome(source, destination, true, packet.ttl(), null);
      }
      if (icmp.isError()) {
        log.info("Lab ping {} -> {}: {} from {}", source, destination, icmp.type(), packet.source());
        return new LabReport.PingOutcome(source, destination, false, -1, icmp.type());
      }
    }
    log.info("Lab ping {} -> {}: no reply", source, destination);
    return new LabReport.PingOutcome(source, destination, false, -1, null);
  }

  /**
   * Captures neighbor states, routing tables and events.
   *
   * @param ping outcome of {@link #pingAcross()}
   * @return report
   */
  public LabReport report(LabReport.PingOutcome ping) {
    List<LabReport.NeighborRow> neighbors = new ArrayList<>();
    Map<String, List<Route>> tables = new LinkedHashMap<>();
    for (Router router : routers) {
      for (OspfNeighbor neighbor : router.ospf().getNeighbors()) {
        neighbors.add(new LabReport.NeighborRow(router.name(), neighbor.interfaceName(), neighbor.routerId(),
            neighbor.address(), neighbor.state()));
      }
      tables.put(router.name(), router.getRoutingTable().routes());
    }
    return new LabReport(routers.size(), context.clock().nowMillis() - startedAtMillis, neighbors, tables, ping,
        context.events().events());
  }

  /**
   * Stops every router's timers.
   */
  public void shutdown() {
    for (Router router : routers) {
      router.powerOff();
    }
  }
}
