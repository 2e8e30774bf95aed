package ca.gc.cra.netsim.application.device;

import ca.gc.cra.netsim.application.acl.AclEngine;
import ca.gc.cra.netsim.application.nat.NatEngine;
import ca.gc.cra.netsim.application.ospf.InterfaceOptions;
import ca.gc.cra.netsim.application.ospf.OspfEngine;
import ca.gc.cra.netsim.application.ospf.OspfRoute;
import ca.gc.cra.netsim.application.ospf.OspfSettings;
import ca.gc.cra.netsim.application.port.Cancellable;
import ca.gc.cra.netsim.application.sim.SimulationContext;
import ca.gc.cra.netsim.domain.acl.AclDirection;
import ca.gc.cra.netsim.domain.nat.NatResult;
import ca.gc.cra.netsim.domain.nat.NatStatus;
import ca.gc.cra.netsim.domain.net.EthernetFrame;
import ca.gc.cra.netsim.domain.net.IcmpMessage;
import ca.gc.cra.netsim.domain.net.IcmpType;
import ca.gc.cra.netsim.domain.net.IpProtocol;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.MacAddress;
import ca.gc.cra.netsim.domain.net.PacketFactory;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.ospf.OspfConstants;
import ca.gc.cra.netsim.domain.ospf.OspfPacket;
import ca.gc.cra.netsim.domain.routing.Route;
import ca.gc.cra.netsim.domain.routing.RouteSource;
import ca.gc.cra.netsim.domain.routing.RoutingTable;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> IPv4 router: connected, static and OSPF routes, TTL handling with ICMP errors, ACL filtering,
 * NAT on inside-to-outside traffic and ARP next-hop resolution.
 * <p><strong>Forwarding order:</strong> inbound NAT on outside interfaces; local delivery (echo, OSPF) bypassing ACLs;
 * ingress ACL; TTL; longest-prefix lookup; outbound NAT; egress ACL; re-encapsulation to the next-hop MAC.</p>
 * <p><strong>Role:</strong> Device; interfaces are named {@code GigabitEthernet0/0} onwards.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven by the simulation thread.</p>
 * <p><strong>Observability:</strong> {@code <prefix>.router.forwarded}, {@code .drop.checksum|acl|nat|ttl},
 * {@code .icmp.timeExceeded|unreachable}; every drop is logged at DEBUG and every ICMP emission at INFO.</p>
 *
 * @since 0.1.0
 */
public final class Router extends IpDevice {
  private static final Logger log = LoggerFactory.getLogger(Router.class);
  /** Interface count of the default chassis. */
  public static final int DEFAULT_INTERFACE_COUNT = 4;
  private static final long NAT_SWEEP_MILLIS = 60_000L;

  private static final MacAddress ALL_SPF_MAC = MacAddress.ipv4Multicast(OspfConstants.ALL_SPF_ROUTERS);
  private static final MacAddress ALL_D_MAC = MacAddress.ipv4Multicast(OspfConstants.ALL_D_ROUTERS);

  private record OspfAssignment(Ipv4Address area, InterfaceOptions options) {}

  private final RoutingTable routingTable = new RoutingTable();
  private final AclEngine acl;
  private final NatEngine nat;
  private final Cancellable natSweep;
  private final Map<String, OspfAssignment> ospfAssignments = new LinkedHashMap<>();
  private OspfEngine ospf;
  private int echoSequence;

  /**
   * Creates a router with {@value #DEFAULT_INTERFACE_COUNT} interfaces.
   *
   * @param name device name
   * @param context owning simulation
   */
  public Router(String name, SimulationContext context) {
    this(name, context, DEFAULT_INTERFACE_COUNT);
  }

  /**
   * Creates a router.
   *
   * @param name device name
   * @param context owning simulation
   * @param interfaceCount number of interfaces, 1-16
   */
  public Router(String name, SimulationContext context, int interfaceCount) {
    super(name, context);
    Numbers.requireRange("interfaceCount", interfaceCount, 1, 16);
    for (int i = 0; i < interfaceCount; i++) {
      addPort("GigabitEthernet0/" + i);
    }
    this.acl = new AclEngine(name);
    this.nat = new NatEngine(name, acl, context.clock(),
        iface -> port(iface).flatMap(NetworkPort::address), context.config().natTranslationTimeoutSeconds());
    this.natSweep = context.timers().scheduleAtFixedRate(NAT_SWEEP_MILLIS, NAT_SWEEP_MILLIS, () -> {
      int removed = nat.cleanupExpired(context.clock().nowMillis());
      if (removed > 0) {
        log.debug("{}: expired {} NAT translations", name(), removed);
      }
    });
  }

  @Override
  public String kind() {
    return "router";
  }

  public AclEngine acl() {
    return acl;
  }

  public NatEngine nat() {
    return nat;
  }

  public RoutingTable getRoutingTable() {
    return routingTable;
  }

  // --- Interface configuration -------------------------------------------------------------------------------

  /**
   * Assigns an address to an interface and installs its connected route, replacing the previous one.
   *
   * @param interfaceName interface
   * @param address address
   * @param mask mask
   */
  public void configureInterface(String interfaceName, Ipv4Address address, SubnetMask mask) {
    NetworkPort port = requirePort(interfaceName);
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(mask, "mask");
    if (address.isMulticast() || address.isUnspecified()) {
      throw new IllegalArgumentException("invalid interface address " + address);
    }
    port.setAddress(address, mask);
    routingTable.removeConnected(interfaceName);
    if (port.isEnabled()) {
      routingTable.add(Route.connected(address, mask, interfaceName));
    }
    log.info("{}: {} ip address {} {}", name(), interfaceName, address, mask);
    publish("config", interfaceName + " ip address " + address + " " + mask);
    if (ospf != null && ospfAssignments.containsKey(interfaceName)) {
      activateOspf(port);
    }
  }

  /**
   * Convenience form of {@link #configureInterface(String, Ipv4Address, SubnetMask)} with literals.
   *
   * @param interfaceName interface
   * @param address dotted-quad address
   * @param mask dotted-quad mask
   */
  public void configureInterface(String interfaceName, String address, String mask) {
    configureInterface(interfaceName, Ipv4Address.parse(address), SubnetMask.parse(mask));
  }

  /**
   * Administratively disables an interface: its connected route and OSPF adjacencies go away.
   *
   * @param interfaceName interface
   */
  public void shutdownInterface(String interfaceName) {
    shutdownPort(interfaceName);
  }

  /**
   * Re-enables an interface.
   *
   * @param interfaceName interface
   */
  public void enableInterface(String interfaceName) {
    enablePort(interfaceName);
    installConnected(requirePort(interfaceName));
  }

  private void installConnected(NetworkPort port) {
    port.address().ifPresent(address -> {
      routingTable.removeConnected(port.name());
      routingTable.add(Route.connected(address, port.mask().orElseThrow(), port.name()));
    });
  }

  @Override
  protected void onLinkChange(NetworkPort port, boolean up) {
    if (up) {
      installConnected(port);
      if (ospf != null && ospfAssignments.containsKey(port.name()) && port.hasAddress()
          && ospf.getInterface(port.name()).isEmpty()) {
        activateOspf(port);
      }
    } else {
      routingTable.removeConnected(port.name());
      if (ospf != null) {
        ospf.deactivateInterface(port.name());
      }
    }
  }

  // --- Static routing ----------------------------------------------------------------------------------------

  /**
   * Adds a static route with metric 0.
   *
   * @param network destination network
   * @param mask destination mask
   * @param nextHop next hop on a connected subnet
   * @return installed route
   */
  public Route addStaticRoute(Ipv4Address network, SubnetMask mask, Ipv4Address nextHop) {
    return addStaticRoute(network, mask, nextHop, 0);
  }

  /**
   * Adds a static route; the egress interface is the one whose connected subnet contains {@code nextHop}.
   *
   * @param network destination network
   * @param mask destination mask
   * @param nextHop next hop on a connected subnet
   * @param metric metric
   * @return installed route
   * @throws IllegalArgumentException when no enabled interface reaches {@code nextHop}
   */
  public Route addStaticRoute(Ipv4Address network, SubnetMask mask, Ipv4Address nextHop, int metric) {
    Objects.requireNonNull(nextHop, "nextHop");
    NetworkPort egress = ports().stream()
        .filter(p -> p.isEnabled() && p.isOnLink(nextHop))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("next hop " + nextHop + " is not on a connected subnet of "
            + name()));
    Route route = new Route(network, mask, nextHop, egress.name(), RouteSource.STATIC, metric);
    routingTable.add(route);
    log.info("{}: ip route {} {} {}", name(), route.network(), mask, nextHop);
    publish("config", "ip route " + route.network() + " " + mask + " " + nextHop);
    return route;
  }

  /**
   * Installs {@code 0.0.0.0/0} via {@code nextHop}.
   *
   * @param nextHop gateway
   * @return installed route
   */
  public Route setDefaultRoute(Ipv4Address nextHop) {
    return addStaticRoute(Ipv4Address.ANY, SubnetMask.ZERO, nextHop);
  }

  /**
   * Removes the static routes for a prefix.
   *
   * @param network network
   * @param mask mask
   * @return number removed
   */
  public int removeStaticRoute(Ipv4Address network, SubnetMask mask) {
    int removed = routingTable.remove(network, mask, RouteSource.STATIC);
    if (removed > 0) {
      log.info("{}: no ip route {} {}", name(), network.network(mask), mask);
    }
    return removed;
  }

  // --- OSPF --------------------------------------------------------------------------------------------------

  /**
   * Starts the OSPF process, or returns the running one.
   *
   * @param routerId router ID
   * @return engine
   * @throws IllegalStateException when already running with another router ID
   */
  public OspfEngine enableOspf(Ipv4Address routerId) {
    if (ospf != null) {
      if (!ospf.routerId().equals(routerId)) {
        throw new IllegalStateException("OSPF already running on " + name() + " with router ID " + ospf.routerId());
      }
      return ospf;
    }
    SimulationContext ctx = context();
    ospf = new OspfEngine(name(), routerId, OspfSettings.from(ctx.config()), ctx.timers(), ctx.clock(),
        ctx.metrics(), this::sendOspf);
    ospf.setRouteListener(this::installOspfRoutes);
    ospf.setEventListener(line -> publish("ospf", line));
    log.info("{}: router ospf, router-id {}", name(), routerId);
    return ospf;
  }

  /**
   * Returns the OSPF process.
   *
   * @return engine
   * @throws IllegalStateException when OSPF is not enabled
   */
  public OspfEngine ospf() {
    if (ospf == null) {
      throw new IllegalStateException("OSPF is not enabled on " + name());
    }
    return ospf;
  }

  /** @return {@code true} after {@link #enableOspf(Ipv4Address)} */
  public boolean isOspfEnabled() {
    return ospf != null;
  }

  /**
   * Runs OSPF on an interface with default options.
   *
   * @param interfaceName interface
   * @param area area ID
   */
  public void enableOspfInterface(String interfaceName, Ipv4Address area) {
    enableOspfInterface(interfaceName, area, InterfaceOptions.defaults());
  }

  /**
   * Runs OSPF on an interface. It activates now when the interface is addressed and up, otherwise as soon as it is.
   *
   * @param interfaceName interface
   * @param area area ID
   * @param options OSPF interface options
   */
  public void enableOspfInterface(String interfaceName, Ipv4Address area, InterfaceOptions options) {
    NetworkPort port = requirePort(interfaceName);
    ospf();
    ospfAssignments.put(interfaceName, new OspfAssignment(area, options));
    if (port.hasAddress() && port.isEnabled()) {
      activateOspf(port);
    }
  }

  private void activateOspf(NetworkPort port) {
    OspfAssignment assignment = ospfAssignments.get(port.name());
    ospf.activateInterface(port.name(), port.address().orElseThrow(), port.mask().orElseThrow(), assignment.area(),
        assignment.options());
  }

  private void sendOspf(String interfaceName, OspfPacket packet, Ipv4Address destination) {
    NetworkPort port = requirePort(interfaceName);
    Optional<Ipv4Address> source = port.address();
    if (source.isEmpty()) {
      return;
    }
    Ipv4Packet ip = PacketFactory.createIpv4Packet(source.get(), destination, IpProtocol.OSPF, 1, packet,
        packet.length());
    sendToNextHop(port, destination, ip);
  }

  private void installOspfRoutes(List<OspfRoute> routes) {
    List<Route> installable = new ArrayList<>();
    for (OspfRoute route : routes) {
      route.toRoute().ifPresent(installable::add);
    }
    routingTable.replaceAll(RouteSource.OSPF, installable);
    log.info("{}: installed {} OSPF routes", name(), installable.size());
  }

  @Override
  protected boolean acceptsGroup(MacAddress mac) {
    return ospf != null && (mac.equals(ALL_SPF_MAC) || mac.equals(ALL_D_MAC));
  }

  // --- Forwarding --------------------------------------------------------------------------------------------

  @Override
  protected void handlePacket(NetworkPort ingress, EthernetFrame frame, Ipv4Packet received) {
    Ipv4Packet packet = received;
    if (nat.isOutside(ingress.name())) {
      NatResult inbound = nat.translateIncoming(packet, ingress.name());
      packet = inbound.packet();
    }

    if (isForUs(packet)) {
      deliverLocally(ingress, packet);
      return;
    }
    if (!acl.checkPacket(ingress.name(), AclDirection.IN, packet)) {
      drop("drop.acl", packet, "denied by inbound ACL on " + ingress.name());
      return;
    }
    if (packet.ttl() - 1 <= 0) {
      drop("drop.ttl", packet, "TTL expired");
      sendIcmpError(ingress, frame.source(), packet, IcmpType.TIME_EXCEEDED, 0, "icmp.timeExceeded");
      return;
    }
    Optional<Route> route = routingTable.lookup(packet.destination());
    if (route.isEmpty()) {
      drop("drop.noRoute", packet, "no route to " + packet.destination());
      sendIcmpError(ingress, frame.source(), packet, IcmpType.DESTINATION_UNREACHABLE, 0, "icmp.unreachable");
      return;
    }
    NetworkPort egress = requirePort(route.get().interfaceName());
    Ipv4Packet forwarded = packet.withTtl(packet.ttl() - 1).withComputedChecksum();
    if (nat.isInside(ingress.name()) && nat.isOutside(egress.name())) {
      NatResult outbound = nat.translateOutgoing(forwarded, ingress.name(), egress.address().orElse(null));
      if (outbound.status() == NatStatus.EXHAUSTED) {
        drop("drop.nat", forwarded, "NAT resources exhausted");
        return;
      }
      forwarded = outbound.packet();
    }
    if (!acl.checkPacket(egress.name(), AclDirection.OUT, forwarded)) {
      drop("drop.acl", forwarded, "denied by outbound ACL on " + egress.name());
      return;
    }
    Ipv4Address nextHop = route.get().gateway().orElse(forwarded.destination());
    log.debug("{}: forwarding {} -> {} via {} on {}", name(), forwarded.source(), forwarded.destination(), nextHop,
        egress.name());
    context().metrics().increment(metricKey("forwarded"));
    sendToNextHop(egress, nextHop, forwarded);
  }

  private boolean isForUs(Ipv4Packet packet) {
    Ipv4Address destination = packet.destination();
    if (isLocalAddress(destination) || destination.equals(Ipv4Address.BROADCAST)) {
      return true;
    }
    return destination.equals(OspfConstants.ALL_SPF_ROUTERS) || destination.equals(OspfConstants.ALL_D_ROUTERS);
  }

  private void deliverLocally(NetworkPort ingress, Ipv4Packet packet) {
    if (packet.payload() instanceof OspfPacket ospfPacket) {
      if (ospf != null) {
        ospf.processPacket(ingress.name(), packet.source(), ospfPacket);
      }
      return;
    }
    if (packet.payload() instanceof IcmpMessage icmp && icmp.type() == IcmpType.ECHO_REQUEST) {
      Ipv4Address replySource = isLocalAddress(packet.destination())
          ? packet.destination()
          : ingress.address().orElse(packet.destination());
      Ipv4Packet reply = PacketFactory.echoReply(packet, replySource, context().config().routerDefaultTtl());
      log.debug("{}: echo reply to {}", name(), packet.source());
      originate(reply);
      return;
    }
    log.debug("{}: consumed {} from {}", name(), packet.payload().getClass().getSimpleName(), packet.source());
  }

  /**
   * Sends a packet originated by this router through the routing table.
   *
   * @param packet packet whose source is one of the router's addresses
   * @return {@code true} when handed to a cable immediately
   */
  public boolean originate(Ipv4Packet packet) {
    Optional<Route> route = routingTable.lookup(packet.destination());
    if (route.isEmpty()) {
      drop("drop.noRoute", packet, "no route for locally originated packet");
      return false;
    }
    NetworkPort egress = requirePort(route.get().interfaceName());
    return sendToNextHop(egress, route.get().gateway().orElse(packet.destination()), packet);
  }

  /**
   * Pings {@code destination} from the egress interface address.
   *
   * @param destination target
   * @return the echo request sent, or empty when there is no route
   */
  public Optional<Ipv4Packet> ping(Ipv4Address destination) {
    Optional<Route> route = routingTable.lookup(destination);
    if (route.isEmpty()) {
      return Optional.empty();
    }
    Ipv4Address source = requirePort(route.get().interfaceName()).address().orElseThrow();
    Ipv4Packet request = PacketFactory.echoRequest(source, destination, context().config().routerDefaultTtl(),
        name().hashCode() & 0xFFFF, ++echoSequence & 0xFFFF);
    originate(request);
    return Optional.of(request);
  }

  private void sendIcmpError(NetworkPort ingress, MacAddress previousHop, Ipv4Packet offending, IcmpType type,
      int code, String metric) {
    if (offending.payload() instanceof IcmpMessage icmp && icmp.isError()) {
      log.debug("{}: not reporting {} about an ICMP error from {}", name(), type, offending.source());
      return;
    }
    Optional<Ipv4Address> reporter = ingress.address();
    if (reporter.isEmpty()) {
      return;
    }
    Ipv4Packet error = PacketFactory.icmpError(type, code, offending, reporter.get(),
        context().config().routerDefaultTtl());
    context().metrics().increment(metricKey(metric));
    log.info("{}: ICMP {} code {} to {} from {}", name(), type, code, offending.source(), reporter.get());
    publish("icmp", type + " to " + offending.source() + " about " + offending.destination());
    transmit(ingress, EthernetFrame.ipv4(ingress.mac(), previousHop, error));
  }

  private void drop(String metric, Ipv4Packet packet, String reason) {
    context().metrics().increment(metricKey(metric));
    log.debug("{}: dropping {} -> {}: {}", name(), packet.source(), packet.destination(), reason);
  }

  /**
   * Stops the router's timers and its OSPF process.
   */
  public void powerOff() {
    natSweep.cancel();
    if (ospf != null) {
      ospf.shutdown();
    }
  }
}
