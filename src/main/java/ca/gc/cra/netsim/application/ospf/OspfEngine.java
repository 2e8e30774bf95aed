package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.application.port.Cancellable;
import ca.gc.cra.netsim.application.port.ClockPort;
import ca.gc.cra.netsim.application.port.MetricsPort;
import ca.gc.cra.netsim.application.port.TimerPort;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.ospf.InterfaceEvent;
import ca.gc.cra.netsim.domain.ospf.InterfaceState;
import ca.gc.cra.netsim.domain.ospf.LinkStateDatabase;
import ca.gc.cra.netsim.domain.ospf.Lsa;
import ca.gc.cra.netsim.domain.ospf.LsaChecksum;
import ca.gc.cra.netsim.domain.ospf.LsaHeader;
import ca.gc.cra.netsim.domain.ospf.LsaKey;
import ca.gc.cra.netsim.domain.ospf.LsaType;
import ca.gc.cra.netsim.domain.ospf.NeighborEvent;
import ca.gc.cra.netsim.domain.ospf.NeighborState;
import ca.gc.cra.netsim.domain.ospf.NetworkLsa;
import ca.gc.cra.netsim.domain.ospf.NetworkType;
import ca.gc.cra.netsim.domain.ospf.OspfConstants;
import ca.gc.cra.netsim.domain.ospf.OspfDatabaseDescription;
import ca.gc.cra.netsim.domain.ospf.OspfHello;
import ca.gc.cra.netsim.domain.ospf.OspfLinkStateAck;
import ca.gc.cra.netsim.domain.ospf.OspfLinkStateRequest;
import ca.gc.cra.netsim.domain.ospf.OspfLinkStateUpdate;
import ca.gc.cra.netsim.domain.ospf.OspfPacket;
import ca.gc.cra.netsim.domain.ospf.RouterLink;
import ca.gc.cra.netsim.domain.ospf.RouterLinkType;
import ca.gc.cra.netsim.domain.ospf.RouterLsa;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> OSPFv2 process of one router: Hello protocol, interface and neighbor state machines, DR/BDR
 * election, database exchange, reliable flooding, LSA origination and SPF.
 * <p><strong>Why:</strong> Routers learn remote networks through it; the adjacency state machine follows RFC 2328
 * §10 closely enough to observe ExStart negotiation, master/slave roles and retransmission in tests.</p>
 * <p><strong>Role:</strong> Owned by a router, which feeds it received protocol 89 packets through
 * {@link #processPacket(String, Ipv4Address, OspfPacket)} and transmits what it emits through {@link OspfSender}.
 * Computed routes are pushed to the route listener.</p>
 * <p><strong>Timers:</strong> every neighbor owns its inactivity and retransmission tasks on the injected
 * {@link TimerPort}; teardown cancels them, and a task that still fires for a removed neighbor does nothing.</p>
 * <p><strong>Transmission:</strong> packets are queued while an input is processed and sent once it completes, so a
 * peer answering synchronously never re-enters a half-finished state change.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; all calls and timer tasks run on the simulation thread.</p>
 * <p><strong>Observability:</strong> state transitions go to the event log and INFO; rejected Hellos to WARN and
 * {@code <prefix>.ospf.hello.rejected}; retransmissions to {@code <prefix>.ospf.retransmit.dd|lsr|lsu}; SPF runs to
 * {@code <prefix>.ospf.spf.runs}.</p>
 *
 * @since 0.1.0
 */
public final class OspfEngine {
  private static final Logger log = LoggerFactory.getLogger(OspfEngine.class);
  static final int EVENT_LOG_CAPACITY = 1_024;

  private final String owner;
  private final Ipv4Address routerId;
  private final OspfSettings settings;
  private final TimerPort timers;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final OspfSender sender;

  private final Map<String, OspfInterface> interfaces = new LinkedHashMap<>();
  private final LinkStateDatabase lsdb = new LinkStateDatabase();
  private final Deque<String> eventLog = new ArrayDeque<>();
  private final Deque<Outbound> outbox = new ArrayDeque<>();
  private boolean draining;
  private List<OspfRoute> routes = List.of();
  private Cancellable spfTimer = Cancellable.NONE;
  private Consumer<List<OspfRoute>> routeListener = r -> { };
  private Consumer<String> eventListener = e -> { };

  private record Outbound(String interfaceName, OspfPacket packet, Ipv4Address destination) {}

  /**
   * Creates an engine with no active interfaces.
   *
   * @param owner device name used in log lines
   * @param routerId router ID
   * @param settings default timers, reference bandwidth and metrics prefix
   * @param timers timer service for hello, wait, inactivity, retransmission and SPF tasks
   * @param clock time source for inactivity deadlines
   * @param metrics metrics sink
   * @param sender transmits emitted packets
   */
  public OspfEngine(
      String owner,
      Ipv4Address routerId,
      OspfSettings settings,
      TimerPort timers,
      ClockPort clock,
      MetricsPort metrics,
      OspfSender sender) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.routerId = Objects.requireNonNull(routerId, "routerId");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.timers = Objects.requireNonNull(timers, "timers");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsPort.NO_OP;
    this.sender = Objects.requireNonNull(sender, "sender");
    if (routerId.isUnspecified()) {
      throw new IllegalArgumentException("router ID must not be 0.0.0.0");
    }
  }

  public Ipv4Address routerId() {
    return routerId;
  }

  /**
   * Registers the consumer of SPF results; it receives every route, directly attached ones included.
   *
   * @param listener route consumer
   */
  public void setRouteListener(Consumer<List<OspfRoute>> listener) {
    this.routeListener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Registers a consumer of state transition lines, in addition to the event log.
   *
   * @param listener transition consumer
   */
  public void setEventListener(Consumer<String> listener) {
    this.eventListener = Objects.requireNonNull(listener, "listener");
  }

  // --- Interfaces --------------------------------------------------------------------------------------------

  /**
   * Activates an interface with default options.
   *
   * @param name interface name
   * @param address interface address
   * @param mask interface mask
   * @param areaId area
   * @return the interface
   */
  public OspfInterface activateInterface(String name, Ipv4Address address, SubnetMask mask, Ipv4Address areaId) {
    return activateInterface(name, address, mask, areaId, InterfaceOptions.defaults());
  }

  /**
   * Activates an interface and fires InterfaceUp. An interface already active under {@code name} is deactivated
   * first.
   *
   * @param name interface name
   * @param address interface address
   * @param mask interface mask
   * @param areaId area
   * @param options per-interface parameters
   * @return the interface
   */
  public OspfInterface activateInterface(
      String name, Ipv4Address address, SubnetMask mask, Ipv4Address areaId, InterfaceOptions options) {
    Objects.requireNonNull(options, "options");
    if (interfaces.containsKey(name)) {
      deactivateInterface(name);
    }
    int hello = options.helloInterval() > 0 ? options.helloInterval() : settings.helloIntervalSeconds();
    int dead = options.deadInterval() > 0 ? options.deadInterval() : settings.deadIntervalSeconds();
    if (dead <= hello) {
      throw new IllegalArgumentException("dead interval must exceed hello interval (was " + dead + " <= "
          + hello + ")");
    }
    int cost = options.cost() > 0
        ? options.cost()
        : Math.max(1, settings.referenceBandwidthMbps() / options.bandwidthMbps());
    OspfInterface iface = new OspfInterface(name, address, mask, areaId, options.networkType(), hello, dead,
        settings.retransmitIntervalSeconds(), options.priority(), Math.min(cost, 0xFFFF), options.passive());
    interfaces.put(name, iface);
    lsdb.addArea(areaId);
    log.info("{}: OSPF enabled on {} {}/{} area {} ({}, cost {}, priority {})", owner, name, address,
        mask.prefixLength(), areaId, options.networkType(), iface.cost(), iface.priority());
    interfaceUp(iface);
    drain();
    return iface;
  }

  /**
   * Fires InterfaceDown: every neighbor receives LLDown, all timers stop, the interface leaves the Router-LSA.
   *
   * @param name interface name
   * @return {@code true} when the interface was active
   */
  public boolean deactivateInterface(String name) {
    OspfInterface iface = interfaces.get(name);
    if (iface == null) {
      return false;
    }
    iface.replaceHelloTimer(Cancellable.NONE);
    iface.replaceWaitTimer(Cancellable.NONE);
    setInterfaceState(iface, InterfaceState.DOWN, InterfaceEvent.INTERFACE_DOWN);
    for (OspfNeighbor neighbor : iface.neighbors()) {
      neighborEvent(iface, neighbor, NeighborEvent.LL_DOWN);
    }
    flushNetworkLsa(iface);
    interfaces.remove(name);
    iface.setDesignatedRouters(Ipv4Address.ANY, Ipv4Address.ANY);
    originateRouterLsa(iface.areaId());
    scheduleSpf();
    drain();
    return true;
  }

  /**
   * Changes an interface cost and re-originates the Router-LSA.
   *
   * @param name interface name
   * @param cost new cost, 1-65535
   * @throws IllegalArgumentException for unknown interfaces
   */
  public void setInterfaceCost(String name, int cost) {
    Numbers.requireRange("cost", cost, 1, 0xFFFF);
    OspfInterface iface = requireInterface(name);
    iface.setCost(cost);
    log.info("{}: ip ospf cost {} on {}", owner, cost, name);
    originateRouterLsa(iface.areaId());
    drain();
  }

  /**
   * Changes the router priority advertised on an interface; it takes effect at the next election.
   *
   * @param name interface name
   * @param priority new priority, 0-255
   */
  public void setInterfacePriority(String name, int priority) {
    Numbers.requireRange("priority", priority, 0, 255);
    requireInterface(name).setPriority(priority);
    log.info("{}: ip ospf priority {} on {}", owner, priority, name);
  }

  /**
   * Makes an interface passive (no Hellos sent or accepted, subnet still advertised) or active again.
   *
   * @param name interface name
   * @param passive new mode
   */
  public void setPassive(String name, boolean passive) {
    OspfInterface iface = requireInterface(name);
    if (iface.isPassive() == passive) {
      return;
    }
    iface.setPassive(passive);
    log.info("{}: {}passive-interface {}", owner, passive ? "" : "no ", name);
    if (passive) {
      iface.replaceHelloTimer(Cancellable.NONE);
      for (OspfNeighbor neighbor : iface.neighbors()) {
        neighborEvent(iface, neighbor, NeighborEvent.KILL_NBR);
      }
    } else {
      startHelloTimer(iface);
    }
    originateRouterLsa(iface.areaId());
    drain();
  }

  /**
   * Configures an NBMA neighbor and fires Start: it enters Attempt and is sent a unicast Hello.
   *
   * @param interfaceName NBMA interface
   * @param neighborRouterId neighbor router ID
   * @param address neighbor interface address
   * @param priority neighbor priority as configured
   * @return the neighbor
   * @throws IllegalArgumentException when the interface is unknown or not NBMA
   */
  public OspfNeighbor startNeighbor(String interfaceName, Ipv4Address neighborRouterId, Ipv4Address address,
      int priority) {
    OspfInterface iface = requireInterface(interfaceName);
    if (iface.networkType() != NetworkType.NBMA) {
      throw new IllegalArgumentException("neighbors can only be configured on NBMA interfaces (was "
          + iface.networkType() + ")");
    }
    OspfNeighbor neighbor = iface.neighborMap().computeIfAbsent(neighborRouterId,
        rid -> new OspfNeighbor(rid, interfaceName, address, priority));
    neighborEvent(iface, neighbor, NeighborEvent.START);
    drain();
    return neighbor;
  }

  // --- Packet input ------------------------------------------------------------------------------------------

  /**
   * Dispatches a received OSPF packet; packets carrying our own router ID are ignored.
   *
   * @param interfaceName receiving interface
   * @param source IPv4 source address
   * @param packet packet
   */
  public void processPacket(String interfaceName, Ipv4Address source, OspfPacket packet) {
    if (packet.routerId().equals(routerId)) {
      return;
    }
    if (packet instanceof OspfHello hello) {
      handleHello(interfaceName, source, hello);
    } else if (packet instanceof OspfDatabaseDescription dd) {
      handleDatabaseDescription(interfaceName, dd);
    } else if (packet instanceof OspfLinkStateRequest lsr) {
      handleLinkStateRequest(interfaceName, lsr);
    } else if (packet instanceof OspfLinkStateUpdate lsu) {
      handleLinkStateUpdate(interfaceName, lsu);
    } else if (packet instanceof OspfLinkStateAck ack) {
      handleLinkStateAck(interfaceName, ack);
    }
    drain();
  }

  public void processHello(String interfaceName, Ipv4Address source, OspfHello hello) {
    processPacket(interfaceName, source, hello);
  }

  public void processDatabaseDescription(String interfaceName, Ipv4Address source, OspfDatabaseDescription dd) {
    processPacket(interfaceName, source, dd);
  }

  public void processLinkStateRequest(String interfaceName, Ipv4Address source, OspfLinkStateRequest lsr) {
    processPacket(interfaceName, source, lsr);
  }

  public void processLinkStateUpdate(String interfaceName, Ipv4Address source, OspfLinkStateUpdate lsu) {
    processPacket(interfaceName, source, lsu);
  }

  public void processLinkStateAck(String interfaceName, Ipv4Address source, OspfLinkStateAck ack) {
    processPacket(interfaceName, source, ack);
  }

  /**
   * Fires KillNbr for one neighbor.
   *
   * @param interfaceName interface
   * @param neighborRouterId neighbor router ID
   * @return {@code true} when the neighbor existed
   */
  public boolean killNeighbor(String interfaceName, Ipv4Address neighborRouterId) {
    OspfInterface iface = interfaces.get(interfaceName);
    if (iface == null) {
      return false;
    }
    OspfNeighbor neighbor = iface.neighborMap().get(neighborRouterId);
    if (neighbor == null) {
      return false;
    }
    neighborEvent(iface, neighbor, NeighborEvent.KILL_NBR);
    drain();
    return true;
  }

  // --- Queries -----------------------------------------------------------------------------------------------

  public Optional<OspfInterface> getInterface(String name) {
    return Optional.ofNullable(interfaces.get(name));
  }

  /** @return active interfaces in activation order */
  public List<OspfInterface> getInterfaces() {
    return new ArrayList<>(interfaces.values());
  }

  public Optional<OspfNeighbor> getNeighbor(String interfaceName, Ipv4Address neighborRouterId) {
    OspfInterface iface = interfaces.get(interfaceName);
    return iface == null ? Optional.empty() : iface.neighbor(neighborRouterId);
  }

  /** @return neighbors of every interface */
  public List<OspfNeighbor> getNeighbors() {
    List<OspfNeighbor> out = new ArrayList<>();
    for (OspfInterface iface : interfaces.values()) {
      out.addAll(iface.neighbors());
    }
    return out;
  }

  public int neighborCount() {
    int count = 0;
    for (OspfInterface iface : interfaces.values()) {
      count += iface.neighborMap().size();
    }
    return count;
  }

  public int fullNeighborCount() {
    int count = 0;
    for (OspfInterface iface : interfaces.values()) {
      count += iface.fullNeighborCount();
    }
    return count;
  }

  /** @return the most recent {@value #EVENT_LOG_CAPACITY} transition lines, oldest first */
  public List<String> getEventLog() {
    return List.copyOf(eventLog);
  }

  public void clearEventLog() {
    eventLog.clear();
  }

  public LinkStateDatabase getLinkStateDatabase() {
    return lsdb;
  }

  /** @return routes of the last SPF run */
  public List<OspfRoute> getRoutes() {
    return routes;
  }

  /**
   * Runs SPF immediately for every area and publishes the result.
   *
   * @return computed routes
   */
  public List<OspfRoute> runSpf() {
    spfTimer.cancel();
    spfTimer = Cancellable.NONE;
    List<OspfRoute> computed = new ArrayList<>();
    for (Ipv4Address area : lsdb.areas()) {
      List<SpfCalculator.LocalLink> local = new ArrayList<>();
      for (OspfInterface iface : interfaces.values()) {
        if (iface.areaId().equals(area) && iface.state() != InterfaceState.DOWN) {
          local.add(new SpfCalculator.LocalLink(iface.name(), iface.address(), iface.mask()));
        }
      }
      computed.addAll(new SpfCalculator(routerId, area, lsdb.lsas(area), local).calculate());
    }
    routes = List.copyOf(computed);
    metrics.increment(settings.metricKey("spf.runs"));
    log.debug("{}: SPF computed {} routes", owner, routes.size());
    routeListener.accept(routes);
    return routes;
  }

  /**
   * Stops every timer and forgets all interfaces, neighbors, LSAs and routes.
   */
  public void shutdown() {
    for (OspfInterface iface : interfaces.values()) {
      iface.replaceHelloTimer(Cancellable.NONE);
      iface.replaceWaitTimer(Cancellable.NONE);
      for (OspfNeighbor neighbor : iface.neighbors()) {
        neighbor.timers().cancelAll();
        neighbor.clearLists();
        neighbor.markRemoved();
      }
      iface.neighborMap().clear();
      iface.setState(InterfaceState.DOWN);
    }
    spfTimer.cancel();
    spfTimer = Cancellable.NONE;
    interfaces.clear();
    lsdb.clear();
    outbox.clear();
    routes = List.of();
    routeListener.accept(routes);
    log.info("{}: OSPF process shut down", owner);
  }

  // --- Interface state machine -------------------------------------------------------------------------------

  private void interfaceUp(OspfInterface iface) {
    InterfaceState next;
    if (!iface.networkType().isMultiAccess()) {
      next = InterfaceState.POINT_TO_POINT;
    } else if (iface.priority() == 0) {
      next = InterfaceState.DR_OTHER;
    } else {
      next = InterfaceState.WAITING;
    }
    setInterfaceState(iface, next, InterfaceEvent.INTERFACE_UP);
    if (next == InterfaceState.WAITING) {
      iface.replaceWaitTimer(timers.schedule(iface.deadInterval() * 1000L, () -> onTimer(() -> {
        if (isActive(iface) && iface.state() == InterfaceState.WAITING) {
          runElection(iface, InterfaceEvent.WAIT_TIMER);
        }
      })));
    }
    if (!iface.isPassive()) {
      startHelloTimer(iface);
    }
    originateRouterLsa(iface.areaId());
  }

  private void setInterfaceState(OspfInterface iface, InterfaceState next, InterfaceEvent event) {
    InterfaceState old = iface.state();
    if (old == next) {
      return;
    }
    iface.setState(next);
    record("Interface " + iface.name() + ": " + old + " -> " + next + " (" + event + ")");
  }

  private void runElection(OspfInterface iface, InterfaceEvent event) {
    iface.replaceWaitTimer(Cancellable.NONE);
    DrElection.Candidate self = new DrElection.Candidate(routerId, iface.address(), iface.priority(),
        iface.designatedRouter(), iface.backupDesignatedRouter());
    List<DrElection.Candidate> others = new ArrayList<>();
    for (OspfNeighbor neighbor : iface.neighborMap().values()) {
      if (neighbor.state().isAtLeast(NeighborState.TWO_WAY)) {
        others.add(new DrElection.Candidate(neighbor.routerId(), neighbor.address(), neighbor.priority(),
            neighbor.declaredDr(), neighbor.declaredBdr()));
      }
    }
    DrElection.Result result = DrElection.elect(self, others);
    Ipv4Address oldDr = iface.designatedRouter();
    Ipv4Address oldBdr = iface.backupDesignatedRouter();
    iface.setDesignatedRouters(result.dr(), result.bdr());
    InterfaceState next;
    if (result.dr().equals(iface.address())) {
      next = InterfaceState.DR;
    } else if (result.bdr().equals(iface.address())) {
      next = InterfaceState.BACKUP;
    } else {
      next = InterfaceState.DR_OTHER;
    }
    setInterfaceState(iface, next, event);
    if (!oldDr.equals(result.dr()) || !oldBdr.equals(result.bdr())) {
      log.info("{}: {} elected DR {} BDR {}", owner, iface.name(), result.dr(), result.bdr());
      for (OspfNeighbor neighbor : iface.neighbors()) {
        if (neighbor.state().isAtLeast(NeighborState.TWO_WAY)) {
          neighborEvent(iface, neighbor, NeighborEvent.ADJ_OK);
        }
      }
      originateRouterLsa(iface.areaId());
    }
    maintainNetworkLsa(iface);
  }

  // --- Hello protocol ----------------------------------------------------------------------------------------

  private void startHelloTimer(OspfInterface iface) {
    long period = iface.helloInterval() * 1000L;
    sendHello(iface);
    iface.replaceHelloTimer(timers.scheduleAtFixedRate(period, period, () -> onTimer(() -> {
      if (isActive(iface) && !iface.isPassive()) {
        sendHello(iface);
      }
    })));
  }

  private void sendHello(OspfInterface iface) {
    List<Ipv4Address> seen = new ArrayList<>();
    for (OspfNeighbor neighbor : iface.neighborMap().values()) {
      if (neighbor.state().isAtLeast(NeighborState.INIT)) {
        seen.add(neighbor.routerId());
      }
    }
    OspfHello hello = new OspfHello(routerId, iface.areaId(), iface.mask(), iface.helloInterval(),
        OspfConstants.OPTIONS_E, iface.priority(), iface.deadInterval(), iface.designatedRouter(),
        iface.backupDesignatedRouter(), seen);
    if (iface.networkType() == NetworkType.NBMA) {
      for (OspfNeighbor neighbor : iface.neighborMap().values()) {
        send(iface, hello, neighbor.address());
      }
    } else {
      send(iface, hello, OspfConstants.ALL_SPF_ROUTERS);
    }
  }

  private void handleHello(String interfaceName, Ipv4Address source, OspfHello hello) {
    OspfInterface iface = interfaces.get(interfaceName);
    if (iface == null || iface.state() == InterfaceState.DOWN) {
      return;
    }
    if (iface.isPassive()) {
      log.debug("{}: ignoring Hello from {} on passive {}", owner, hello.routerId(), interfaceName);
      return;
    }
    if (!hello.areaId().equals(iface.areaId())) {
      rejectHello(iface, hello, "area " + hello.areaId() + " != " + iface.areaId());
      return;
    }
    if (iface.networkType() != NetworkType.POINT_TO_POINT && !hello.networkMask().equals(iface.mask())) {
      rejectHello(iface, hello, "mask " + hello.networkMask() + " != " + iface.mask());
      return;
    }
    if (hello.helloInterval() != iface.helloInterval() || hello.deadInterval() != iface.deadInterval()) {
      rejectHello(iface, hello, "timers " + hello.helloInterval() + "/" + hello.deadInterval() + " != "
          + iface.helloInterval() + "/" + iface.deadInterval());
      return;
    }

    OspfNeighbor neighbor = iface.neighborMap().get(hello.routerId());
    boolean created = neighbor == null;
    if (created) {
      neighbor = new OspfNeighbor(hello.routerId(), iface.name(), source, hello.priority());
      iface.neighborMap().put(hello.routerId(), neighbor);
    }
    NeighborState before = neighbor.state();
    int oldPriority = neighbor.priority();
    Ipv4Address oldDr = neighbor.declaredDr();
    Ipv4Address oldBdr = neighbor.declaredBdr();
    neighbor.updateFromHello(source, hello.priority(), hello.designatedRouter(), hello.backupDesignatedRouter());

    neighborEvent(iface, neighbor, NeighborEvent.HELLO_RECEIVED);
    if (hello.lists(routerId)) {
      neighborEvent(iface, neighbor, NeighborEvent.TWO_WAY_RECEIVED);
    } else {
      neighborEvent(iface, neighbor, NeighborEvent.ONE_WAY);
    }

    if (!iface.networkType().isMultiAccess()) {
      return;
    }
    boolean declaresDr = hello.designatedRouter().equals(source);
    boolean declaresBdr = hello.backupDesignatedRouter().equals(source);
    if (iface.state() == InterfaceState.WAITING
        && (declaresBdr || (declaresDr && hello.backupDesignatedRouter().isUnspecified()))) {
      runElection(iface, InterfaceEvent.BACKUP_SEEN);
      return;
    }
    boolean declarationChanged = !created
        && (oldPriority != hello.priority()
            || !oldDr.equals(hello.designatedRouter())
            || !oldBdr.equals(hello.backupDesignatedRouter()));
    boolean crossedTwoWay = before.isAtLeast(NeighborState.TWO_WAY)
        != neighbor.state().isAtLeast(NeighborState.TWO_WAY);
    if ((declarationChanged || crossedTwoWay) && iface.state().isElected()) {
      runElection(iface, InterfaceEvent.NEIGHBOR_CHANGE);
    }
  }

  private void rejectHello(OspfInterface iface, OspfHello hello, String reason) {
    metrics.increment(settings.metricKey("hello.rejected"));
    log.warn("{}: Hello from {} on {} rejected: {}", owner, hello.routerId(), iface.name(), reason);
  }

  // --- Neighbor state machine --------------------------------------------------------------------------------

  private void neighborEvent(OspfInterface iface, OspfNeighbor neighbor, NeighborEvent event) {
    if (neighbor.isRemoved()) {
      return;
    }
    NeighborState old = neighbor.state();
    switch (event) {
      case START -> {
        if (old == NeighborState.DOWN) {
          neighbor.setState(NeighborState.ATTEMPT);
          restartInactivity(iface, neighbor);
          sendHello(iface);
        }
      }
      case HELLO_RECEIVED -> {
        restartInactivity(iface, neighbor);
        if (old == NeighborState.DOWN || old == NeighborState.ATTEMPT) {
          neighbor.setState(NeighborState.INIT);
        }
      }
      case TWO_WAY_RECEIVED -> {
        if (old == NeighborState.INIT) {
          if (adjacencyWanted(iface, neighbor)) {
            startExStart(iface, neighbor);
          } else {
            neighbor.setState(NeighborState.TWO_WAY);
          }
        }
      }
      case NEGOTIATION_DONE -> {
        if (old == NeighborState.EXSTART) {
          neighbor.setState(NeighborState.EXCHANGE);
          neighbor.summaries().clear();
          neighbor.summaries().addAll(lsdb.headers(iface.areaId()));
          if (!neighbor.isMaster()) {
            neighbor.timers().cancelDdRetransmit();
          }
        }
      }
      case EXCHANGE_DONE -> {
        if (old == NeighborState.EXCHANGE) {
          neighbor.timers().cancelDdRetransmit();
          if (neighbor.requests().isEmpty()) {
            neighbor.setState(NeighborState.FULL);
          } else {
            neighbor.setState(NeighborState.LOADING);
            sendLinkStateRequest(iface, neighbor);
            startLsrRetransmit(iface, neighbor);
          }
        }
      }
      case LOADING_DONE -> {
        if (old == NeighborState.LOADING) {
          neighbor.setState(NeighborState.FULL);
        }
      }
      case ADJ_OK -> {
        boolean wanted = adjacencyWanted(iface, neighbor);
        if (old == NeighborState.TWO_WAY && wanted) {
          startExStart(iface, neighbor);
        } else if (old.isAtLeast(NeighborState.EXSTART) && !wanted) {
          neighbor.setState(NeighborState.TWO_WAY);
          neighbor.clearLists();
          neighbor.timers().cancelExchange();
        }
      }
      case SEQ_NUMBER_MISMATCH, BAD_LS_REQ -> {
        if (old.isAtLeast(NeighborState.EXCHANGE)) {
          log.debug("{}: {} with {} on {}", owner, event, neighbor.routerId(), iface.name());
          startExStart(iface, neighbor);
        }
      }
      case ONE_WAY -> {
        if (old.isAtLeast(NeighborState.TWO_WAY)) {
          neighbor.setState(NeighborState.INIT);
          neighbor.clearLists();
          neighbor.timers().cancelExchange();
        }
      }
      case KILL_NBR, LL_DOWN, INACTIVITY_TIMER -> {
        neighbor.timers().cancelAll();
        neighbor.clearLists();
        neighbor.setState(NeighborState.DOWN);
        neighbor.markRemoved();
        iface.neighborMap().remove(neighbor.routerId(), neighbor);
      }
      default -> throw new IllegalStateException("unhandled neighbor event " + event);
    }
    NeighborState next = neighbor.state();
    if (old != next) {
      record("Neighbor " + neighbor.routerId() + " (" + iface.name() + "): " + old + " -> " + next + " ("
          + event + ")");
      if (next == NeighborState.FULL) {
        neighbor.timers().cancelDdRetransmit();
        neighbor.timers().cancelLsrRetransmit();
        neighbor.summaries().clear();
      }
      if (next == NeighborState.FULL || old == NeighborState.FULL) {
        originateRouterLsa(iface.areaId());
        maintainNetworkLsa(iface);
        scheduleSpf();
      }
    }
    if (event.isTeardown()
        && old.isAtLeast(NeighborState.TWO_WAY)
        && iface.networkType().isMultiAccess()
        && iface.state().isElected()
        && isActive(iface)) {
      runElection(iface, InterfaceEvent.NEIGHBOR_CHANGE);
    }
  }

  private boolean adjacencyWanted(OspfInterface iface, OspfNeighbor neighbor) {
    if (!iface.networkType().isMultiAccess()) {
      return true;
    }
    if (iface.state() == InterfaceState.DR || iface.state() == InterfaceState.BACKUP) {
      return true;
    }
    return neighbor.address().equals(iface.designatedRouter())
        || neighbor.address().equals(iface.backupDesignatedRouter());
  }

  private void restartInactivity(OspfInterface iface, OspfNeighbor neighbor) {
    long delay = iface.deadInterval() * 1000L;
    neighbor.setInactivityDeadlineMillis(clock.nowMillis() + delay);
    neighbor.timers().replaceInactivity(timers.schedule(delay, () -> onTimer(() -> {
      if (!neighbor.isRemoved()) {
        log.info("{}: neighbor {} on {} dead after {}s", owner, neighbor.routerId(), iface.name(),
            iface.deadInterval());
        neighborEvent(iface, neighbor, NeighborEvent.INACTIVITY_TIMER);
      }
    })));
  }

  // --- Database exchange -------------------------------------------------------------------------------------

  private void startExStart(OspfInterface iface, OspfNeighbor neighbor) {
    neighbor.setState(NeighborState.EXSTART);
    neighbor.clearLists();
    neighbor.timers().cancelExchange();
    int sequence = neighbor.ddSequence() == 0
        ? Math.max(1, (int) (clock.nowMillis() / 1000L))
        : neighbor.ddSequence() + 1;
    neighbor.setDdSequence(sequence);
    neighbor.setMaster(true);
    neighbor.setLastReceivedDd(null);
    OspfDatabaseDescription initial = databaseDescription(iface,
        OspfConstants.DD_FLAG_INIT | OspfConstants.DD_FLAG_MORE | OspfConstants.DD_FLAG_MASTER, sequence, List.of());
    neighbor.setLastSentDd(initial);
    send(iface, initial, neighbor.address());
    long period = iface.retransmitInterval() * 1000L;
    neighbor.timers().replaceDdRetransmit(timers.scheduleAtFixedRate(period, period, () -> onTimer(() -> {
      if (neighbor.isRemoved()) {
        return;
      }
      NeighborState state = neighbor.state();
      boolean retransmitting = state == NeighborState.EXSTART
          || (state == NeighborState.EXCHANGE && neighbor.isMaster());
      if (!retransmitting) {
        neighbor.timers().cancelDdRetransmit();
        return;
      }
      neighbor.lastSentDd().ifPresent(dd -> {
        neighbor.countDdRetransmission();
        metrics.increment(settings.metricKey("retransmit.dd"));
        log.debug("{}: retransmitting DD seq {} to {}", owner, dd.sequence(), neighbor.routerId());
        send(iface, dd, neighbor.address());
      });
    })));
  }

  private void handleDatabaseDescription(String interfaceName, OspfDatabaseDescription dd) {
    OspfInterface iface = activeInterface(interfaceName, dd).orElse(null);
    if (iface == null) {
      return;
    }
    OspfNeighbor neighbor = iface.neighborMap().get(dd.routerId());
    if (neighbor == null) {
      log.debug("{}: DD from unknown neighbor {} on {}", owner, dd.routerId(), interfaceName);
      return;
    }
    if (neighbor.state() == NeighborState.INIT) {
      neighborEvent(iface, neighbor, NeighborEvent.TWO_WAY_RECEIVED);
    }
    switch (neighbor.state()) {
      case EXSTART -> negotiate(iface, neighbor, dd);
      case EXCHANGE -> exchange(iface, neighbor, dd);
      case LOADING, FULL -> {
        if (dd.isDuplicateOf(neighbor.lastReceivedDd().orElse(null))) {
          if (!neighbor.isMaster()) {
            neighbor.lastSentDd().ifPresent(last -> send(iface, last, neighbor.address()));
          }
        } else {
          neighborEvent(iface, neighbor, NeighborEvent.SEQ_NUMBER_MISMATCH);
        }
      }
      default -> log.debug("{}: DD from {} ignored in state {}", owner, dd.routerId(), neighbor.state());
    }
  }

  private void negotiate(OspfInterface iface, OspfNeighbor neighbor, OspfDatabaseDescription dd) {
    int order = dd.routerId().compareTo(routerId);
    if (dd.isInit() && dd.isMore() && dd.isMaster() && dd.headers().isEmpty() && order > 0) {
      neighbor.setMaster(false);
      neighbor.setDdSequence(dd.sequence());
      neighbor.setLastReceivedDd(dd);
      neighborEvent(iface, neighbor, NeighborEvent.NEGOTIATION_DONE);
      slaveRespond(iface, neighbor, dd);
    } else if (!dd.isInit() && !dd.isMaster() && dd.sequence() == neighbor.ddSequence() && order < 0) {
      neighbor.setMaster(true);
      neighbor.setLastReceivedDd(dd);
      neighborEvent(iface, neighbor, NeighborEvent.NEGOTIATION_DONE);
      if (acceptHeaders(iface, neighbor, dd)) {
        masterAdvance(iface, neighbor, dd);
      }
    } else {
      log.debug("{}: DD from {} does not settle negotiation (flags {}, seq {})", owner, dd.routerId(),
          dd.flags(), dd.sequence());
    }
  }

  private void exchange(OspfInterface iface, OspfNeighbor neighbor, OspfDatabaseDescription dd) {
    if (dd.isDuplicateOf(neighbor.lastReceivedDd().orElse(null))) {
      if (!neighbor.isMaster()) {
        neighbor.lastSentDd().ifPresent(last -> send(iface, last, neighbor.address()));
      }
      return;
    }
    int expected = neighbor.isMaster() ? neighbor.ddSequence() : neighbor.ddSequence() + 1;
    if (dd.isMaster() == neighbor.isMaster() || dd.isInit() || dd.sequence() != expected) {
      neighborEvent(iface, neighbor, NeighborEvent.SEQ_NUMBER_MISMATCH);
      return;
    }
    neighbor.setLastReceivedDd(dd);
    if (!acceptHeaders(iface, neighbor, dd)) {
      return;
    }
    if (neighbor.isMaster()) {
      masterAdvance(iface, neighbor, dd);
    } else {
      neighbor.setDdSequence(dd.sequence());
      slaveRespond(iface, neighbor, dd);
    }
  }

  private boolean acceptHeaders(OspfInterface iface, OspfNeighbor neighbor, OspfDatabaseDescription dd) {
    for (LsaHeader header : dd.headers()) {
      if (LsaType.fromCode(header.type()).isEmpty()) {
        neighborEvent(iface, neighbor, NeighborEvent.SEQ_NUMBER_MISMATCH);
        return false;
      }
      Optional<Lsa> existing = lsdb.lookup(iface.areaId(), header.key());
      if (existing.isEmpty() || header.compareInstance(existing.get().header()) > 0) {
        neighbor.requests().put(header.key(), header);
      }
    }
    return true;
  }

  private void masterAdvance(OspfInterface iface, OspfNeighbor neighbor, OspfDatabaseDescription received) {
    boolean sentEverything = neighbor.lastSentDd().map(last -> !last.isMore()).orElse(false);
    neighbor.setDdSequence(neighbor.ddSequence() + 1);
    if (sentEverything && !received.isMore()) {
      neighborEvent(iface, neighbor, NeighborEvent.EXCHANGE_DONE);
    } else {
      sendNextSummary(iface, neighbor);
    }
  }

  private void slaveRespond(OspfInterface iface, OspfNeighbor neighbor, OspfDatabaseDescription received) {
    OspfDatabaseDescription sent = sendNextSummary(iface, neighbor);
    if (!received.isMore() && !sent.isMore()) {
      neighborEvent(iface, neighbor, NeighborEvent.EXCHANGE_DONE);
    }
  }

  private OspfDatabaseDescription sendNextSummary(OspfInterface iface, OspfNeighbor neighbor) {
    List<LsaHeader> chunk = new ArrayList<>();
    while (chunk.size() < OspfConstants.MAX_DD_HEADERS && !neighbor.summaries().isEmpty()) {
      chunk.add(neighbor.summaries().poll());
    }
    int flags = (neighbor.summaries().isEmpty() ? 0 : OspfConstants.DD_FLAG_MORE)
        | (neighbor.isMaster() ? OspfConstants.DD_FLAG_MASTER : 0);
    OspfDatabaseDescription dd = databaseDescription(iface, flags, neighbor.ddSequence(), chunk);
    neighbor.setLastSentDd(dd);
    send(iface, dd, neighbor.address());
    return dd;
  }

  private OspfDatabaseDescription databaseDescription(OspfInterface iface, int flags, int sequence,
      List<LsaHeader> headers) {
    return new OspfDatabaseDescription(routerId, iface.areaId(), OspfConstants.DEFAULT_MTU, OspfConstants.OPTIONS_E,
        flags, sequence, headers);
  }

  // --- Requests, updates and acknowledgments -----------------------------------------------------------------

  private void sendLinkStateRequest(OspfInterface iface, OspfNeighbor neighbor) {
    List<LsaKey> keys = new ArrayList<>();
    for (LsaKey key : neighbor.requests().keySet()) {
      if (keys.size() == OspfConstants.MAX_LSR_KEYS) {
        break;
      }
      keys.add(key);
    }
    if (keys.isEmpty()) {
      return;
    }
    neighbor.outstandingRequests().clear();
    neighbor.outstandingRequests().addAll(keys);
    send(iface, new OspfLinkStateRequest(routerId, iface.areaId(), keys), neighbor.address());
  }

  private void startLsrRetransmit(OspfInterface iface, OspfNeighbor neighbor) {
    long period = iface.retransmitInterval() * 1000L;
    neighbor.timers().replaceLsrRetransmit(timers.scheduleAtFixedRate(period, period, () -> onTimer(() -> {
      if (neighbor.isRemoved()) {
        return;
      }
      if (neighbor.state() != NeighborState.LOADING || neighbor.requests().isEmpty()) {
        neighbor.timers().cancelLsrRetransmit();
        return;
      }
      neighbor.countLsrRetransmission();
      metrics.increment(settings.metricKey("retransmit.lsr"));
      log.debug("{}: retransmitting LSR to {}", owner, neighbor.routerId());
      sendLinkStateRequest(iface, neighbor);
    })));
  }

  private void handleLinkStateRequest(String interfaceName, OspfLinkStateRequest lsr) {
    OspfInterface iface = activeInterface(interfaceName, lsr).orElse(null);
    if (iface == null) {
      return;
    }
    OspfNeighbor neighbor = iface.neighborMap().get(lsr.routerId());
    if (neighbor == null || !neighbor.state().isSynchronizing()) {
      return;
    }
    List<Lsa> found = new ArrayList<>();
    for (LsaKey key : lsr.requests()) {
      Optional<Lsa> lsa = lsdb.lookup(iface.areaId(), key);
      if (lsa.isEmpty()) {
        log.debug("{}: {} requested unknown LSA {}", owner, neighbor.routerId(), key);
        neighborEvent(iface, neighbor, NeighborEvent.BAD_LS_REQ);
        return;
      }
      found.add(lsa.get());
    }
    if (!found.isEmpty()) {
      send(iface, new OspfLinkStateUpdate(routerId, iface.areaId(), found), neighbor.address());
    }
  }

  private void handleLinkStateUpdate(String interfaceName, OspfLinkStateUpdate lsu) {
    OspfInterface iface = activeInterface(interfaceName, lsu).orElse(null);
    if (iface == null) {
      return;
    }
    OspfNeighbor neighbor = iface.neighborMap().get(lsu.routerId());
    if (neighbor == null || !neighbor.state().isSynchronizing()) {
      return;
    }
    Ipv4Address area = iface.areaId();
    List<LsaHeader> acks = new ArrayList<>();
    boolean changed = false;
    for (Lsa lsa : lsu.lsas()) {
      LsaHeader header = lsa.header();
      if (LsaType.fromCode(header.type()).isEmpty()) {
        continue;
      }
      if (!LsaChecksum.verify(lsa)) {
        metrics.increment(settings.metricKey("lsu.rejected"));
        log.warn("{}: discarding {} from {}: bad LSA checksum", owner, header.key(), neighbor.routerId());
        continue;
      }
      Optional<Lsa> existing = lsdb.lookup(area, header.key());
      if (header.isMaxAge() && existing.isEmpty() && !anyNeighborSynchronizing()) {
        acks.add(header);
        continue;
      }
      if (existing.isEmpty() || header.compareInstance(existing.get().header()) > 0) {
        neighbor.requests().remove(header.key());
        lsdb.install(area, lsa);
        removeFromRetransmissionLists(header.key());
        changed = true;
        acks.add(header);
        if (isSelfOriginated(lsa)) {
          log.info("{}: received newer self-originated {}, re-originating", owner, header.key());
          reoriginate(iface, lsa);
        } else {
          flood(area, lsa, iface, neighbor);
        }
        continue;
      }
      if (neighbor.requests().containsKey(header.key())) {
        neighborEvent(iface, neighbor, NeighborEvent.BAD_LS_REQ);
        return;
      }
      int order = header.compareInstance(existing.get().header());
      if (order == 0) {
        Lsa pending = neighbor.retransmissions().get(header.key());
        if (pending != null && pending.header().compareInstance(header) == 0) {
          neighbor.retransmissions().remove(header.key());
        } else {
          acks.add(header);
        }
      } else {
        send(iface, new OspfLinkStateUpdate(routerId, area, List.of(existing.get())), neighbor.address());
      }
    }
    if (!acks.isEmpty()) {
      send(iface, new OspfLinkStateAck(routerId, area, acks), neighbor.address());
    }
    if (neighbor.state() == NeighborState.LOADING) {
      if (neighbor.requests().isEmpty()) {
        neighborEvent(iface, neighbor, NeighborEvent.LOADING_DONE);
      } else if (!anyOutstanding(neighbor)) {
        sendLinkStateRequest(iface, neighbor);
      }
    }
    if (changed) {
      scheduleSpf();
    }
  }

  private void handleLinkStateAck(String interfaceName, OspfLinkStateAck ack) {
    OspfInterface iface = activeInterface(interfaceName, ack).orElse(null);
    if (iface == null) {
      return;
    }
    OspfNeighbor neighbor = iface.neighborMap().get(ack.routerId());
    if (neighbor == null || !neighbor.state().isSynchronizing()) {
      return;
    }
    for (LsaHeader header : ack.headers()) {
      Lsa pending = neighbor.retransmissions().get(header.key());
      if (pending != null && pending.header().compareInstance(header) == 0) {
        neighbor.retransmissions().remove(header.key());
      }
    }
    if (neighbor.retransmissions().isEmpty()) {
      neighbor.timers().cancelLsuRetransmit();
    }
  }

  private static boolean anyOutstanding(OspfNeighbor neighbor) {
    for (LsaKey key : neighbor.outstandingRequests()) {
      if (neighbor.requests().containsKey(key)) {
        return true;
      }
    }
    return false;
  }

  private boolean anyNeighborSynchronizing() {
    for (OspfInterface iface : interfaces.values()) {
      for (OspfNeighbor neighbor : iface.neighborMap().values()) {
        if (neighbor.state() == NeighborState.EXCHANGE || neighbor.state() == NeighborState.LOADING) {
          return true;
        }
      }
    }
    return false;
  }

  private void removeFromRetransmissionLists(LsaKey key) {
    for (OspfInterface iface : interfaces.values()) {
      for (OspfNeighbor neighbor : iface.neighborMap().values()) {
        neighbor.retransmissions().remove(key);
      }
    }
  }

  // --- Flooding ----------------------------------------------------------------------------------------------

  private void flood(Ipv4Address area, Lsa lsa, OspfInterface fromInterface, OspfNeighbor fromNeighbor) {
    for (OspfInterface iface : interfaces.values()) {
      if (!iface.areaId().equals(area) || iface.isPassive() || iface.state() == InterfaceState.DOWN) {
        continue;
      }
      List<OspfNeighbor> targets = new ArrayList<>();
      for (OspfNeighbor neighbor : iface.neighborMap().values()) {
        if (neighbor == fromNeighbor || !neighbor.state().isSynchronizing()) {
          continue;
        }
        LsaHeader requested = neighbor.requests().get(lsa.key());
        if (requested != null) {
          int order = lsa.header().compareInstance(requested);
          if (order < 0) {
            continue;
          }
          neighbor.requests().remove(lsa.key());
          if (order == 0) {
            continue;
          }
        }
        neighbor.retransmissions().put(lsa.key(), lsa);
        ensureLsuRetransmit(iface, neighbor);
        targets.add(neighbor);
      }
      if (targets.isEmpty()) {
        continue;
      }
      if (iface == fromInterface && fromNeighbor != null && iface.networkType().isMultiAccess()
          && (fromNeighbor.address().equals(iface.designatedRouter())
              || fromNeighbor.address().equals(iface.backupDesignatedRouter())
              || iface.state() == InterfaceState.BACKUP)) {
        continue;
      }
      OspfLinkStateUpdate update = new OspfLinkStateUpdate(routerId, area, List.of(lsa));
      if (iface.networkType() == NetworkType.NBMA || iface.networkType() == NetworkType.POINT_TO_MULTIPOINT) {
        for (OspfNeighbor neighbor : targets) {
          send(iface, update, neighbor.address());
        }
      } else if (iface.networkType() == NetworkType.BROADCAST && iface.state() == InterfaceState.DR_OTHER) {
        send(iface, update, OspfConstants.ALL_D_ROUTERS);
      } else {
        send(iface, update, OspfConstants.ALL_SPF_ROUTERS);
      }
    }
  }

  private void ensureLsuRetransmit(OspfInterface iface, OspfNeighbor neighbor) {
    if (neighbor.timers().lsuRetransmitActive()) {
      return;
    }
    long period = iface.retransmitInterval() * 1000L;
    neighbor.timers().replaceLsuRetransmit(timers.scheduleAtFixedRate(period, period, () -> onTimer(() -> {
      if (neighbor.isRemoved()) {
        return;
      }
      if (neighbor.retransmissions().isEmpty() || !neighbor.state().isSynchronizing()) {
        neighbor.timers().cancelLsuRetransmit();
        return;
      }
      neighbor.countLsuRetransmission();
      metrics.increment(settings.metricKey("retransmit.lsu"));
      send(iface, new OspfLinkStateUpdate(routerId, iface.areaId(), neighbor.retransmissionList()),
          neighbor.address());
    })));
  }

  // --- Origination -------------------------------------------------------------------------------------------

  private void originateRouterLsa(Ipv4Address area) {
    List<RouterLink> links = new ArrayList<>();
    Set<Ipv4Address> spanned = new HashSet<>();
    for (OspfInterface iface : interfaces.values()) {
      if (iface.state() == InterfaceState.DOWN) {
        continue;
      }
      spanned.add(iface.areaId());
      if (!iface.areaId().equals(area)) {
        continue;
      }
      Ipv4Address maskAsAddress = iface.mask().asAddress();
      if (iface.isPassive()) {
        links.add(new RouterLink(iface.network(), maskAsAddress, RouterLinkType.STUB, iface.cost()));
      } else if (!iface.networkType().isMultiAccess()) {
        for (OspfNeighbor neighbor : iface.neighborMap().values()) {
          if (neighbor.state() == NeighborState.FULL) {
            links.add(new RouterLink(neighbor.routerId(), iface.address(), RouterLinkType.POINT_TO_POINT,
                iface.cost()));
          }
        }
        links.add(new RouterLink(iface.network(), maskAsAddress, RouterLinkType.STUB, iface.cost()));
      } else if (isTransit(iface)) {
        links.add(new RouterLink(iface.designatedRouter(), iface.address(), RouterLinkType.TRANSIT, iface.cost()));
      } else {
        links.add(new RouterLink(iface.network(), maskAsAddress, RouterLinkType.STUB, iface.cost()));
      }
    }
    int flags = spanned.size() > 1 ? OspfConstants.ROUTER_FLAG_B : 0;
    LsaKey key = new LsaKey(LsaType.ROUTER.code(), routerId, routerId);
    RouterLsa lsa = RouterLsa.originate(routerId, nextSequence(area, key), flags, links);
    lsdb.install(area, lsa);
    log.debug("{}: originated Router-LSA seq 0x{} with {} links in area {}", owner,
        Integer.toHexString(lsa.header().sequence()), links.size(), area);
    flood(area, lsa, null, null);
    scheduleSpf();
  }

  private boolean isTransit(OspfInterface iface) {
    if (iface.state() == InterfaceState.WAITING || iface.designatedRouter().isUnspecified()) {
      return false;
    }
    if (iface.state() == InterfaceState.DR) {
      return iface.fullNeighborCount() > 0;
    }
    for (OspfNeighbor neighbor : iface.neighborMap().values()) {
      if (neighbor.address().equals(iface.designatedRouter()) && neighbor.state() == NeighborState.FULL) {
        return true;
      }
    }
    return false;
  }

  private void maintainNetworkLsa(OspfInterface iface) {
    if (!iface.networkType().isMultiAccess()) {
      return;
    }
    if (iface.state() != InterfaceState.DR || iface.fullNeighborCount() == 0) {
      flushNetworkLsa(iface);
      return;
    }
    List<Ipv4Address> attached = new ArrayList<>();
    attached.add(routerId);
    for (OspfNeighbor neighbor : iface.neighborMap().values()) {
      if (neighbor.state() == NeighborState.FULL) {
        attached.add(neighbor.routerId());
      }
    }
    LsaKey key = new LsaKey(LsaType.NETWORK.code(), iface.address(), routerId);
    NetworkLsa lsa = NetworkLsa.originate(iface.address(), routerId, nextSequence(iface.areaId(), key),
        iface.mask(), attached);
    lsdb.install(iface.areaId(), lsa);
    log.debug("{}: originated Network-LSA for {} with {} routers", owner, iface.name(), attached.size());
    flood(iface.areaId(), lsa, null, null);
    scheduleSpf();
  }

  private void flushNetworkLsa(OspfInterface iface) {
    LsaKey key = new LsaKey(LsaType.NETWORK.code(), iface.address(), routerId);
    Optional<Lsa> existing = lsdb.lookup(iface.areaId(), key);
    if (existing.isEmpty() || existing.get().header().isMaxAge()) {
      return;
    }
    Lsa flushed = existing.get().withAge(OspfConstants.MAX_AGE_SECONDS);
    lsdb.install(iface.areaId(), flushed);
    log.debug("{}: flushing Network-LSA for {}", owner, iface.name());
    flood(iface.areaId(), flushed, null, null);
    scheduleSpf();
  }

  private boolean isSelfOriginated(Lsa lsa) {
    if (lsa.header().advertisingRouter().equals(routerId)) {
      return true;
    }
    if (lsa.header().type() == LsaType.NETWORK.code()) {
      for (OspfInterface iface : interfaces.values()) {
        if (iface.address().equals(lsa.header().linkStateId())) {
          return true;
        }
      }
    }
    return false;
  }

  private void reoriginate(OspfInterface receivedOn, Lsa received) {
    if (received.header().type() == LsaType.ROUTER.code()) {
      originateRouterLsa(receivedOn.areaId());
      return;
    }
    for (OspfInterface iface : interfaces.values()) {
      if (iface.address().equals(received.header().linkStateId())) {
        maintainNetworkLsa(iface);
        return;
      }
    }
    if (!received.header().isMaxAge()) {
      Lsa flushed = received.withAge(OspfConstants.MAX_AGE_SECONDS);
      lsdb.install(receivedOn.areaId(), flushed);
      flood(receivedOn.areaId(), flushed, null, null);
    }
  }

  private int nextSequence(Ipv4Address area, LsaKey key) {
    Optional<Lsa> existing = lsdb.lookup(area, key);
    if (existing.isEmpty()) {
      return OspfConstants.INITIAL_SEQUENCE_NUMBER;
    }
    int current = existing.get().header().sequence();
    // TODO: flush and restart at InitialSequenceNumber instead of wrapping once MaxSequenceNumber is reached
    return current == OspfConstants.MAX_SEQUENCE_NUMBER ? OspfConstants.INITIAL_SEQUENCE_NUMBER : current + 1;
  }

  private void scheduleSpf() {
    if (!spfTimer.isCancelled()) {
      return;
    }
    spfTimer = timers.schedule(OspfConstants.SPF_DELAY_MILLIS, () -> onTimer(this::runSpf));
  }

  // --- Plumbing ----------------------------------------------------------------------------------------------

  private Optional<OspfInterface> activeInterface(String interfaceName, OspfPacket packet) {
    OspfInterface iface = interfaces.get(interfaceName);
    if (iface == null || iface.state() == InterfaceState.DOWN || iface.isPassive()) {
      return Optional.empty();
    }
    if (!packet.areaId().equals(iface.areaId())) {
      log.debug("{}: {} from {} for area {} ignored on {}", owner, packet.packetType(), packet.routerId(),
          packet.areaId(), interfaceName);
      return Optional.empty();
    }
    return Optional.of(iface);
  }

  private OspfInterface requireInterface(String name) {
    OspfInterface iface = interfaces.get(name);
    if (iface == null) {
      throw new IllegalArgumentException("OSPF is not enabled on interface: " + name);
    }
    return iface;
  }

  private boolean isActive(OspfInterface iface) {
    return interfaces.get(iface.name()) == iface;
  }

  private void record(String line) {
    if (eventLog.size() == EVENT_LOG_CAPACITY) {
      eventLog.removeFirst();
    }
    eventLog.addLast(line);
    log.info("{}: {}", owner, line);
    eventListener.accept(line);
  }

  private void send(OspfInterface iface, OspfPacket packet, Ipv4Address destination) {
    outbox.add(new Outbound(iface.name(), packet, destination));
  }

  private void onTimer(Runnable action) {
    action.run();
    drain();
  }

  private void drain() {
    if (draining) {
      return;
    }
    draining = true;
    try {
      Outbound next;
      while ((next = outbox.poll()) != null) {
        sender.send(next.interfaceName(), next.packet(), next.destination());
      }
    } finally {
      draining = false;
    }
  }
}
