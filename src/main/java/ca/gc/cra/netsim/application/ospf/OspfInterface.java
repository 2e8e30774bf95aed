package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.application.port.Cancellable;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.ospf.InterfaceState;
import ca.gc.cra.netsim.domain.ospf.NeighborState;
import ca.gc.cra.netsim.domain.ospf.NetworkType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One router interface taking part in OSPF, with its neighbors keyed by router ID.
 * <p><strong>Role:</strong> Owned by {@link OspfEngine}; DR and BDR are identified by interface address.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class OspfInterface {
  private final String name;
  private final Ipv4Address address;
  private final SubnetMask mask;
  private final Ipv4Address areaId;
  private final NetworkType networkType;
  private final int helloInterval;
  private final int deadInterval;
  private final int retransmitInterval;
  private int priority;
  private int cost;
  private boolean passive;

  private InterfaceState state = InterfaceState.DOWN;
  private Ipv4Address dr = Ipv4Address.ANY;
  private Ipv4Address bdr = Ipv4Address.ANY;
  private final Map<Ipv4Address, OspfNeighbor> neighbors = new LinkedHashMap<>();
  private Cancellable helloTimer = Cancellable.NONE;
  private Cancellable waitTimer = Cancellable.NONE;

  OspfInterface(
      String name,
      Ipv4Address address,
      SubnetMask mask,
      Ipv4Address areaId,
      NetworkType networkType,
      int helloInterval,
      int deadInterval,
      int retransmitInterval,
      int priority,
      int cost,
      boolean passive) {
    this.name = Objects.requireNonNull(name, "name");
    this.address = Objects.requireNonNull(address, "address");
    this.mask = Objects.requireNonNull(mask, "mask");
    this.areaId = Objects.requireNonNull(areaId, "areaId");
    this.networkType = Objects.requireNonNull(networkType, "networkType");
    this.helloInterval = helloInterval;
    this.deadInterval = deadInterval;
    this.retransmitInterval = retransmitInterval;
    this.priority = priority;
    this.cost = cost;
    this.passive = passive;
  }

  public String name() {
    return name;
  }

  public Ipv4Address address() {
    return address;
  }

  public SubnetMask mask() {
    return mask;
  }

  public Ipv4Address network() {
    return address.network(mask);
  }

  public Ipv4Address areaId() {
    return areaId;
  }

  public NetworkType networkType() {
    return networkType;
  }

  public int helloInterval() {
    return helloInterval;
  }

  public int deadInterval() {
    return deadInterval;
  }

  public int retransmitInterval() {
    return retransmitInterval;
  }

  public int priority() {
    return priority;
  }

  public int cost() {
    return cost;
  }

  public boolean isPassive() {
    return passive;
  }

  public InterfaceState state() {
    return state;
  }

  /** @return DR interface address, or {@code 0.0.0.0} when none is elected */
  public Ipv4Address designatedRouter() {
    return dr;
  }

  /** @return BDR interface address, or {@code 0.0.0.0} when none is elected */
  public Ipv4Address backupDesignatedRouter() {
    return bdr;
  }

  /** @return neighbors in discovery order */
  public List<OspfNeighbor> neighbors() {
    return new ArrayList<>(neighbors.values());
  }

  public Optional<OspfNeighbor> neighbor(Ipv4Address routerId) {
    return Optional.ofNullable(neighbors.get(routerId));
  }

  /** @return number of neighbors in state Full */
  public int fullNeighborCount() {
    int count = 0;
    for (OspfNeighbor neighbor : neighbors.values()) {
      if (neighbor.state() == NeighborState.FULL) {
        count++;
      }
    }
    return count;
  }

  Map<Ipv4Address, OspfNeighbor> neighborMap() {
    return neighbors;
  }

  void setState(InterfaceState next) {
    this.state = next;
  }

  void setDesignatedRouters(Ipv4Address newDr, Ipv4Address newBdr) {
    this.dr = newDr;
    this.bdr = newBdr;
  }

  void setPriority(int newPriority) {
    this.priority = newPriority;
  }

  void setCost(int newCost) {
    this.cost = newCost;
  }

  void setPassive(boolean isPassive) {
    this.passive = isPassive;
  }

  void replaceHelloTimer(Cancellable next) {
    helloTimer.cancel();
    helloTimer = next;
  }

  void replaceWaitTimer(Cancellable next) {
    waitTimer.cancel();
    waitTimer = next;
  }

  @Override
  public String toString() {
    return "OspfInterface{" + name + " " + address + "/" + mask.prefixLength() + " area " + areaId
        + ", " + networkType + ", state=" + state + ", dr=" + dr + ", bdr=" + bdr + '}';
  }
}
