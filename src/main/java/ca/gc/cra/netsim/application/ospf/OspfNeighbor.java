package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.ospf.Lsa;
import ca.gc.cra.netsim.domain.ospf.LsaHeader;
import ca.gc.cra.netsim.domain.ospf.LsaKey;
import ca.gc.cra.netsim.domain.ospf.NeighborState;
import ca.gc.cra.netsim.domain.ospf.OspfDatabaseDescription;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> The conversation with one neighboring router on one interface (RFC 2328 §10).
 * <p><strong>Role:</strong> Created by the engine on the first Hello (or by configuration on NBMA networks) and
 * discarded for good on teardown; a removed neighbor is never revived, a later Hello creates a fresh one.</p>
 * <p><strong>Master flag:</strong> {@link #isMaster()} reports whether the <em>local</em> router is master of the
 * database exchange with this neighbor.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; mutated by the owning engine on the simulation thread.</p>
 *
 * @since 0.1.0
 */
public final class OspfNeighbor {
  private final Ipv4Address routerId;
  private final String interfaceName;
  private final NeighborTimers timers = new NeighborTimers();

  private Ipv4Address address;
  private int priority;
  private Ipv4Address declaredDr = Ipv4Address.ANY;
  private Ipv4Address declaredBdr = Ipv4Address.ANY;
  private NeighborState state = NeighborState.DOWN;
  private boolean master;
  private int ddSequence;
  private long inactivityDeadlineMillis;
  private OspfDatabaseDescription lastSentDd;
  private OspfDatabaseDescription lastReceivedDd;
  private boolean removed;

  private final Map<LsaKey, LsaHeader> requestList = new LinkedHashMap<>();
  private final Set<LsaKey> outstandingRequests = new LinkedHashSet<>();
  private final Map<LsaKey, Lsa> retransmissionList = new LinkedHashMap<>();
  private final Deque<LsaHeader> summaryList = new ArrayDeque<>();

  private long ddRetransmissions;
  private long lsrRetransmissions;
  private long lsuRetransmissions;

  OspfNeighbor(Ipv4Address routerId, String interfaceName, Ipv4Address address, int priority) {
    this.routerId = Objects.requireNonNull(routerId, "routerId");
    this.interfaceName = Objects.requireNonNull(interfaceName, "interfaceName");
    this.address = Objects.requireNonNull(address, "address");
    this.priority = priority;
  }

  public Ipv4Address routerId() {
    return routerId;
  }

  public String interfaceName() {
    return interfaceName;
  }

  /** @return the neighbor's interface address, the source of its Hellos */
  public Ipv4Address address() {
    return address;
  }

  public int priority() {
    return priority;
  }

  public Ipv4Address declaredDr() {
    return declaredDr;
  }

  public Ipv4Address declaredBdr() {
    return declaredBdr;
  }

  public NeighborState state() {
    return state;
  }

  /** @return {@code true} when the local router is master of the exchange with this neighbor */
  public boolean isMaster() {
    return master;
  }

  public int ddSequence() {
    return ddSequence;
  }

  /** @return simulation time at which the inactivity timer fires unless another Hello arrives */
  public long inactivityDeadlineMillis() {
    return inactivityDeadlineMillis;
  }

  public Optional<OspfDatabaseDescription> lastSentDd() {
    return Optional.ofNullable(lastSentDd);
  }

  public Optional<OspfDatabaseDescription> lastReceivedDd() {
    return Optional.ofNullable(lastReceivedDd);
  }

  /** @return {@code true} once torn down; timers for a removed neighbor do nothing */
  public boolean isRemoved() {
    return removed;
  }

  /** @return LSAs still to be requested or awaiting an update, oldest first */
  public List<LsaHeader> requestList() {
    return List.copyOf(requestList.values());
  }

  /** @return LSAs flooded to this neighbor and not yet acknowledged */
  public List<Lsa> retransmissionList() {
    return List.copyOf(retransmissionList.values());
  }

  /** @return headers not yet sent in the current database exchange */
  public List<LsaHeader> summaryList() {
    return new ArrayList<>(summaryList);
  }

  public long ddRetransmissions() {
    return ddRetransmissions;
  }

  public long lsrRetransmissions() {
    return lsrRetransmissions;
  }

  public long lsuRetransmissions() {
    return lsuRetransmissions;
  }

  NeighborTimers timers() {
    return timers;
  }

  void updateFromHello(Ipv4Address source, int helloPriority, Ipv4Address dr, Ipv4Address bdr) {
    this.address = source;
    this.priority = helloPriority;
    this.declaredDr = dr;
    this.declaredBdr = bdr;
  }

  void setState(NeighborState next) {
    this.state = next;
  }

  void setMaster(boolean localIsMaster) {
    this.master = localIsMaster;
  }

  void setDdSequence(int sequence) {
    this.ddSequence = sequence;
  }

  void setInactivityDeadlineMillis(long deadline) {
    this.inactivityDeadlineMillis = deadline;
  }

  void setLastSentDd(OspfDatabaseDescription dd) {
    this.lastSentDd = dd;
  }

  void setLastReceivedDd(OspfDatabaseDescription dd) {
    this.lastReceivedDd = dd;
  }

  void markRemoved() {
    this.removed = true;
  }

  Map<LsaKey, LsaHeader> requests() {
    return requestList;
  }

  Set<LsaKey> outstandingRequests() {
    return outstandingRequests;
  }

  Map<LsaKey, Lsa> retransmissions() {
    return retransmissionList;
  }

  Deque<LsaHeader> summaries() {
    return summaryList;
  }

  void clearLists() {
    requestList.clear();
    outstandingRequests.clear();
    retransmissionList.clear();
    summaryList.clear();
  }

  void countDdRetransmission() {
    ddRetransmissions++;
  }

  void countLsrRetransmission() {
    lsrRetransmissions++;
  }

  void countLsuRetransmission() {
    lsuRetransmissions++;
  }

  @Override
  public String toString() {
    return "OspfNeighbor{" + routerId + " via " + interfaceName + " (" + address + "), state=" + state
        + ", master=" + master + '}';
  }
}
