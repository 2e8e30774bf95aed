package ca.gc.cra.netsim.application.device;

import ca.gc.cra.netsim.application.port.Cancellable;
import ca.gc.cra.netsim.application.sim.SimulationContext;
import ca.gc.cra.netsim.domain.l2.ForwardAction;
import ca.gc.cra.netsim.domain.l2.ForwardingDecision;
import ca.gc.cra.netsim.domain.l2.MacTable;
import ca.gc.cra.netsim.domain.l2.SwitchPortConfig;
import ca.gc.cra.netsim.domain.l2.SwitchPortMode;
import ca.gc.cra.netsim.domain.l2.Vlan;
import ca.gc.cra.netsim.domain.net.EthernetFrame;
import ca.gc.cra.netsim.domain.net.MacAddress;
import ca.gc.cra.netsim.domain.net.VlanTag;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> MAC-learning Ethernet switch with 802.1Q access and trunk ports and a VLAN database.
 * <p><strong>Why:</strong> Hosts and routers on one segment reach each other through it; flooding, learning and VLAN
 * isolation are observable through {@link #onFrameForward(Consumer)}.</p>
 * <p><strong>Role:</strong> Device; ports are named {@code FastEthernet0/1} onwards and start as access ports in
 * VLAN 1.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven by the simulation thread.</p>
 * <p><strong>Observability:</strong> {@code <prefix>.switch.flooded}, {@code .forwarded} and {@code .dropped};
 * MAC learning at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class Switch extends NetworkDevice {
  private static final Logger log = LoggerFactory.getLogger(Switch.class);
  /** Port count of the default chassis. */
  public static final int DEFAULT_PORT_COUNT = 24;

  private final MacTable macTable;
  private final Map<String, SwitchPortConfig> portConfigs = new HashMap<>();
  private final TreeMap<Integer, Vlan> vlans = new TreeMap<>();
  private final List<Consumer<ForwardingDecision>> listeners = new ArrayList<>();
  private final Cancellable agingSweep;

  /**
   * Creates a switch with {@value #DEFAULT_PORT_COUNT} ports.
   *
   * @param name device name
   * @param context owning simulation
   */
  public Switch(String name, SimulationContext context) {
    this(name, context, DEFAULT_PORT_COUNT);
  }

  /**
   * Creates a switch.
   *
   * @param name device name
   * @param context owning simulation
   * @param portCount number of ports, 1-48
   */
  public Switch(String name, SimulationContext context, int portCount) {
    super(name, context);
    Numbers.requireRange("portCount", portCount, 1, 48);
    this.macTable = new MacTable(context.config().macAgingSeconds(), context.config().macTableCapacity());
    for (int i = 1; i <= portCount; i++) {
      String portName = "FastEthernet0/" + i;
      addPort(portName);
      portConfigs.put(portName, SwitchPortConfig.DEFAULT);
    }
    vlans.put(Vlan.DEFAULT_ID, Vlan.withDefaultName(Vlan.DEFAULT_ID));
    long agingMillis = context.config().macAgingSeconds() * 1000L;
    this.agingSweep = context.timers().scheduleAtFixedRate(agingMillis, agingMillis, () -> {
      int removed = macTable.cleanExpired(context.clock().nowMillis());
      if (removed > 0) {
        log.debug("{}: aged out {} MAC entries", name(), removed);
      }
    });
  }

  @Override
  public String kind() {
    return "switch";
  }

  /**
   * Registers an observer of every forwarding decision.
   *
   * @param listener observer
   */
  public void onFrameForward(Consumer<ForwardingDecision> listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public MacTable getMacTable() {
    return macTable;
  }

  /** Removes learned entries; static entries survive. */
  public void clearMacTable() {
    macTable.clearDynamic();
    log.info("{}: MAC address table cleared", name());
  }

  /**
   * Installs a static MAC entry.
   *
   * @param vlan VLAN ID
   * @param mac station address
   * @param portName port
   */
  public void addStaticMac(int vlan, MacAddress mac, String portName) {
    requirePort(portName);
    requireVlan(vlan);
    macTable.addStatic(vlan, mac, portName);
    log.info("{}: static MAC {} vlan {} on {}", name(), mac, vlan, portName);
  }

  /**
   * Stops the periodic MAC aging sweep.
   */
  public void powerOff() {
    agingSweep.cancel();
  }

  // --- Ports -------------------------------------------------------------------------------------------------

  public SwitchPortConfig portConfig(String portName) {
    requirePort(portName);
    return portConfigs.get(portName);
  }

  /**
   * Makes {@code portName} an access port of {@code vlan}, creating the VLAN when missing.
   *
   * @param portName port
   * @param vlan VLAN ID
   */
  public void setAccessVlan(String portName, int vlan) {
    requirePort(portName);
    ensureVlan(vlan);
    applyPortConfig(portName, SwitchPortConfig.access(vlan));
  }

  /**
   * Makes {@code portName} a trunk.
   *
   * @param portName port
   * @param nativeVlan untagged VLAN
   * @param allowed allowed VLANs; empty means all
   */
  public void setTrunk(String portName, int nativeVlan, Set<Integer> allowed) {
    requirePort(portName);
    ensureVlan(nativeVlan);
    applyPortConfig(portName, SwitchPortConfig.trunk(nativeVlan, allowed));
  }

  private void applyPortConfig(String portName, SwitchPortConfig config) {
    SwitchPortConfig previous = portConfigs.put(portName, config);
    if (!config.equals(previous)) {
      int purged = macTable.removePort(portName);
      log.info("{}: {} switchport {} ({} MAC entries purged)", name(), portName, config, purged);
      publish("config", portName + " switchport " + config);
    }
  }

  @Override
  protected void onLinkChange(NetworkPort port, boolean up) {
    if (!up) {
      int purged = macTable.removePort(port.name());
      log.debug("{}: {} down, purged {} MAC entries", name(), port.name(), purged);
    }
  }

  // --- VLAN database -----------------------------------------------------------------------------------------

  /** @return VLANs ordered by ID */
  public List<Vlan> vlans() {
    return new ArrayList<>(vlans.values());
  }

  public Optional<Vlan> vlan(int id) {
    return Optional.ofNullable(vlans.get(id));
  }

  /**
   * Creates a VLAN, or renames it when it exists.
   *
   * @param id VLAN ID
   * @param vlanName display name
   * @return the VLAN
   */
  public Vlan createVlan(int id, String vlanName) {
    Vlan vlan = new Vlan(id, vlanName);
    Vlan previous = vlans.put(id, vlan);
    if (previous == null) {
      log.info("{}: vlan {} created ({})", name(), id, vlanName);
      publish("config", "vlan " + id + " name " + vlanName);
    } else if (!previous.name().equals(vlanName)) {
      log.info("{}: vlan {} renamed {} -> {}", name(), id, previous.name(), vlanName);
    }
    return vlan;
  }

  /**
   * Creates a VLAN with its conventional name.
   *
   * @param id VLAN ID
   * @return the VLAN
   */
  public Vlan createVlan(int id) {
    return createVlan(id, Vlan.withDefaultName(id).name());
  }

  /**
   * Renames an existing VLAN.
   *
   * @param id VLAN ID
   * @param vlanName new name
   * @throws IllegalArgumentException when the VLAN does not exist
   */
  public void renameVlan(int id, String vlanName) {
    requireVlan(id);
    createVlan(id, vlanName);
  }

  /**
   * Deletes a VLAN: its access ports move to VLAN 1 and its MAC entries are purged.
   *
   * @param id VLAN ID
   * @return {@code true} when the VLAN existed
   * @throws IllegalArgumentException for VLAN 1
   */
  public boolean deleteVlan(int id) {
    if (id == Vlan.DEFAULT_ID) {
      throw new IllegalArgumentException("default VLAN 1 cannot be deleted");
    }
    if (vlans.remove(id) == null) {
      return false;
    }
    List<String> moved = new ArrayList<>();
    for (Map.Entry<String, SwitchPortConfig> entry : portConfigs.entrySet()) {
      SwitchPortConfig config = entry.getValue();
      if (config.mode() == SwitchPortMode.ACCESS && config.accessVlan() == id) {
        entry.setValue(config.withAccessVlan(Vlan.DEFAULT_ID));
        moved.add(entry.getKey());
      }
    }
    int purged = macTable.removeVlan(id);
    log.info("{}: vlan {} deleted; {} ports moved to vlan 1, {} MAC entries purged", name(), id, moved.size(),
        purged);
    publish("config", "no vlan " + id);
    return true;
  }

  private void ensureVlan(int id) {
    if (!vlans.containsKey(id)) {
      createVlan(id);
    }
  }

  private void requireVlan(int id) {
    if (!vlans.containsKey(id)) {
      throw new IllegalArgumentException("unknown vlan " + id + " on " + name());
    }
  }

  // --- Forwarding --------------------------------------------------------------------------------------------

  @Override
  protected void handleFrame(NetworkPort port, EthernetFrame frame) {
    SwitchPortConfig ingress = portConfigs.get(port.name());
    int vlan = classify(ingress, frame);
    if (vlan == 0) {
      drop(port, 0, frame, "vlan not permitted on " + ingress);
      return;
    }
    if (!vlans.containsKey(vlan)) {
      drop(port, vlan, frame, "vlan " + vlan + " not in database");
      return;
    }
    long now = context().clock().nowMillis();
    if (frame.source().isUnicast() && macTable.learn(vlan, frame.source(), port.name(), now)) {
      log.debug("{}: learned {} vlan {} on {}", name(), frame.source(), vlan, port.name());
    }

    MacAddress destination = frame.destination();
    Optional<String> known = destination.isMulticast() ? Optional.empty() : macTable.lookup(vlan, destination, now);
    if (known.isEmpty()) {
      flood(port, vlan, frame);
      return;
    }
    String egressName = known.get();
    if (egressName.equals(port.name())) {
      report(port, vlan, frame, ForwardAction.FILTER, List.of(), "destination on ingress port");
      return;
    }
    NetworkPort egress = requirePort(egressName);
    SwitchPortConfig egressConfig = portConfigs.get(egressName);
    if (!egress.isEnabled() || !egressConfig.carries(vlan)) {
      drop(port, vlan, frame, "egress " + egressName + " cannot carry vlan " + vlan);
      return;
    }
    transmit(egress, encode(egressConfig, vlan, frame));
    context().metrics().increment(metricKey("forwarded"));
    report(port, vlan, frame, ForwardAction.FORWARD, List.of(egressName), "");
  }

  private void flood(NetworkPort ingress, int vlan, EthernetFrame frame) {
    List<String> egress = new ArrayList<>();
    for (NetworkPort candidate : ports()) {
      if (candidate == ingress || !candidate.isEnabled() || !isConnected(candidate.name())) {
        continue;
      }
      SwitchPortConfig config = portConfigs.get(candidate.name());
      if (!config.carries(vlan)) {
        continue;
      }
      egress.add(candidate.name());
    }
    context().metrics().increment(metricKey("flooded"));
    log.debug("{}: flooding {} -> {} in vlan {} to {}", name(), frame.source(), frame.destination(), vlan, egress);
    report(ingress, vlan, frame, ForwardAction.FLOOD, egress, "");
    for (String portName : egress) {
      transmit(requirePort(portName), encode(portConfigs.get(portName), vlan, frame));
    }
  }

  /** Returns the ingress VLAN, or 0 when the frame is not admitted. */
  private static int classify(SwitchPortConfig config, EthernetFrame frame) {
    Optional<VlanTag> tag = frame.vlan();
    if (config.mode() == SwitchPortMode.ACCESS) {
      if (tag.isPresent() && tag.get().vid() != config.accessVlan()) {
        return 0;
      }
      return config.accessVlan();
    }
    if (tag.isEmpty()) {
      return config.nativeVlan();
    }
    int vid = tag.get().vid();
    return config.carries(vid) ? vid : 0;
  }

  private static EthernetFrame encode(SwitchPortConfig config, int vlan, EthernetFrame frame) {
    if (config.mode() == SwitchPortMode.ACCESS || vlan == config.nativeVlan()) {
      return frame.withoutVlanTag();
    }
    return frame.withVlanTag(VlanTag.of(vlan));
  }

  private void drop(NetworkPort port, int vlan, EthernetFrame frame, String reason) {
    context().metrics().increment(metricKey("dropped"));
    log.debug("{}: dropping frame from {} on {}: {}", name(), frame.source(), port.name(), reason);
    report(port, vlan, frame, ForwardAction.DROP, List.of(), reason);
  }

  private void report(NetworkPort port, int vlan, EthernetFrame frame, ForwardAction action, List<String> egress,
      String reason) {
    if (listeners.isEmpty()) {
      return;
    }
    ForwardingDecision decision = new ForwardingDecision(name(), port.name(), vlan, frame, action, egress, reason);
    for (Consumer<ForwardingDecision> listener : listeners) {
      listener.accept(decision);
    }
  }
}
