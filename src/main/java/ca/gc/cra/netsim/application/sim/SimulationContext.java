package ca.gc.cra.netsim.application.sim;

import ca.gc.cra.netsim.application.device.NetworkDevice;
import ca.gc.cra.netsim.application.port.ClockPort;
import ca.gc.cra.netsim.application.port.MetricsPort;
import ca.gc.cra.netsim.application.port.SimulationEventSink;
import ca.gc.cra.netsim.application.port.TimerPort;
import ca.gc.cra.netsim.config.SimulationConfig;
import ca.gc.cra.netsim.domain.net.EthernetFrame;
import ca.gc.cra.netsim.domain.net.MacAddress;
import ca.gc.cra.netsim.domain.sim.SimulationEvent;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Everything the devices of one simulation share: device registry, cabling, configuration,
 * clock, timers, metrics and the event sink.
 * <p><strong>Why:</strong> Devices receive it at construction instead of reaching for global state, so several
 * simulations (one per test) can coexist in one JVM.</p>
 * <p><strong>Role:</strong> Application service wired by the CLI or by tests with infrastructure adapters.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine to the simulation thread.</p>
 *
 * @since 0.1.0
 */
public final class SimulationContext {
  private static final Logger log = LoggerFactory.getLogger(SimulationContext.class);
  private static final long LOCALLY_ADMINISTERED_BASE = 0x0200_0000_0000L;

  private final SimulationConfig config;
  private final ClockPort clock;
  private final TimerPort timers;
  private final MetricsPort metrics;
  private final SimulationEventSink events;
  private final Map<String, NetworkDevice> devices = new LinkedHashMap<>();
  private final Map<String, Cable> cablesByEnd = new HashMap<>();
  private final List<Cable> cables = new ArrayList<>();
  private long macCounter;

  /**
   * Creates a context.
   *
   * @param config shared configuration
   * @param clock time source
   * @param timers timer service
   * @param metrics metrics sink; {@code null} disables metrics
   * @param events event sink
   */
  public SimulationContext(SimulationConfig config, ClockPort clock, TimerPort timers, MetricsPort metrics,
      SimulationEventSink events) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.timers = Objects.requireNonNull(timers, "timers");
    this.metrics = metrics != null ? metrics : MetricsPort.NO_OP;
    this.events = Objects.requireNonNull(events, "events");
  }

  public SimulationConfig config() {
    return config;
  }

  public ClockPort clock() {
    return clock;
  }

  public TimerPort timers() {
    return timers;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public SimulationEventSink events() {
    return events;
  }

  /**
   * Registers a device under its name.
   *
   * @param device device built with this context
   * @param <T> device type
   * @return {@code device}
   * @throws IllegalArgumentException when the name is taken or the device belongs to another context
   */
  public <T extends NetworkDevice> T register(T device) {
    Objects.requireNonNull(device, "device");
    if (device.context() != this) {
      throw new IllegalArgumentException("device " + device.name() + " was built for another simulation");
    }
    if (devices.putIfAbsent(device.name(), device) != null) {
      throw new IllegalArgumentException("device name already in use: " + device.name());
    }
    log.info("Registered {} {}", device.kind(), device.name());
    return device;
  }

  public Optional<NetworkDevice> device(String name) {
    return Optional.ofNullable(devices.get(name));
  }

  /**
   * Looks up a device by name and type.
   *
   * @param name device name
   * @param type expected type
   * @param <T> expected type
   * @return device
   * @throws IllegalArgumentException when absent or of another type
   */
  public <T extends NetworkDevice> T device(String name, Class<T> type) {
    NetworkDevice device = devices.get(name);
    if (!type.isInstance(device)) {
      throw new IllegalArgumentException("no " + type.getSimpleName() + " named " + name);
    }
    return type.cast(device);
  }

  /** @return registered devices in registration order */
  public List<NetworkDevice> devices() {
    return List.copyOf(devices.values());
  }

  /**
   * Cables {@code a:portA} to {@code b:portB} and raises link up on both ends.
   *
   * @param a first device name
   * @param portA port on {@code a}
   * @param b second device name
   * @param portB port on {@code b}
   * @return the cable
   * @throws IllegalArgumentException for unknown devices or ports, or ports already cabled
   */
  public Cable connect(String a, String portA, String b, String portB) {
    NetworkDevice first = requireDevice(a);
    NetworkDevice second = requireDevice(b);
    first.requirePort(portA);
    second.requirePort(portB);
    if (a.equals(b) && portA.equals(portB)) {
      throw new IllegalArgumentException("cannot cable a port to itself: " + a + ":" + portA);
    }
    for (String end : List.of(endKey(a, portA), endKey(b, portB))) {
      if (cablesByEnd.containsKey(end)) {
        throw new IllegalArgumentException("port already cabled: " + end);
      }
    }
    Cable cable = new Cable(new Cable.Endpoint(a, portA, first), new Cable.Endpoint(b, portB, second));
    cables.add(cable);
    cablesByEnd.put(endKey(a, portA), cable);
    cablesByEnd.put(endKey(b, portB), cable);
    log.info("Connected {}", cable);
    publish(a, "link", "cable " + cable + " connected");
    first.linkStateChanged(portA, true);
    second.linkStateChanged(portB, true);
    return cable;
  }

  /**
   * Removes the cable attached to {@code device:port} and raises link down on both ends.
   *
   * @param device device name
   * @param port port name
   * @return {@code true} when a cable was attached
   */
  public boolean disconnect(String device, String port) {
    Cable cable = cablesByEnd.get(endKey(device, port));
    if (cable == null) {
      return false;
    }
    cable.unplug();
    cables.remove(cable);
    cablesByEnd.remove(endKey(cable.a().device(), cable.a().port()));
    cablesByEnd.remove(endKey(cable.b().device(), cable.b().port()));
    log.info("Disconnected {}", cable);
    publish(device, "link", "cable " + cable + " disconnected");
    for (Cable.Endpoint end : List.of(cable.a(), cable.b())) {
      NetworkDevice owner = devices.get(end.device());
      if (owner != null) {
        owner.linkStateChanged(end.port(), false);
      }
    }
    return true;
  }

  public Optional<Cable> cableAt(String device, String port) {
    return Optional.ofNullable(cablesByEnd.get(endKey(device, port)));
  }

  /** @return cables in connection order */
  public List<Cable> cables() {
    return List.copyOf(cables);
  }

  /**
   * Sends {@code frame} out of {@code device:port}; an uncabled port drops it.
   *
   * @param device sending device
   * @param port sending port
   * @param frame frame
   * @return {@code true} when delivered to a far end
   */
  public boolean transmit(String device, String port, EthernetFrame frame) {
    Cable cable = cablesByEnd.get(endKey(device, port));
    return cable != null && cable.transmit(device, port, frame);
  }

  /**
   * Records an event stamped with the current time.
   *
   * @param device originating device
   * @param category short category such as {@code ospf} or {@code icmp}
   * @param message description
   */
  public void publish(String device, String category, String message) {
    events.publish(new SimulationEvent(clock.nowMillis(), device, category, message));
  }

  /**
   * Allocates the next locally administered unicast MAC ({@code 02:00:00:00:00:01} onwards).
   *
   * @return fresh address
   */
  public MacAddress allocateMac() {
    macCounter++;
    return new MacAddress(LOCALLY_ADMINISTERED_BASE | macCounter);
  }

  private NetworkDevice requireDevice(String name) {
    NetworkDevice device = devices.get(name);
    if (device == null) {
      throw new IllegalArgumentException("unknown device: " + name);
    }
    return device;
  }

  private static String endKey(String device, String port) {
    return device + "\u0000" + port;
  }
}
