package ca.gc.cra.netsim.application.device;

import ca.gc.cra.netsim.application.port.FrameSink;
import ca.gc.cra.netsim.application.sim.SimulationContext;
import ca.gc.cra.netsim.domain.net.EthernetFrame;
import ca.gc.cra.netsim.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Base class of simulated switches, routers and hosts.
 * <p><strong>Why:</strong> Cables only need the {@link FrameSink} capability; port bookkeeping, administrative
 * state and transmission are the same for every kind of device.</p>
 * <p><strong>Role:</strong> Subclasses implement {@link #handleFrame(NetworkPort, EthernetFrame)} and optionally
 * react to {@link #onLinkChange(NetworkPort, boolean)}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven by the simulation thread.</p>
 *
 * @since 0.1.0
 */
public abstract class NetworkDevice implements FrameSink {
  private static final Logger log = LoggerFactory.getLogger(NetworkDevice.class);

  private final String name;
  private final SimulationContext context;
  private final Map<String, NetworkPort> ports = new LinkedHashMap<>();

  /**
   * Creates a device without ports.
   *
   * @param name unique device name
   * @param context owning simulation
   */
  protected NetworkDevice(String name, SimulationContext context) {
    this.name = Strings.requireIdentifier("name", name);
    this.context = Objects.requireNonNull(context, "context");
  }

  public String name() {
    return name;
  }

  public SimulationContext context() {
    return context;
  }

  /** @return short kind name used in logs, such as {@code router} */
  public abstract String kind();

  /**
   * Adds a port with a freshly allocated MAC.
   *
   * @param portName port name
   * @return the port
   */
  protected final NetworkPort addPort(String portName) {
    NetworkPort port = new NetworkPort(portName, context.allocateMac());
    if (ports.putIfAbsent(portName, port) != null) {
      throw new IllegalArgumentException("duplicate port " + portName + " on " + name);
    }
    return port;
  }

  public Optional<NetworkPort> port(String portName) {
    return Optional.ofNullable(ports.get(portName));
  }

  /**
   * Returns the named port.
   *
   * @param portName port name
   * @return port
   * @throws IllegalArgumentException when the device has no such port
   */
  public NetworkPort requirePort(String portName) {
    NetworkPort port = ports.get(portName);
    if (port == null) {
      throw new IllegalArgumentException("unknown port " + portName + " on " + name);
    }
    return port;
  }

  /** @return ports in creation order */
  public List<NetworkPort> ports() {
    return new ArrayList<>(ports.values());
  }

  /**
   * Returns whether a cable is attached to the port.
   *
   * @param portName port name
   * @return {@code true} when cabled
   */
  public boolean isConnected(String portName) {
    return context.cableAt(name, portName).isPresent();
  }

  /**
   * Administratively disables a port; frames in either direction are dropped.
   *
   * @param portName port name
   */
  public void shutdownPort(String portName) {
    NetworkPort port = requirePort(portName);
    if (!port.isEnabled()) {
      return;
    }
    port.setEnabled(false);
    log.info("{}: {} administratively down", name, portName);
    context.publish(name, "config", portName + " shutdown");
    onLinkChange(port, false);
  }

  /**
   * Re-enables a port.
   *
   * @param portName port name
   */
  public void enablePort(String portName) {
    NetworkPort port = requirePort(portName);
    if (port.isEnabled()) {
      return;
    }
    port.setEnabled(true);
    log.info("{}: {} enabled", name, portName);
    context.publish(name, "config", portName + " no shutdown");
    if (isConnected(portName)) {
      onLinkChange(port, true);
    }
  }

  /**
   * Notification from the simulation that a cable was attached to or removed from {@code portName}.
   *
   * @param portName port name
   * @param up {@code true} on connect
   */
  public final void linkStateChanged(String portName, boolean up) {
    NetworkPort port = requirePort(portName);
    if (port.isEnabled()) {
      onLinkChange(port, up);
    }
  }

  @Override
  public final void receiveFrame(String portName, EthernetFrame frame) {
    NetworkPort port = ports.get(portName);
    if (port == null || !port.isEnabled()) {
      log.debug("{}: dropping frame on {} (port down or unknown)", name, portName);
      return;
    }
    handleFrame(port, frame);
  }

  /**
   * Sends a frame out of {@code port}. Disabled or uncabled ports drop it.
   *
   * @param port egress port
   * @param frame frame
   * @return {@code true} when delivered
   */
  protected final boolean transmit(NetworkPort port, EthernetFrame frame) {
    if (!port.isEnabled()) {
      return false;
    }
    return context.transmit(name, port.name(), frame);
  }

  /**
   * Handles a frame received on an enabled port.
   *
   * @param port ingress port
   * @param frame frame
   */
  protected abstract void handleFrame(NetworkPort port, EthernetFrame frame);

  /**
   * Reacts to a port going up or down. Does nothing by default.
   *
   * @param port port
   * @param up new state
   */
  protected void onLinkChange(NetworkPort port, boolean up) {
  }

  protected final void publish(String category, String message) {
    context.publish(name, category, message);
  }

  protected final String metricKey(String suffix) {
    return context.config().metricKey(kind() + "." + suffix);
  }

  @Override
  public String toString() {
    return kind() + " " + name;
  }
}
