package ca.gc.cra.netsim.application.device;

import ca.gc.cra.netsim.application.sim.SimulationContext;
import ca.gc.cra.netsim.domain.net.EthernetFrame;
import ca.gc.cra.netsim.domain.net.IcmpMessage;
import ca.gc.cra.netsim.domain.net.IcmpType;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.PacketFactory;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * End station with one NIC ({@code eth0}), a default gateway and an inbox of received packets. Answers ARP and
 * echo requests; does not forward.
 *
 * @since 0.1.0
 */
public final class Host extends IpDevice {
  private static final Logger log = LoggerFactory.getLogger(Host.class);
  /** Name of the only NIC. */
  public static final String NIC = "eth0";

  private final NetworkPort nic;
  private final List<Ipv4Packet> inbox = new ArrayList<>();
  private Ipv4Address gateway;
  private int echoSequence;

  public Host(String name, SimulationContext context) {
    super(name, context);
    this.nic = addPort(NIC);
  }

  @Override
  public String kind() {
    return "host";
  }

  /**
   * Sets the NIC address and default gateway.
   *
   * @param address address
   * @param mask mask
   * @param defaultGateway gateway on the NIC subnet, or {@code null} for none
   * @throws IllegalArgumentException when the gateway is off-link
   */
  public void configure(Ipv4Address address, SubnetMask mask, Ipv4Address defaultGateway) {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(mask, "mask");
    if (defaultGateway != null && !defaultGateway.sameSubnet(address, mask)) {
      throw new IllegalArgumentException("default gateway " + defaultGateway + " is not on " + address + "/"
          + mask.prefixLength());
    }
    nic.setAddress(address, mask);
    this.gateway = defaultGateway;
    log.info("{}: {} {}/{} gateway {}", name(), NIC, address, mask.prefixLength(), defaultGateway);
    publish("config", NIC + " " + address + "/" + mask.prefixLength() + " gateway " + defaultGateway);
  }

  public NetworkPort nic() {
    return nic;
  }

  public Optional<Ipv4Address> address() {
    return nic.address();
  }

  public Optional<Ipv4Address> gateway() {
    return Optional.ofNullable(gateway);
  }

  /**
   * Sends an echo request with the configured host TTL.
   *
   * @param destination target
   * @return the request sent
   */
  public Ipv4Packet ping(Ipv4Address destination) {
    return ping(destination, context().config().hostDefaultTtl());
  }

  /**
   * Sends an echo request.
   *
   * @param destination target
   * @param ttl TTL, 1-255
   * @return the request sent
   * @throws IllegalStateException when the NIC has no address
   */
  public Ipv4Packet ping(Ipv4Address destination, int ttl) {
    Numbers.requireRange("ttl", ttl, 1, 255);
    Ipv4Address source = nic.address().orElseThrow(() -> new IllegalStateException(name() + " has no address"));
    echoSequence = (echoSequence + 1) & 0xFFFF;
    Ipv4Packet request = PacketFactory.echoRequest(source, destination, ttl, identifier(), echoSequence);
    log.debug("{}: ping {} seq {} ttl {}", name(), destination, echoSequence, ttl);
    send(request);
    return request;
  }

  /**
   * Sends a packet directly when the destination is on-link, otherwise through the gateway.
   *
   * @param packet packet
   * @return {@code false} when there is no route or the next hop is still being resolved
   */
  public boolean send(Ipv4Packet packet) {
    Ipv4Address destination = packet.destination();
    if (nic.isOnLink(destination) || destination.isMulticast() || destination.equals(Ipv4Address.BROADCAST)) {
      return sendToNextHop(nic, destination, packet);
    }
    if (gateway == null) {
      log.debug("{}: no route to {}", name(), destination);
      return false;
    }
    return sendToNextHop(nic, gateway, packet);
  }

  /** @return packets delivered to this host, oldest first */
  public List<Ipv4Packet> inbox() {
    return List.copyOf(inbox);
  }

  /**
   * Returns the received ICMP messages of one type.
   *
   * @param type ICMP type
   * @return matching packets, oldest first
   */
  public List<Ipv4Packet> received(IcmpType type) {
    List<Ipv4Packet> out = new ArrayList<>();
    for (Ipv4Packet packet : inbox) {
      if (packet.payload() instanceof IcmpMessage icmp && icmp.type() == type) {
        out.add(packet);
      }
    }
    return out;
  }

  public void clearInbox() {
    inbox.clear();
  }

  @Override
  protected void handlePacket(NetworkPort port, EthernetFrame frame, Ipv4Packet packet) {
    Ipv4Address destination = packet.destination();
    boolean forUs = nic.address().filter(destination::equals).isPresent() || destination.equals(Ipv4Address.BROADCAST);
    if (!forUs) {
      return;
    }
    inbox.add(packet);
    if (packet.payload() instanceof IcmpMessage icmp) {
      if (icmp.type() == IcmpType.ECHO_REQUEST && nic.hasAddress()) {
        send(PacketFactory.echoReply(packet, nic.address().orElseThrow(), context().config().hostDefaultTtl()));
      } else {
        log.debug("{}: received ICMP {} from {} ttl {}", name(), icmp.type(), packet.source(), packet.ttl());
      }
    }
  }

  private int identifier() {
    return name().hashCode() & 0xFFFF;
  }
}
