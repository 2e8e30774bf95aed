package ca.gc.cra.netsim.application.device;

import ca.gc.cra.netsim.application.sim.SimulationContext;
import ca.gc.cra.netsim.domain.net.ArpPacket;
import ca.gc.cra.netsim.domain.net.EthernetFrame;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.MacAddress;
import ca.gc.cra.netsim.domain.net.PacketFactory;
import ca.gc.cra.netsim.logging.Logs;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Layer 3 endpoint behavior shared by routers and hosts: frame acceptance, ARP, header checksum
 * validation and next-hop resolution with a bounded wait queue.
 * <p><strong>Role:</strong> Subclasses receive validated packets through
 * {@link #handlePacket(NetworkPort, EthernetFrame, Ipv4Packet)} and transmit through
 * {@link #sendToNextHop(NetworkPort, Ipv4Address, Ipv4Packet)}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven by the simulation thread.</p>
 *
 * @since 0.1.0
 */
public abstract class IpDevice extends NetworkDevice {
  private static final Logger log = LoggerFactory.getLogger(IpDevice.class);

  private final ArpCache arp = new ArpCache();

  protected IpDevice(String name, SimulationContext context) {
    super(name, context);
  }

  public ArpCache arpCache() {
    return arp;
  }

  /**
   * Returns whether the device owns {@code address} on any port.
   *
   * @param address address
   * @return {@code true} for a local address
   */
  public boolean isLocalAddress(Ipv4Address address) {
    for (NetworkPort port : ports()) {
      if (port.address().filter(address::equals).isPresent()) {
        return true;
      }
    }
    return false;
  }

  @Override
  protected final void handleFrame(NetworkPort port, EthernetFrame frame) {
    MacAddress destination = frame.destination();
    if (!destination.equals(port.mac()) && !destination.isBroadcast() && !acceptsGroup(destination)) {
      return;
    }
    Optional<ArpPacket> arpPacket = frame.arpPacket();
    if (arpPacket.isPresent()) {
      handleArp(port, arpPacket.get());
      return;
    }
    Optional<Ipv4Packet> packet = frame.ipv4Packet();
    if (packet.isEmpty()) {
      log.debug("{}: ignoring ether-type 0x{} on {}", name(), Integer.toHexString(frame.etherType()), port.name());
      return;
    }
    if (!PacketFactory.verifyChecksum(packet.get())) {
      context().metrics().increment(metricKey("drop.checksum"));
      log.warn("{}: dropping packet from {} on {}: bad header checksum", name(), packet.get().source(), port.name());
      if (log.isDebugEnabled()) {
        log.debug("{}: header {}", name(), Logs.hex(packet.get().headerBytes(), Ipv4Packet.HEADER_BYTES));
      }
      return;
    }
    handlePacket(port, frame, packet.get());
  }

  /**
   * Returns whether frames sent to the Ethernet group {@code mac} are for this device. None are by default.
   *
   * @param mac multicast destination
   * @return {@code true} to accept
   */
  protected boolean acceptsGroup(MacAddress mac) {
    return false;
  }

  /**
   * Handles a packet with a valid header checksum.
   *
   * @param port ingress port
   * @param frame carrying frame
   * @param packet packet
   */
  protected abstract void handlePacket(NetworkPort port, EthernetFrame frame, Ipv4Packet packet);

  private void handleArp(NetworkPort port, ArpPacket message) {
    boolean forUs = port.address().filter(message.targetIp()::equals).isPresent();
    boolean known = arp.lookup(message.senderIp()).isPresent();
    if (!forUs && !known) {
      return;
    }
    if (arp.learn(message.senderIp(), message.senderMac())) {
      log.debug("{}: ARP {} is-at {}", name(), message.senderIp(), message.senderMac());
    }
    if (forUs && message.operation() == ArpPacket.Operation.REQUEST) {
      transmit(port, PacketFactory.arpReply(message, port.mac()));
    }
    for (ArpCache.Pending pending : arp.release(message.senderIp())) {
      NetworkPort egress = requirePort(pending.portName());
      transmit(egress, EthernetFrame.ipv4(egress.mac(), message.senderMac(), pending.packet()));
    }
  }

  /**
   * Sends {@code packet} out of {@code port} towards {@code nextHop}. Multicast and broadcast destinations map
   * directly to group MACs; unicast next hops are resolved through ARP, parking the packet until the reply arrives
   * or the queue timeout discards it.
   *
   * @param port egress port
   * @param nextHop next-hop address, the destination itself when on-link
   * @param packet packet to send
   * @return {@code true} when the frame was handed to the cable immediately
   */
  protected final boolean sendToNextHop(NetworkPort port, Ipv4Address nextHop, Ipv4Packet packet) {
    Ipv4Address destination = packet.destination();
    if (destination.isMulticast()) {
      return transmit(port, EthernetFrame.ipv4(port.mac(), MacAddress.ipv4Multicast(destination), packet));
    }
    if (destination.equals(Ipv4Address.BROADCAST)) {
      return transmit(port, EthernetFrame.ipv4(port.mac(), MacAddress.BROADCAST, packet));
    }
    Optional<MacAddress> mac = arp.lookup(nextHop);
    if (mac.isPresent()) {
      return transmit(port, EthernetFrame.ipv4(port.mac(), mac.get(), packet));
    }
    Optional<Ipv4Address> source = port.address();
    if (source.isEmpty()) {
      log.debug("{}: cannot resolve {} on unaddressed {}", name(), nextHop, port.name());
      return false;
    }
    long now = context().clock().nowMillis();
    if (arp.enqueue(nextHop, new ArpCache.Pending(packet, port.name(), now))) {
      log.debug("{}: resolving {} on {}", name(), nextHop, port.name());
      transmit(port, PacketFactory.arpRequest(port.mac(), source.get(), nextHop));
      long timeout = context().config().arpQueueTimeoutMillis();
      context().timers().schedule(timeout, () -> {
        int dropped = arp.discardOlderThan(nextHop, context().clock().nowMillis());
        if (dropped > 0) {
          context().metrics().increment(metricKey("drop.arp"));
          log.debug("{}: discarded {} packets waiting for {}", name(), dropped, nextHop);
        }
      });
    }
    return false;
  }
}
