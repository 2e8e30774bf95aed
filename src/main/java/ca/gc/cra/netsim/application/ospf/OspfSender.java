package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.ospf.OspfPacket;

/**
 * Transmits OSPF packets on behalf of an engine; implemented by the owning router.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface OspfSender {
  /**
   * Sends {@code packet} out of {@code interfaceName}.
   *
   * @param interfaceName egress interface
   * @param packet OSPF packet
   * @param destination unicast neighbor address or an OSPF multicast group
   */
  void send(String interfaceName, OspfPacket packet, Ipv4Address destination);
}
