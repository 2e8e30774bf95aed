package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.ProtocolPayload;

/**
 * <strong>What:</strong> Common view of the five OSPF packet types carried as IPv4 protocol 89.
 * <p><strong>Role:</strong> Payload of an {@code Ipv4Packet}; the router hands it to its OSPF engine on local
 * delivery.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable.</p>
 *
 * @since 0.1.0
 */
public interface OspfPacket extends ProtocolPayload {
  /** Size of the common OSPF header in bytes. */
  int HEADER_BYTES = 24;

  OspfPacketType packetType();

  /** @return router ID of the sender */
  Ipv4Address routerId();

  /** @return area the sending interface belongs to */
  Ipv4Address areaId();

  /** @return body size in bytes, excluding the common header */
  int bodyLength();

  @Override
  default int protocol() {
    return OspfConstants.PROTOCOL;
  }

  @Override
  default int length() {
    return HEADER_BYTES + bodyLength();
  }
}
