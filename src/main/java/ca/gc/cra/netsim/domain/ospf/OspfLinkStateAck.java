package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.List;
import java.util.Objects;

/**
 * Link State Acknowledgment packet (RFC 2328 A.3.6).
 *
 * @param routerId sender router ID
 * @param areaId sender area
 * @param headers acknowledged LSA instances
 * @since 0.1.0
 */
public record OspfLinkStateAck(Ipv4Address routerId, Ipv4Address areaId, List<LsaHeader> headers)
    implements OspfPacket {

  public OspfLinkStateAck {
    Objects.requireNonNull(routerId, "routerId");
    Objects.requireNonNull(areaId, "areaId");
    headers = List.copyOf(headers);
  }

  @Override
  public OspfPacketType packetType() {
    return OspfPacketType.LINK_STATE_ACK;
  }

  @Override
  public int bodyLength() {
    return headers.size() * LsaHeader.BYTES;
  }
}
