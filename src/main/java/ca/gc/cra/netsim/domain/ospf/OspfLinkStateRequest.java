package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.List;
import java.util.Objects;

/**
 * Link State Request packet (RFC 2328 A.3.4).
 *
 * @param routerId sender router ID
 * @param areaId sender area
 * @param requests requested LSAs
 * @since 0.1.0
 */
public record OspfLinkStateRequest(Ipv4Address routerId, Ipv4Address areaId, List<LsaKey> requests)
    implements OspfPacket {

  public OspfLinkStateRequest {
    Objects.requireNonNull(routerId, "routerId");
    Objects.requireNonNull(areaId, "areaId");
    requests = List.copyOf(requests);
  }

  @Override
  public OspfPacketType packetType() {
    return OspfPacketType.LINK_STATE_REQUEST;
  }

  @Override
  public int bodyLength() {
    return requests.size() * 12;
  }
}
