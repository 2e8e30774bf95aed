package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.List;
import java.util.Objects;

/**
 * Link State Update packet (RFC 2328 A.3.5).
 *
 * @param routerId sender router ID
 * @param areaId sender area
 * @param lsas carried LSAs
 * @since 0.1.0
 */
public record OspfLinkStateUpdate(Ipv4Address routerId, Ipv4Address areaId, List<Lsa> lsas) implements OspfPacket {

  public OspfLinkStateUpdate {
    Objects.requireNonNull(routerId, "routerId");
    Objects.requireNonNull(areaId, "areaId");
    lsas = List.copyOf(lsas);
  }

  @Override
  public OspfPacketType packetType() {
    return OspfPacketType.LINK_STATE_UPDATE;
  }

  @Override
  public int bodyLength() {
    int total = 4;
    for (Lsa lsa : lsas) {
      total += lsa.header().length();
    }
    return total;
  }
}
