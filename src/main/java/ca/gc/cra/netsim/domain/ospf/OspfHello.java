package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import java.util.List;
import java.util.Objects;

/**
 * Hello packet (RFC 2328 A.3.2).
 *
 * @param routerId sender router ID
 * @param areaId sender area
 * @param networkMask mask of the sending interface
 * @param helloInterval hello interval in seconds
 * @param options options byte
 * @param priority router priority; 0 means ineligible to become DR
 * @param deadInterval router dead interval in seconds
 * @param designatedRouter DR interface address as seen by the sender, or {@code 0.0.0.0}
 * @param backupDesignatedRouter BDR interface address as seen by the sender, or {@code 0.0.0.0}
 * @param neighbors router IDs the sender has heard from recently
 * @since 0.1.0
 */
public record OspfHello(
    Ipv4Address routerId,
    Ipv4Address areaId,
    SubnetMask networkMask,
    int helloInterval,
    int options,
    int priority,
    int deadInterval,
    Ipv4Address designatedRouter,
    Ipv4Address backupDesignatedRouter,
    List<Ipv4Address> neighbors) implements OspfPacket {

  public OspfHello {
    Objects.requireNonNull(routerId, "routerId");
    Objects.requireNonNull(areaId, "areaId");
    Objects.requireNonNull(networkMask, "networkMask");
    designatedRouter = designatedRouter != null ? designatedRouter : Ipv4Address.ANY;
    backupDesignatedRouter = backupDesignatedRouter != null ? backupDesignatedRouter : Ipv4Address.ANY;
    neighbors = List.copyOf(neighbors);
  }

  /**
   * Returns whether {@code router} appears in the neighbor list.
   *
   * @param router router ID
   * @return {@code true} when the sender has seen {@code router}
   */
  public boolean lists(Ipv4Address router) {
    return neighbors.contains(router);
  }

  @Override
  public OspfPacketType packetType() {
    return OspfPacketType.HELLO;
  }

  @Override
  public int bodyLength() {
    return 20 + neighbors.size() * 4;
  }
}
