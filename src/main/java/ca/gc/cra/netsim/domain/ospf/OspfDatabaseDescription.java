package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.List;
import java.util.Objects;

/**
 * Database Description packet (RFC 2328 A.3.3).
 *
 * @param routerId sender router ID
 * @param areaId sender area
 * @param interfaceMtu MTU of the sending interface
 * @param options options byte
 * @param flags I/M/MS bits
 * @param sequence DD sequence number
 * @param headers summarized LSA headers
 * @since 0.1.0
 */
public record OspfDatabaseDescription(
    Ipv4Address routerId,
    Ipv4Address areaId,
    int interfaceMtu,
    int options,
    int flags,
    int sequence,
    List<LsaHeader> headers) implements OspfPacket {

  public OspfDatabaseDescription {
    Objects.requireNonNull(routerId, "routerId");
    Objects.requireNonNull(areaId, "areaId");
    headers = List.copyOf(headers);
  }

  public boolean isInit() {
    return (flags & OspfConstants.DD_FLAG_INIT) != 0;
  }

  public boolean isMore() {
    return (flags & OspfConstants.DD_FLAG_MORE) != 0;
  }

  /** @return {@code true} when the sender claims to be master */
  public boolean isMaster() {
    return (flags & OspfConstants.DD_FLAG_MASTER) != 0;
  }

  /**
   * Returns whether {@code other} repeats this packet: same I/M/MS bits and sequence number.
   *
   * @param other previously received packet; may be {@code null}
   * @return {@code true} for a duplicate
   */
  public boolean isDuplicateOf(OspfDatabaseDescription other) {
    return other != null && other.flags == flags && other.sequence == sequence;
  }

  @Override
  public OspfPacketType packetType() {
    return OspfPacketType.DATABASE_DESCRIPTION;
  }

  @Override
  public int bodyLength() {
    return 8 + headers.size() * LsaHeader.BYTES;
  }
}
