package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.util.Bytes;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Type 2 LSA originated by the DR of a multi-access network.
 * <p><strong>Role:</strong> Its link state ID is the DR's interface address; it lists every router fully adjacent to
 * the DR, the DR included.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param header LSA header
 * @param mask network mask
 * @param attachedRouters router IDs attached to the network
 * @since 0.1.0
 */
public record NetworkLsa(LsaHeader header, SubnetMask mask, List<Ipv4Address> attachedRouters) implements Lsa {

  public NetworkLsa {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(mask, "mask");
    attachedRouters = List.copyOf(attachedRouters);
  }

  /**
   * Builds a freshly originated Network-LSA with age 0 and a computed checksum.
   *
   * @param drAddress DR interface address, the link state ID
   * @param routerId originating router ID
   * @param sequence LS sequence number
   * @param mask network mask
   * @param attachedRouters attached routers
   * @return LSA
   */
  public static NetworkLsa originate(
      Ipv4Address drAddress, Ipv4Address routerId, int sequence, SubnetMask mask, List<Ipv4Address> attachedRouters) {
    int length = LsaHeader.BYTES + 4 + attachedRouters.size() * 4;
    LsaHeader header = new LsaHeader(0, OspfConstants.OPTIONS_E, LsaType.NETWORK.code(), drAddress, routerId,
        sequence, 0, length);
    NetworkLsa unchecked = new NetworkLsa(header, mask, attachedRouters);
    return new NetworkLsa(header.withChecksum(LsaChecksum.compute(unchecked.toBytes())), mask, attachedRouters);
  }

  /** @return network address of the described segment */
  public Ipv4Address network() {
    return header.linkStateId().network(mask);
  }

  @Override
  public byte[] bodyBytes() {
    byte[] out = new byte[4 + attachedRouters.size() * 4];
    Bytes.putU32be(out, 0, mask.bits());
    int off = 4;
    for (Ipv4Address router : attachedRouters) {
      Bytes.putU32be(out, off, router.bits());
      off += 4;
    }
    return out;
  }

  @Override
  public NetworkLsa withAge(int age) {
    return new NetworkLsa(header.withAge(age), mask, attachedRouters);
  }
}
