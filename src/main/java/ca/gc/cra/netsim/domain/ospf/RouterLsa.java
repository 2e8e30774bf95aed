package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.util.Bytes;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Type 1 LSA describing a router's links into one area.
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param header LSA header
 * @param flags V/E/B flag byte
 * @param links described links
 * @since 0.1.0
 */
public record RouterLsa(LsaHeader header, int flags, List<RouterLink> links) implements Lsa {

  public RouterLsa {
    Objects.requireNonNull(header, "header");
    links = List.copyOf(links);
  }

  /**
   * Builds a freshly originated Router-LSA with age 0 and a computed checksum.
   *
   * @param routerId originating router, also the link state ID
   * @param sequence LS sequence number
   * @param flags flag byte
   * @param links links
   * @return LSA
   */
  public static RouterLsa originate(Ipv4Address routerId, int sequence, int flags, List<RouterLink> links) {
    int length = LsaHeader.BYTES + 4 + links.size() * RouterLink.BYTES;
    LsaHeader header = new LsaHeader(0, OspfConstants.OPTIONS_E, LsaType.ROUTER.code(), routerId, routerId,
        sequence, 0, length);
    RouterLsa unchecked = new RouterLsa(header, flags, links);
    return new RouterLsa(header.withChecksum(LsaChecksum.compute(unchecked.toBytes())), flags, links);
  }

  /** @return {@code true} when the B flag marks an area border router */
  public boolean isAreaBorderRouter() {
    return (flags & OspfConstants.ROUTER_FLAG_B) != 0;
  }

  @Override
  public byte[] bodyBytes() {
    byte[] out = new byte[4 + links.size() * RouterLink.BYTES];
    out[0] = (byte) flags;
    Bytes.putU16be(out, 2, links.size());
    int off = 4;
    for (RouterLink link : links) {
      Bytes.putU32be(out, off, link.linkId().bits());
      Bytes.putU32be(out, off + 4, link.linkData().bits());
      out[off + 8] = (byte) link.type().code();
      Bytes.putU16be(out, off + 10, link.metric());
      off += RouterLink.BYTES;
    }
    return out;
  }

  @Override
  public RouterLsa withAge(int age) {
    return new RouterLsa(header.withAge(age), flags, links);
  }
}
