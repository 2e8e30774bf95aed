package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;

/**
 * One link described by a Router-LSA.
 *
 * <p>Link ID and data depend on the type: neighbor router ID and our interface address for point-to-point, DR
 * address and our interface address for transit, network and mask for stub.</p>
 *
 * @param linkId link ID
 * @param linkData link data
 * @param type link type
 * @param metric cost of the link, 0-65535
 * @since 0.1.0
 */
public record RouterLink(Ipv4Address linkId, Ipv4Address linkData, RouterLinkType type, int metric) {
  /** Encoded size in bytes (no TOS entries). */
  public static final int BYTES = 12;

  public RouterLink {
    Objects.requireNonNull(linkId, "linkId");
    Objects.requireNonNull(linkData, "linkData");
    Objects.requireNonNull(type, "type");
    Numbers.requireRange("metric", metric, 0, 0xFFFF);
  }
}
