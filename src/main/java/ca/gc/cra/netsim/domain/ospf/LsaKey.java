package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.Objects;

/**
 * Identity of an LSA independent of its instance: (type, link state ID, advertising router).
 *
 * @param type LS type code
 * @param linkStateId link state ID
 * @param advertisingRouter originating router ID
 * @since 0.1.0
 */
public record LsaKey(int type, Ipv4Address linkStateId, Ipv4Address advertisingRouter) {
  public LsaKey {
    Objects.requireNonNull(linkStateId, "linkStateId");
    Objects.requireNonNull(advertisingRouter, "advertisingRouter");
  }

  /** @return {@code type:lsid:advrtr}, the database key format */
  @Override
  public String toString() {
    return type + ":" + linkStateId + ":" + advertisingRouter;
  }
}
