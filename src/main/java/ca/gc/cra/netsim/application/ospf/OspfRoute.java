package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.routing.Route;
import ca.gc.cra.netsim.domain.routing.RouteSource;
import java.util.Objects;
import java.util.Optional;

/**
 * Intra-area route produced by the SPF calculation.
 *
 * @param network destination network
 * @param mask destination mask
 * @param nextHop first-hop router address, or {@code null} when the network is directly attached
 * @param interfaceName egress interface
 * @param cost total path cost
 * @param advertisingRouter router whose LSA described the destination
 * @param areaId area the route was computed in
 * @since 0.1.0
 */
public record OspfRoute(
    Ipv4Address network,
    SubnetMask mask,
    Ipv4Address nextHop,
    String interfaceName,
    int cost,
    Ipv4Address advertisingRouter,
    Ipv4Address areaId) {

  public OspfRoute {
    Objects.requireNonNull(network, "network");
    Objects.requireNonNull(mask, "mask");
    Objects.requireNonNull(interfaceName, "interfaceName");
    Objects.requireNonNull(advertisingRouter, "advertisingRouter");
    Objects.requireNonNull(areaId, "areaId");
    network = network.network(mask);
  }

  public Optional<Ipv4Address> gateway() {
    return Optional.ofNullable(nextHop);
  }

  /**
   * Converts to a routing table entry.
   *
   * @return {@code ospf} route, or empty for directly attached networks
   */
  public Optional<Route> toRoute() {
    if (nextHop == null) {
      return Optional.empty();
    }
    return Optional.of(new Route(network, mask, nextHop, interfaceName, RouteSource.OSPF, cost));
  }
}
