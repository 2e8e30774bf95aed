package ca.gc.cra.netsim.domain.routing;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import java.util.Objects;
import java.util.Optional;

/**
 * Routing table entry.
 *
 * @param network destination network; stored normalized to {@code mask}
 * @param mask destination mask
 * @param nextHop next-hop address, or {@code null} for directly connected networks
 * @param interfaceName egress interface
 * @param source origin
 * @param metric cost within the source; lower wins between equal prefixes
 * @since 0.1.0
 */
public record Route(
    Ipv4Address network, SubnetMask mask, Ipv4Address nextHop, String interfaceName, RouteSource source, int metric) {

  /**
   * Normalizes the network and validates fields.
   */
  public Route {
    Objects.requireNonNull(network, "network");
    Objects.requireNonNull(mask, "mask");
    Objects.requireNonNull(interfaceName, "interfaceName");
    Objects.requireNonNull(source, "source");
    if (metric < 0) {
      throw new IllegalArgumentException("metric must not be negative (was " + metric + ")");
    }
    network = network.network(mask);
  }

  /**
   * Directly connected route.
   *
   * @param network network
   * @param mask mask
   * @param interfaceName interface
   * @return route
   */
  public static Route connected(Ipv4Address network, SubnetMask mask, String interfaceName) {
    return new Route(network, mask, null, interfaceName, RouteSource.CONNECTED, 0);
  }

  /**
   * Returns whether {@code destination} falls inside this route's prefix.
   *
   * @param destination address
   * @return {@code true} on match
   */
  public boolean matches(Ipv4Address destination) {
    return destination.network(mask).equals(network);
  }

  public Optional<Ipv4Address> gateway() {
    return Optional.ofNullable(nextHop);
  }

  /**
   * Renders in routing-table style, e.g. {@code O 10.0.2.0/24 [110/2] via 10.0.12.2, GigabitEthernet0/1}.
   *
   * @return rendering
   */
  @Override
  public String toString() {
    String prefix = source.code() + " " + network + "/" + mask.prefixLength();
    if (nextHop == null) {
      return prefix + " is directly connected, " + interfaceName;
    }
    return prefix + " [" + source.administrativeDistance() + "/" + metric + "] via " + nextHop + ", " + interfaceName;
  }
}
