package ca.gc.cra.netsim.domain.routing;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> IPv4 routing table holding connected, static and OSPF routes side by side.
 * <p><strong>Lookup:</strong> longest prefix first, then lowest metric, then source priority
 * (connected before static before OSPF).</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by one router.</p>
 *
 * @since 0.1.0
 */
public final class RoutingTable {
  private static final Comparator<Route> PREFERENCE = Comparator
      .comparingInt((Route r) -> -r.mask().prefixLength())
      .thenComparingInt(Route::metric)
      .thenComparingInt(r -> r.source().administrativeDistance());

  private static final Comparator<Route> DISPLAY_ORDER = Comparator
      .comparing(Route::network)
      .thenComparingInt(r -> -r.mask().prefixLength())
      .thenComparingInt(r -> r.source().administrativeDistance());

  private final List<Route> routes = new ArrayList<>();

  /**
   * Adds a route; an identical prefix from the same source with the same next hop and interface is replaced.
   *
   * @param route route
   */
  public void add(Route route) {
    Objects.requireNonNull(route, "route");
    routes.removeIf(r -> sameSlot(r, route));
    routes.add(route);
  }

  /**
   * Removes routes of {@code source} for the given prefix.
   *
   * @param network network
   * @param mask mask
   * @param source source
   * @return number removed
   */
  public int remove(Ipv4Address network, SubnetMask mask, RouteSource source) {
    Ipv4Address normalized = network.network(mask);
    int before = routes.size();
    routes.removeIf(r -> r.source() == source && r.network().equals(normalized) && r.mask().equals(mask));
    return before - routes.size();
  }

  /**
   * Removes connected routes of an interface.
   *
   * @param interfaceName interface
   * @return number removed
   */
  public int removeConnected(String interfaceName) {
    int before = routes.size();
    routes.removeIf(r -> r.source() == RouteSource.CONNECTED && r.interfaceName().equals(interfaceName));
    return before - routes.size();
  }

  /**
   * Replaces every route of {@code source} with {@code replacement}.
   *
   * @param source source being refreshed, typically {@link RouteSource#OSPF}
   * @param replacement new routes; each must have {@code source} as its source
   */
  public void replaceAll(RouteSource source, Collection<Route> replacement) {
    for (Route route : replacement) {
      if (route.source() != source) {
        throw new IllegalArgumentException("route " + route + " is not from " + source);
      }
    }
    routes.removeIf(r -> r.source() == source);
    routes.addAll(replacement);
  }

  /**
   * Finds the preferred route to {@code destination}.
   *
   * @param destination destination address
   * @return best route, or empty when no prefix matches
   */
  public Optional<Route> lookup(Ipv4Address destination) {
    Objects.requireNonNull(destination, "destination");
    return routes.stream().filter(r -> r.matches(destination)).min(PREFERENCE);
  }

  /** @return routes ordered by network, longest prefix first */
  public List<Route> routes() {
    List<Route> snapshot = new ArrayList<>(routes);
    snapshot.sort(DISPLAY_ORDER);
    return List.copyOf(snapshot);
  }

  /**
   * Returns the routes of one source.
   *
   * @param source source
   * @return matching routes
   */
  public List<Route> routes(RouteSource source) {
    return routes().stream().filter(r -> r.source() == source).toList();
  }

  public int size() {
    return routes.size();
  }

  private static boolean sameSlot(Route a, Route b) {
    return a.source() == b.source()
        && a.network().equals(b.network())
        && a.mask().equals(b.mask())
        && Objects.equals(a.nextHop(), b.nextHop())
        && a.interfaceName().equals(b.interfaceName());
  }
}
