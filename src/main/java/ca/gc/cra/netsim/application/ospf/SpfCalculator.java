package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.domain.ospf.Lsa;
import ca.gc.cra.netsim.domain.ospf.LsaKey;
import ca.gc.cra.netsim.domain.ospf.LsaType;
import ca.gc.cra.netsim.domain.ospf.NetworkLsa;
import ca.gc.cra.netsim.domain.ospf.RouterLink;
import ca.gc.cra.netsim.domain.ospf.RouterLinkType;
import ca.gc.cra.netsim.domain.ospf.RouterLsa;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Shortest-path-first calculation over one area's Router and Network LSAs
 * (RFC 2328 §16.1).
 * <p><strong>Algorithm:</strong> Dijkstra from the calculating router. An edge is used only when the far end
 * describes the link back (bidirectional check). On the first hop the next hop is the neighbor's own link data:
 * its interface address on the shared link. Networks reached through a transit vertex attached to the root have
 * no next hop. Stub links of every reached router become leaves.</p>
 * <p><strong>Output:</strong> one route per destination prefix, lowest cost first; a directly attached route wins
 * a cost tie.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls.</p>
 *
 * @since 0.1.0
 */
final class SpfCalculator {

  /**
   * An interface of the calculating router in the area.
   *
   * @param name interface name
   * @param address interface address
   * @param mask interface mask
   */
  record LocalLink(String name, Ipv4Address address, SubnetMask mask) {}

  private enum VertexType { NETWORK, ROUTER }

  private record VertexId(VertexType type, Ipv4Address id) {}

  private static final class Vertex {
    final VertexId id;
    final Lsa lsa;
    int distance;
    Ipv4Address nextHop;
    String interfaceName;
    boolean viaRoot;

    Vertex(VertexId id, Lsa lsa, int distance, Ipv4Address nextHop, String interfaceName, boolean viaRoot) {
      this.id = id;
      this.lsa = lsa;
      this.distance = distance;
      this.nextHop = nextHop;
      this.interfaceName = interfaceName;
      this.viaRoot = viaRoot;
    }
  }

  private static final Comparator<Vertex> ORDER = Comparator.<Vertex>comparingInt(v -> v.distance)
      .thenComparing(v -> v.id.type())
      .thenComparing(v -> v.id.id());

  private final Ipv4Address rootId;
  private final Ipv4Address areaId;
  private final Map<LsaKey, Lsa> database = new HashMap<>();
  private final List<LocalLink> localLinks;

  SpfCalculator(Ipv4Address rootId, Ipv4Address areaId, List<Lsa> lsas, List<LocalLink> localLinks) {
    this.rootId = Objects.requireNonNull(rootId, "rootId");
    this.areaId = Objects.requireNonNull(areaId, "areaId");
    for (Lsa lsa : lsas) {
      if (!lsa.header().isMaxAge()) {
        database.put(lsa.key(), lsa);
      }
    }
    this.localLinks = List.copyOf(localLinks);
  }

  /**
   * Runs the calculation.
   *
   * @return routes, including directly attached networks without a next hop; empty when the root has no
   *     Router-LSA in the area
   */
  List<OspfRoute> calculate() {
    Optional<RouterLsa> rootLsa = routerLsa(rootId);
    if (rootLsa.isEmpty()) {
      return List.of();
    }
    Map<VertexId, Vertex> tree = new LinkedHashMap<>();
    Map<VertexId, Vertex> candidates = new HashMap<>();
    Vertex root = new Vertex(new VertexId(VertexType.ROUTER, rootId), rootLsa.get(), 0, null, null, false);
    tree.put(root.id, root);
    addCandidates(root, tree, candidates);
    while (!candidates.isEmpty()) {
      Vertex next = candidates.values().stream().min(ORDER).orElseThrow();
      candidates.remove(next.id);
      tree.put(next.id, next);
      addCandidates(next, tree, candidates);
    }
    return routes(tree);
  }

  private void addCandidates(Vertex vertex, Map<VertexId, Vertex> tree, Map<VertexId, Vertex> candidates) {
    boolean isRoot = vertex.id.id().equals(rootId) && vertex.id.type() == VertexType.ROUTER;
    if (vertex.lsa instanceof RouterLsa router) {
      for (RouterLink link : router.links()) {
        if (link.type() == RouterLinkType.POINT_TO_POINT) {
          Optional<RouterLsa> far = routerLsa(link.linkId());
          if (far.isEmpty()) {
            continue;
          }
          Optional<RouterLink> back = linkBack(far.get(), RouterLinkType.POINT_TO_POINT, vertex.id.id());
          if (back.isEmpty()) {
            continue;
          }
          Ipv4Address nextHop = vertex.nextHop;
          String iface = vertex.interfaceName;
          if (isRoot) {
            nextHop = back.get().linkData();
            iface = interfaceFor(link.linkData()).orElse(null);
            if (iface == null) {
              continue;
            }
          }
          offer(tree, candidates, new Vertex(new VertexId(VertexType.ROUTER, link.linkId()), far.get(),
              vertex.distance + link.metric(), nextHop, iface, false));
        } else if (link.type() == RouterLinkType.TRANSIT) {
          Optional<NetworkLsa> network = networkLsa(link.linkId());
          if (network.isEmpty() || !network.get().attachedRouters().contains(vertex.id.id())) {
            continue;
          }
          Ipv4Address nextHop = vertex.nextHop;
          String iface = vertex.interfaceName;
          if (isRoot) {
            nextHop = null;
            iface = interfaceFor(link.linkData()).orElse(null);
            if (iface == null) {
              continue;
            }
          }
          offer(tree, candidates, new Vertex(new VertexId(VertexType.NETWORK, link.linkId()), network.get(),
              vertex.distance + link.metric(), nextHop, iface, isRoot));
        }
      }
    } else if (vertex.lsa instanceof NetworkLsa network) {
      for (Ipv4Address attached : network.attachedRouters()) {
        if (attached.equals(rootId)) {
          continue;
        }
        Optional<RouterLsa> far = routerLsa(attached);
        if (far.isEmpty()) {
          continue;
        }
        Optional<RouterLink> back = linkBack(far.get(), RouterLinkType.TRANSIT, vertex.id.id());
        if (back.isEmpty()) {
          continue;
        }
        Ipv4Address nextHop = vertex.viaRoot ? back.get().linkData() : vertex.nextHop;
        offer(tree, candidates, new Vertex(new VertexId(VertexType.ROUTER, attached), far.get(),
            vertex.distance, nextHop, vertex.interfaceName, false));
      }
    }
  }

  private static void offer(Map<VertexId, Vertex> tree, Map<VertexId, Vertex> candidates, Vertex vertex) {
    if (tree.containsKey(vertex.id)) {
      return;
    }
    Vertex existing = candidates.get(vertex.id);
    if (existing == null || vertex.distance < existing.distance) {
      candidates.put(vertex.id, vertex);
    }
  }

  private List<OspfRoute> routes(Map<VertexId, Vertex> tree) {
    Map<String, OspfRoute> best = new LinkedHashMap<>();
    for (Vertex vertex : tree.values()) {
      if (vertex.lsa instanceof NetworkLsa network) {
        consider(best, new OspfRoute(network.network(), network.mask(), vertex.nextHop, vertex.interfaceName,
            vertex.distance, network.header().advertisingRouter(), areaId));
      } else if (vertex.lsa instanceof RouterLsa router) {
        boolean isRoot = vertex.id.id().equals(rootId);
        for (RouterLink link : router.links()) {
          if (link.type() != RouterLinkType.STUB) {
            continue;
          }
          SubnetMask mask = new SubnetMask(link.linkData().bits());
          String iface = isRoot ? localInterfaceOn(link.linkId(), mask).orElse(null) : vertex.interfaceName;
          if (iface == null) {
            continue;
          }
          consider(best, new OspfRoute(link.linkId(), mask, isRoot ? null : vertex.nextHop, iface,
              vertex.distance + link.metric(), router.header().advertisingRouter(), areaId));
        }
      }
    }
    return new ArrayList<>(best.values());
  }

  private static void consider(Map<String, OspfRoute> best, OspfRoute route) {
    String key = route.network() + "/" + route.mask().prefixLength();
    OspfRoute existing = best.get(key);
    if (existing == null
        || route.cost() < existing.cost()
        || (route.cost() == existing.cost() && route.nextHop() == null && existing.nextHop() != null)) {
      best.put(key, route);
    }
  }

  private Optional<RouterLsa> routerLsa(Ipv4Address routerId) {
    Lsa lsa = database.get(new LsaKey(LsaType.ROUTER.code(), routerId, routerId));
    return lsa instanceof RouterLsa router ? Optional.of(router) : Optional.empty();
  }

  private Optional<NetworkLsa> networkLsa(Ipv4Address drAddress) {
    for (Lsa lsa : database.values()) {
      if (lsa instanceof NetworkLsa network && network.header().linkStateId().equals(drAddress)) {
        return Optional.of(network);
      }
    }
    return Optional.empty();
  }

  private static Optional<RouterLink> linkBack(RouterLsa far, RouterLinkType type, Ipv4Address target) {
    for (RouterLink link : far.links()) {
      if (link.type() == type && link.linkId().equals(target)) {
        return Optional.of(link);
      }
    }
    return Optional.empty();
  }

  private Optional<String> interfaceFor(Ipv4Address localAddress) {
    for (LocalLink link : localLinks) {
      if (link.address().equals(localAddress)) {
        return Optional.of(link.name());
      }
    }
    return Optional.empty();
  }

  private Optional<String> localInterfaceOn(Ipv4Address network, SubnetMask mask) {
    for (LocalLink link : localLinks) {
      if (link.address().network(mask).equals(network) && link.mask().equals(mask)) {
        return Optional.of(link.name());
      }
    }
    return Optional.empty();
  }
}
