package ca.gc.cra.netsim.domain.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import java.util.List;
import org.junit.jupiter.api.Test;

class RoutingTableTest {

  @Test
  void longestPrefixWins() {
    RoutingTable table = new RoutingTable();
    table.add(new Route(ip("0.0.0.0"), SubnetMask.ZERO, ip("10.0.0.1"), "Gi0/0", RouteSource.STATIC, 0));
    table.add(new Route(ip("172.16.0.0"), SubnetMask.ofPrefix(16), ip("10.0.0.2"), "Gi0/1", RouteSource.OSPF, 20));
    table.add(new Route(ip("172.16.5.0"), SubnetMask.ofPrefix(24), ip("10.0.0.3"), "Gi0/2", RouteSource.OSPF, 30));

    assertEquals(ip("10.0.0.3"), table.lookup(ip("172.16.5.9")).orElseThrow().nextHop());
    assertEquals(ip("10.0.0.2"), table.lookup(ip("172.16.6.9")).orElseThrow().nextHop());
    assertEquals(ip("10.0.0.1"), table.lookup(ip("8.8.8.8")).orElseThrow().nextHop());
  }

  @Test
  void equalPrefixPrefersConnectedOverStatic() {
    RoutingTable table = new RoutingTable();
    table.add(new Route(ip("10.1.1.0"), SubnetMask.ofPrefix(24), ip("10.0.0.9"), "Gi0/1", RouteSource.STATIC, 0));
    table.add(Route.connected(ip("10.1.1.0"), SubnetMask.ofPrefix(24), "Gi0/0"));

    Route best = table.lookup(ip("10.1.1.20")).orElseThrow();
    assertEquals(RouteSource.CONNECTED, best.source());
    assertEquals("Gi0/0", best.interfaceName());
  }

  @Test
  void lowerMetricWinsWithinOspf() {
    RoutingTable table = new RoutingTable();
    table.add(new Route(ip("10.9.0.0"), SubnetMask.ofPrefix(16), ip("10.0.0.1"), "Gi0/0", RouteSource.OSPF, 30));
    table.add(new Route(ip("10.9.0.0"), SubnetMask.ofPrefix(16), ip("10.0.0.5"), "Gi0/1", RouteSource.OSPF, 10));

    assertEquals(ip("10.0.0.5"), table.lookup(ip("10.9.1.1")).orElseThrow().nextHop());
  }

  @Test
  void noMatchIsEmpty() {
    RoutingTable table = new RoutingTable();
    table.add(Route.connected(ip("10.1.1.0"), SubnetMask.ofPrefix(24), "Gi0/0"));

    assertTrue(table.lookup(ip("10.1.2.1")).isEmpty());
  }

  @Test
  void networkIsNormalizedAndSameSlotReplaced() {
    RoutingTable table = new RoutingTable();
    table.add(new Route(ip("10.1.1.77"), SubnetMask.ofPrefix(24), ip("10.0.0.1"), "Gi0/0", RouteSource.STATIC, 0));
    table.add(new Route(ip("10.1.1.0"), SubnetMask.ofPrefix(24), ip("10.0.0.1"), "Gi0/0", RouteSource.STATIC, 0));

    assertEquals(1, table.size());
    assertEquals(ip("10.1.1.0"), table.routes().get(0).network());
  }

  @Test
  void replaceAllSwapsOnlyOneSource() {
    RoutingTable table = new RoutingTable();
    table.add(Route.connected(ip("10.1.1.0"), SubnetMask.ofPrefix(24), "Gi0/0"));
    table.add(new Route(ip("10.2.0.0"), SubnetMask.ofPrefix(16), ip("10.1.1.2"), "Gi0/0", RouteSource.OSPF, 2));

    table.replaceAll(RouteSource.OSPF,
        List.of(new Route(ip("10.3.0.0"), SubnetMask.ofPrefix(16), ip("10.1.1.2"), "Gi0/0", RouteSource.OSPF, 3)));

    assertEquals(2, table.size());
    assertEquals(ip("10.3.0.0"), table.routes(RouteSource.OSPF).get(0).network());
    assertThrows(IllegalArgumentException.class, () -> table.replaceAll(RouteSource.OSPF,
        List.of(Route.connected(ip("10.4.0.0"), SubnetMask.ofPrefix(16), "Gi0/1"))));
  }

  @Test
  void removeConnectedLeavesStaticRoutesOnThatInterface() {
    RoutingTable table = new RoutingTable();
    table.add(Route.connected(ip("10.1.1.0"), SubnetMask.ofPrefix(24), "Gi0/0"));
    table.add(new Route(ip("10.5.0.0"), SubnetMask.ofPrefix(16), ip("10.1.1.2"), "Gi0/0", RouteSource.STATIC, 0));

    assertEquals(1, table.removeConnected("Gi0/0"));
    assertEquals(RouteSource.STATIC, table.routes().get(0).source());
  }

  @Test
  void rendersLikeARouterListing() {
    Route ospf = new Route(ip("10.0.2.0"), SubnetMask.ofPrefix(24), ip("10.0.12.2"), "GigabitEthernet0/1",
        RouteSource.OSPF, 2);

    assertEquals("O 10.0.2.0/24 [110/2] via 10.0.12.2, GigabitEthernet0/1", ospf.toString());
    assertEquals("C 10.1.1.0/24 is directly connected, Gi0/0",
        Route.connected(ip("10.1.1.9"), SubnetMask.ofPrefix(24), "Gi0/0").toString());
  }

  private static Ipv4Address ip(String text) {
    return Ipv4Address.parse(text);
  }
}
