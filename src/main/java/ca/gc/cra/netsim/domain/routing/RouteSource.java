package ca.gc.cra.netsim.domain.routing;

/**
 * Origin of a route with its administrative distance.
 *
 * @since 0.1.0
 */
public enum RouteSource {
  CONNECTED(0, "C"),
  STATIC(1, "S"),
  OSPF(110, "O");

  private final int administrativeDistance;
  private final String code;

  RouteSource(int administrativeDistance, String code) {
    this.administrativeDistance = administrativeDistance;
    this.code = code;
  }

  public int administrativeDistance() {
    return administrativeDistance;
  }

  /** @return one-letter code as shown in a routing table listing */
  public String code() {
    return code;
  }
}
