package ca.gc.cra.netsim.application.sim;

import ca.gc.cra.netsim.domain.net.IcmpType;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.ospf.NeighborState;
import ca.gc.cra.netsim.domain.routing.Route;
import ca.gc.cra.netsim.domain.sim.SimulationEvent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Snapshot of a lab run: adjacencies, routing tables, the end-to-end ping and the event log.
 * <p><strong>Role:</strong> Value handed from {@link LabScenario} to the CLI renderers.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param routerCount routers in the chain
 * @param elapsedMillis simulated time covered by the run
 * @param neighbors one row per OSPF neighbor, grouped by router
 * @param routingTables routing table per router, in chain order
 * @param ping end-to-end ping outcome
 * @param events simulation events, oldest first
 * @since 0.1.0
 */
public record LabReport(
    int routerCount,
    long elapsedMillis,
    List<NeighborRow> neighbors,
    Map<String, List<Route>> routingTables,
    PingOutcome ping,
    List<SimulationEvent> events) {

  public LabReport {
    neighbors = List.copyOf(neighbors);
    routingTables = Collections.unmodifiableMap(new LinkedHashMap<>(routingTables));
    Objects.requireNonNull(ping, "ping");
    events = List.copyOf(events);
  }

  /** @return {@code true} when every neighbor row is Full */
  public boolean converged() {
    return neighbors.stream().allMatch(row -> row.state() == NeighborState.FULL);
  }

  /**
   * One OSPF neighbor as seen by a router.
   *
   * @param router reporting router
   * @param interfaceName interface the neighbor was heard on
   * @param neighborId neighbor router ID
   * @param address neighbor interface address
   * @param state adjacency state
   */
  public record NeighborRow(
      String router, String interfaceName, Ipv4Address neighborId, Ipv4Address address, NeighborState state) {}

  /**
   * Result of the end-to-end ping.
   *
   * @param source pinging host address
   * @param destination target host address
   * @param replied whether an echo reply came back
   * @param replyTtl TTL of the reply, or -1
   * @param error ICMP error received instead, or {@code null}
   */
  public record PingOutcome(
      Ipv4Address source, Ipv4Address destination, boolean replied, int replyTtl, IcmpType error) {

    public PingOutcome {
      Objects.requireNonNull(source, "source");
      Objects.requireNonNull(destination, "destination");
    }

    /** @return e.g. {@code reply from 192.168.2.10 ttl=61} */
    public String summary() {
      if (replied) {
        return "reply from " + destination + " ttl=" + replyTtl;
      }
      if (error != null) {
        return error + " for " + destination;
      }
      return "no reply from " + destination;
    }
  }
}
