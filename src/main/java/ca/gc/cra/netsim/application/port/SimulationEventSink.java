package ca.gc.cra.netsim.application.port;

import ca.gc.cra.netsim.domain.sim.SimulationEvent;
import java.util.List;

/**
 * Port receiving notable simulation events (configuration changes, drops, ICMP emissions, adjacency changes).
 *
 * <p>Implementations must tolerate calls from timer tasks and device receive paths.</p>
 *
 * @since 0.1.0
 */
public interface SimulationEventSink {
  /**
   * Publishes an event.
   *
   * @param event event to record; must not be {@code null}
   */
  void publish(SimulationEvent event);

  /**
   * Returns the retained events, oldest first.
   *
   * @return immutable snapshot
   */
  List<SimulationEvent> events();
}
