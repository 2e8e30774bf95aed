package ca.gc.cra.netsim.domain.sim;

import java.util.Objects;

/**
 * <strong>What:</strong> A notable occurrence inside the simulation.
 * <p><strong>Role:</strong> Domain value object recorded by the simulation event sink and rendered by the lab CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param timestampMillis simulation time of the event
 * @param device name of the device reporting the event
 * @param category dotted category such as {@code router.icmp.timeExceeded}
 * @param message human-readable detail
 * @since 0.1.0
 */
public record SimulationEvent(long timestampMillis, String device, String category, String message) {
  /**
   * Validates required fields.
   */
  public SimulationEvent {
    Objects.requireNonNull(device, "device");
    Objects.requireNonNull(category, "category");
    message = message == null ? "" : message;
  }
}
