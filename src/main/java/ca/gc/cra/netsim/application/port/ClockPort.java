package ca.gc.cra.netsim.application.port;

/**
 * <strong>What:</strong> Port supplying the current simulation time in milliseconds.
 * <p><strong>Why:</strong> MAC aging, NAT idle timeouts and OSPF inactivity deadlines read time through this port so
 * that tests can substitute a virtual clock.</p>
 * <p><strong>Role:</strong> Domain port consumed by devices and engines.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.netsim.infrastructure.time.SystemClockAdapter
 * @see ca.gc.cra.netsim.infrastructure.time.VirtualClock
 */
public interface ClockPort {
  /**
   * Returns the current time in milliseconds.
   *
   * @return milliseconds since the clock's epoch; virtual clocks start at zero
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
