package ca.gc.cra.netsim.application.port;

/**
 * <strong>What:</strong> Port for scheduling cancelable timer tasks.
 * <p><strong>Why:</strong> Hello, dead, wait and retransmission timers, ARP queue expiry and NAT reclamation are
 * independent tasks owned by the component that scheduled them; cancelling the handle is the only way to stop one.</p>
 * <p><strong>Role:</strong> Domain port implemented by the virtual clock (tests, lab runs) and by a
 * {@code ScheduledExecutorService} adapter (wall-clock runs).</p>
 * <p><strong>Thread-safety:</strong> Implementations run every task on a single simulation thread, so device state
 * touched from tasks needs no further locking.</p>
 * <p><strong>Observability:</strong> Implementations log and swallow task failures so one failing task cannot stop
 * the clock.</p>
 *
 * @since 0.1.0
 */
public interface TimerPort {
  /**
   * Schedules a one-shot task.
   *
   * @param delayMillis delay before execution; must not be negative
   * @param task task to run
   * @return handle used to cancel the task
   */
  Cancellable schedule(long delayMillis, Runnable task);

  /**
   * Schedules a repeating task.
   *
   * @param initialDelayMillis delay before the first execution; must not be negative
   * @param periodMillis interval between executions; must be positive
   * @param task task to run
   * @return handle used to cancel all future executions
   */
  Cancellable scheduleAtFixedRate(long initialDelayMillis, long periodMillis, Runnable task);
}
