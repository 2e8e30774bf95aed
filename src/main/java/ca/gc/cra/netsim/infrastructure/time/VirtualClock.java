package ca.gc.cra.netsim.infrastructure.time;

import ca.gc.cra.netsim.application.port.Cancellable;
import ca.gc.cra.netsim.application.port.ClockPort;
import ca.gc.cra.netsim.application.port.TimerPort;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Deterministic clock and timer scheduler that only moves when told to.
 * <p><strong>Why:</strong> OSPF hello/dead/retransmit behavior, NAT idle timeouts and ARP queue expiry must be
 * testable without wall-clock sleeps.</p>
 * <p><strong>Role:</strong> Adapter implementing both {@link ClockPort} and {@link TimerPort}.</p>
 * <p><strong>Ordering:</strong> Due tasks run in due-time order; tasks due at the same instant run in the order they
 * were scheduled. {@link #nowMillis()} reads the task's due time while it runs. Tasks scheduled by a running task
 * run within the same {@link #advanceTo(long)} call when they fall due before its target.</p>
 * <p><strong>Thread-safety:</strong> Methods synchronize on the clock; tasks run on the caller's thread while the
 * lock is held (the lock is reentrant, so tasks may schedule and cancel).</p>
 *
 * @since 0.1.0
 */
public final class VirtualClock implements ClockPort, TimerPort {
  private static final Logger log = LoggerFactory.getLogger(VirtualClock.class);

  private final PriorityQueue<Task> queue = new PriorityQueue<>(
      Comparator.comparingLong((Task t) -> t.dueMillis).thenComparingLong(t -> t.order));
  private long now;
  private long nextOrder;

  /**
   * Creates a clock starting at time zero.
   */
  public VirtualClock() {
    this(0L);
  }

  /**
   * Creates a clock starting at {@code startMillis}.
   *
   * @param startMillis initial time
   */
  public VirtualClock(long startMillis) {
    this.now = startMillis;
  }

  @Override
  public synchronized long nowMillis() {
    return now;
  }

  @Override
  public synchronized Cancellable schedule(long delayMillis, Runnable task) {
    return enqueue(delayMillis, 0L, task);
  }

  @Override
  public synchronized Cancellable scheduleAtFixedRate(long initialDelayMillis, long periodMillis, Runnable task) {
    if (periodMillis <= 0) {
      throw new IllegalArgumentException("periodMillis must be positive (was " + periodMillis + ")");
    }
    return enqueue(initialDelayMillis, periodMillis, task);
  }

  /**
   * Advances time by {@code millis}, running every task that falls due.
   *
   * @param millis non-negative duration
   */
  public synchronized void advanceBy(long millis) {
    if (millis < 0) {
      throw new IllegalArgumentException("millis must not be negative (was " + millis + ")");
    }
    advanceTo(now + millis);
  }

  /**
   * Advances time to {@code targetMillis}, running every task due at or before it.
   *
   * @param targetMillis absolute target time; must not be in the past
   */
  public synchronized void advanceTo(long targetMillis) {
    if (targetMillis < now) {
      throw new IllegalArgumentException("cannot move time backwards from " + now + " to " + targetMillis);
    }
    Task next;
    while ((next = queue.peek()) != null && next.dueMillis <= targetMillis) {
      queue.poll();
      if (next.cancelled) {
        continue;
      }
      now = next.dueMillis;
      run(next);
      if (next.periodMillis > 0 && !next.cancelled) {
        next.dueMillis += next.periodMillis;
        next.order = nextOrder++;
        queue.add(next);
      }
    }
    now = targetMillis;
  }

  /** Runs the tasks already due at the current instant. */
  public synchronized void runDue() {
    advanceTo(now);
  }

  /** @return number of scheduled tasks that have not been cancelled */
  public synchronized int pendingTasks() {
    int count = 0;
    for (Task task : queue) {
      if (!task.cancelled) {
        count++;
      }
    }
    return count;
  }

  private Cancellable enqueue(long delayMillis, long periodMillis, Runnable runnable) {
    Objects.requireNonNull(runnable, "task");
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delayMillis must not be negative (was " + delayMillis + ")");
    }
    Task task = new Task(now + delayMillis, periodMillis, nextOrder++, runnable);
    queue.add(task);
    return task;
  }

  private void run(Task task) {
    try {
      task.runnable.run();
    } catch (RuntimeException ex) {
      log.warn("Timer task failed at t={}ms", now, ex);
    }
  }

  private final class Task implements Cancellable {
    private long dueMillis;
    private final long periodMillis;
    private long order;
    private final Runnable runnable;
    private boolean cancelled;

    private Task(long dueMillis, long periodMillis, long order, Runnable runnable) {
      this.dueMillis = dueMillis;
      this.periodMillis = periodMillis;
      this.order = order;
      this.runnable = runnable;
    }

    @Override
    public void cancel() {
      synchronized (VirtualClock.this) {
        if (!cancelled) {
          cancelled = true;
          queue.remove(this);
        }
      }
    }

    @Override
    public boolean isCancelled() {
      synchronized (VirtualClock.this) {
        return cancelled;
      }
    }
  }
}
