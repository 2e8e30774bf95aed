package ca.gc.cra.netsim.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for creating executors aligned with the simulator's concurrency model.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds the single-threaded scheduler that runs every timer task of a wall-clock simulation.
   *
   * <p>One thread serializes all device state changes, matching the synchronous frame delivery model.</p>
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the worker thread
   * @return configured scheduler; cancelled tasks are removed from its queue immediately
   */
  public static ScheduledExecutorService newSimulationScheduler(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "netsim-timer" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return executor;
  }
}
