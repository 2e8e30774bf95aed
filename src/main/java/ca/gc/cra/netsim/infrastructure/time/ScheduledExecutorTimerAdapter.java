package ca.gc.cra.netsim.infrastructure.time;

import ca.gc.cra.netsim.application.port.Cancellable;
import ca.gc.cra.netsim.application.port.TimerPort;
import ca.gc.cra.netsim.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TimerPort} backed by a single-threaded {@link ScheduledExecutorService}, for wall-clock simulations.
 */
public final class ScheduledExecutorTimerAdapter implements TimerPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorTimerAdapter.class);

  private final ScheduledExecutorService executor;

  /**
   * Creates an adapter owning a fresh simulation scheduler thread.
   */
  public ScheduledExecutorTimerAdapter() {
    this(ExecutorFactories.newSimulationScheduler("netsim-timer",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)));
  }

  ScheduledExecutorTimerAdapter(ScheduledExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public Cancellable schedule(long delayMillis, Runnable task) {
    Objects.requireNonNull(task, "task");
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delayMillis must not be negative (was " + delayMillis + ")");
    }
    return new FutureHandle(executor.schedule(guard(task), delayMillis, TimeUnit.MILLISECONDS));
  }

  @Override
  public Cancellable scheduleAtFixedRate(long initialDelayMillis, long periodMillis, Runnable task) {
    Objects.requireNonNull(task, "task");
    if (periodMillis <= 0) {
      throw new IllegalArgumentException("periodMillis must be positive (was " + periodMillis + ")");
    }
    return new FutureHandle(executor.scheduleAtFixedRate(
        guard(task), Math.max(0L, initialDelayMillis), periodMillis, TimeUnit.MILLISECONDS));
  }

  /**
   * Submits work to the simulation thread, so callers outside timer tasks can touch device state safely.
   *
   * @param task work to run
   */
  public void execute(Runnable task) {
    executor.execute(guard(Objects.requireNonNull(task, "task")));
  }

  /**
   * Runs {@code task} on the simulation thread and waits for its result.
   *
   * @param task work to run
   * @param <T> result type
   * @return the task's result
   * @throws ExecutionException when the task throws
   * @throws InterruptedException when interrupted while waiting
   */
  public <T> T call(Callable<T> task) throws ExecutionException, InterruptedException {
    return executor.submit(Objects.requireNonNull(task, "task")).get();
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private static Runnable guard(Runnable task) {
    // A periodic task that throws is never rescheduled by the executor; log and keep it alive.
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        log.warn("Timer task failed", ex);
      }
    };
  }

  private static final class FutureHandle implements Cancellable {
    private final ScheduledFuture<?> future;

    private FutureHandle(ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }
}
