package ca.gc.cra.netsim.application.port;

/**
 * Handle to a scheduled timer task.
 *
 * @since 0.1.0
 */
public interface Cancellable {
  /**
   * Prevents any future execution of the task. Idempotent.
   */
  void cancel();

  /** @return {@code true} once {@link #cancel()} has been called */
  boolean isCancelled();

  /** Handle for "no timer"; cancelling it does nothing. */
  Cancellable NONE = new Cancellable() {
    @Override public void cancel() {}

    @Override public boolean isCancelled() {
      return true;
    }
  };
}
