package ca.gc.cra.netsim.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets devices count drops, ICMP emissions and protocol events without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code netsim.router.drop.acl}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
