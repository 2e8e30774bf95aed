package ca.gc.cra.netsim.infrastructure.events;

import ca.gc.cra.netsim.application.port.MetricsPort;
import ca.gc.cra.netsim.application.port.SimulationEventSink;
import ca.gc.cra.netsim.domain.sim.SimulationEvent;
import ca.gc.cra.netsim.logging.Logs;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SimulationEventSink} that logs each event and retains a bounded history for inspection.
 */
public final class LoggingSimulationEventSink implements SimulationEventSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingSimulationEventSink.class);
  private static final int DEFAULT_CAPACITY = 10_000;
  private static final int MAX_MESSAGE_BYTES = 512;

  private final MetricsPort metrics;
  private final String metricPrefix;
  private final int capacity;
  private final Deque<SimulationEvent> history = new ArrayDeque<>();

  /**
   * Creates a sink.
   *
   * @param metrics metrics port; {@code null} disables metrics
   * @param metricPrefix metric key prefix; defaults to {@code netsim.events}
   * @param capacity maximum retained events; oldest are dropped first
   */
  public LoggingSimulationEventSink(MetricsPort metrics, String metricPrefix, int capacity) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix =
        metricPrefix == null || metricPrefix.isBlank() ? "netsim.events" : metricPrefix.trim();
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  /**
   * Creates a sink with default capacity.
   *
   * @param metrics metrics port
   * @param metricPrefix metric key prefix
   */
  public LoggingSimulationEventSink(MetricsPort metrics, String metricPrefix) {
    this(metrics, metricPrefix, DEFAULT_CAPACITY);
  }

  /**
   * Creates a sink without metrics.
   */
  public LoggingSimulationEventSink() {
    this(MetricsPort.NO_OP, "netsim.events", DEFAULT_CAPACITY);
  }

  @Override
  public void publish(SimulationEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + ".published");
    synchronized (history) {
      if (history.size() == capacity) {
        history.removeFirst();
      }
      history.addLast(event);
    }
    log.info("sim.event t={}ms device={} category={} {}",
        event.timestampMillis(), event.device(), event.category(),
        Logs.truncate(event.message(), MAX_MESSAGE_BYTES));
  }

  @Override
  public List<SimulationEvent> events() {
    synchronized (history) {
      return List.copyOf(history);
    }
  }
}
