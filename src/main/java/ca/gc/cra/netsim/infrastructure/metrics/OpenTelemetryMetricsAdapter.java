package ca.gc.cra.netsim.infrastructure.metrics;

import ca.gc.cra.netsim.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards simulator counters (drops, ICMP emissions, OSPF retransmissions) and
 * observations to OpenTelemetry instruments, one instrument per metric key.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("netsim.metric.key");
  private static final String FALLBACK_METRIC_NAME = "netsim.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter; noop when {@code OTEL_METRICS_EXPORTER}
   * is unset or {@code none}.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.isNoop() ? null : bootstrap.meter();
    if (meter == null) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (meter == null) {
      return;
    }
    Counter counter = counters.computeIfAbsent(key, this::createCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (meter == null) {
      return;
    }
    Histogram histogram = histograms.computeIfAbsent(key, this::createHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /** @return {@code true} when no exporter is configured */
  public boolean isNoop() {
    return meter == null;
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private Counter createCounter(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("netsim counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("netsim observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
