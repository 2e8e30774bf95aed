package ca.gc.cra.netsim.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for simulator metrics.
 *
 * <p>Settings come from system properties first, then the standard OTEL environment variables. Lab runs
 * usually have no collector, so the exporter defaults to {@code none}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.netsim";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility
  }

  static BootstrapResult initialize() {
    try {
      ExporterMode exporter = ExporterMode.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none"));
      if (exporter == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(Duration.ofSeconds(30)).build();
      log.info("OpenTelemetry metrics initialized with exporter {} targeting {}", exporter, endpoint);
      return build(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static Resource buildResource(String version) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "netsim")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    String extra = setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", "");
    for (String pair : extra.split(",")) {
      int idx = pair.indexOf('=');
      if (idx > 0 && idx < pair.length() - 1) {
        builder.put(AttributeKey.stringKey(pair.substring(0, idx).trim()), pair.substring(idx + 1).trim());
      }
    }
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String impl = pkg == null ? null : pkg.getImplementationVersion();
    return impl == null || impl.isBlank() ? "0.0.0-dev" : impl;
  }

  private static String setting(String property, String env, String defaultValue) {
    String fromProperty = System.getProperty(property);
    if (fromProperty != null && !fromProperty.isBlank()) {
      return fromProperty.trim();
    }
    String fromEnv = System.getenv(env);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return fromEnv.trim();
    }
    return defaultValue;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none", "" -> NONE;
        default -> {
          log.warn("Unknown OTEL_METRICS_EXPORTER value '{}'; metrics disabled", raw);
          yield NONE;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
