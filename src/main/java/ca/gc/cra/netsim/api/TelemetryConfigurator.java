package ca.gc.cra.netsim.api;

import ca.gc.cra.netsim.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related CLI settings as system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code args} and
   * publishes them as {@code otel.*} system properties.
   *
   * @param args mutable argument map
   * @throws IllegalArgumentException when a value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = args.remove("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
    }

    String resourceAttributes = args.remove("otelResourceAttributes");
    if (resourceAttributes != null && !resourceAttributes.isBlank()) {
      String trimmed = Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes,
          MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty("otel.resource.attributes", trimmed);
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
