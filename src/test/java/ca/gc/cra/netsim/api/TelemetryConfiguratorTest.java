package ca.gc.cra.netsim.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void publishesSettingsAndRemovesKeys() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4318",
        "otelResourceAttributes", "team=net,env=lab",
        "routers", "3"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4318", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("team=net,env=lab", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("routers", "3"), args);
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://collector"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "http://"))));
    assertNull(System.getProperty("otel.metrics.exporter"));
  }

  @Test
  void configPathIsExtractedOnce() {
    Map<String, String> args = new HashMap<>(Map.of("--config", " lab.yaml ", "seconds", "5"));

    assertEquals("lab.yaml", ConfigCliUtils.extractConfigPath(args));
    assertFalse(args.containsKey("--config"));
    assertEquals(5, ConfigCliUtils.parseInt(args, "seconds", 60, 1, 10));
    assertEquals(60, ConfigCliUtils.parseInt(args, "missing", 60, 1, 10));
    assertThrows(IllegalArgumentException.class, () -> ConfigCliUtils.parseInt(args, "seconds", 60, 10, 20));
  }
}
