package ca.gc.dfo.tides.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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
  void normalizesExporterAndCopiesOtlpSettings() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", " OTLP ",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=test"));

    assertEquals("otlp", TelemetryConfigurator.configureMetrics(args));

    assertEquals("otlp", args.get("metricsExporter"));
    assertFalse(args.containsKey("otelEndpoint"));
    assertFalse(args.containsKey("otelResourceAttributes"));
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=test", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void blankExporterMeansNone() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", ""));

    assertEquals("none", TelemetryConfigurator.configureMetrics(args));
    assertEquals("none", args.get("metricsExporter"));
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://collector"))));
  }
}
