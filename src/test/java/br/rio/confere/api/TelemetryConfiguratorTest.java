package br.rio.confere.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @BeforeEach
  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void appliesExporterSettingsAndConsumesKeys() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "NONE",
        "otelEndpoint", "http://collector:4318",
        "otelResourceAttributes", "deployment.environment=test",
        "runId", "audit-1"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("none", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4318", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=test", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("runId", "audit-1"), args);
  }

  @Test
  void blankValuesLeavePropertiesUntouched() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "", "otelEndpoint", " "));

    TelemetryConfigurator.configureMetrics(args);

    assertNull(System.getProperty("otel.metrics.exporter"));
    assertFalse(args.containsKey("otelEndpoint"));
  }

  @Test
  void rejectsUnknownExporter() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "prometheus"));

    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(args));
  }

  @Test
  void rejectsEndpointWithoutHttpScheme() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://collector"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "http:///path"))));
  }
}
