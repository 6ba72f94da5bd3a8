package br.rio.confere.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("filterYear", "2025", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("filterYear", "2024", "max", "10");
    Map<String, String> cli = Map.of("filterYear", "2023", "max", "3");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("2023", merged.get("filterYear"));
    assertEquals("3", merged.get("max"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: filterYear"));
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run", Optional.of(Map.of("headless", "true")), Map.of(), Map.of("headless", "false"), warnings::add);

    assertEquals("true", merged.get("headless"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void resumeRequiresRunId() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "resume",
            Optional.empty(),
            Map.of(),
            Map.of("runId", ""),
            msg -> {}));

    assertEquals("resume requires runId=ID", ex.getMessage());
  }

  @Test
  void conformityRequiresPairsAndRejectsCsv() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "conformity", Optional.empty(), Map.of(), Map.of("pairs", ""), msg -> {}));

    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "conformity", Optional.empty(), Map.of("pairs", "/data/pairs", "csv", "seed.csv"), Map.of(), msg -> {}));
    assertEquals("csv is only supported by run and resume", ex.getMessage());
  }
}
