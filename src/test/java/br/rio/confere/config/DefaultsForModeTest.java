package br.rio.confere.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsCoverThePipelineKnobs() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");

    assertEquals("10", defaults.get("timeoutSeconds"));
    assertEquals("false", defaults.get("headless"));
    assertEquals("0", defaults.get("max"));
    assertEquals("GROQ_API_KEY", defaults.get("extractionApiKeyEnv"));
    assertEquals("otlp", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("pairs"));
  }

  @Test
  void resumeSharesRunDefaults() {
    assertEquals(DefaultsForMode.asFlatMap("run").keySet(), DefaultsForMode.asFlatMap(" Resume ").keySet());
  }

  @Test
  void conformityDefaultsOnlyAddPairs() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("conformity");

    assertTrue(defaults.containsKey("pairs"));
    assertTrue(defaults.containsKey("out"));
    assertFalse(defaults.containsKey("filterYear"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }

  @Test
  void defaultsProduceAValidConfiguration() {
    PipelineConfig config = PipelineConfig.fromMap(DefaultsForMode.asFlatMap("run"));

    assertEquals(PipelineConfig.defaults().extractionModel(), config.extractionModel());
    assertTrue(config.csvSeed().isEmpty());
  }
}
