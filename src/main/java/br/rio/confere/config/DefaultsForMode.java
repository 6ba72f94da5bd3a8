package br.rio.confere.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CONFERE CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys; values mirror
 * {@link PipelineConfig#defaults()}.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (run, resume, conformity)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run", "resume" -> buildPipelineDefaults();
      case "conformity" -> buildConformityDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    PipelineConfig defaults = PipelineConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("out", defaults.outputDirectory().toString());
    return Map.copyOf(map);
  }

  private static Map<String, String> buildPipelineDefaults() {
    PipelineConfig defaults = PipelineConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("filterYear", Integer.toString(defaults.filterYear()));
    map.put("timeoutSeconds", Long.toString(defaults.timeout().toSeconds()));
    map.put("headless", Boolean.toString(defaults.headless()));
    map.put("max", Integer.toString(defaults.maxCompanies()));
    map.put("csv", "");
    map.put("checkpointDir", defaults.checkpointDirectory().toString());
    map.put("tempDir", defaults.tempDirectory().toString());
    map.put("portalUrl", defaults.portalUrl());
    map.put("gazetteUrl", defaults.gazetteUrl());
    map.put("settleMillis", Long.toString(defaults.settle().toMillis()));
    map.put("pollMillis", Long.toString(defaults.poll().toMillis()));
    map.put("maxScrollPasses", Integer.toString(defaults.maxScrollPasses()));
    map.put("captchaAutoAttempts", Integer.toString(defaults.captchaAutoAttempts()));
    map.put("captchaManualTimeoutSeconds", Long.toString(defaults.captchaManualTimeout().toSeconds()));
    map.put("maxCandidates", Integer.toString(defaults.maxCandidates()));
    map.put("extractionEndpoint", defaults.extractionEndpoint());
    map.put("extractionModel", defaults.extractionModel());
    map.put("extractionApiKeyEnv", defaults.extractionApiKeyEnv());
    map.put("retryBaseDelayMillis", Long.toString(defaults.retryBaseDelay().toMillis()));
    map.put("retryMultiplier", Double.toString(defaults.retryMultiplier()));
    map.put("retryJitter", Double.toString(defaults.retryJitter()));
    map.put("retryMaxAttempts", Integer.toString(defaults.retryMaxAttempts()));
    map.put("retryMaxDelayMillis", Long.toString(defaults.retryMaxDelay().toMillis()));
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildConformityDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("pairs", "");
    return map;
  }
}
