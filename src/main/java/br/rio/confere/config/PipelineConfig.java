package br.rio.confere.config;

import br.rio.confere.validation.Numbers;
import br.rio.confere.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.Year;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable configuration of a CONFERE run.
 * <p><strong>Why:</strong> Navigation, search, extraction, and persistence read their knobs from one record
 * threaded through the composition root, so a run is reproducible from its merged configuration.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate materialized from the merged CLI/YAML/default map.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param filterYear contract year applied to the portal listing
 * @param timeout upper bound on each render wait
 * @param headless whether the browser runs without a window
 * @param maxCompanies cap on listed companies; {@code 0} means unlimited
 * @param csvSeed optional CSV file replacing the portal listing
 * @param runId identifier naming the checkpoint and output directory
 * @param outputDirectory root directory for run artifacts
 * @param checkpointDirectory directory holding checkpoint files
 * @param tempDirectory scratch directory for downloaded documents
 * @param portalUrl contracts portal entry point
 * @param gazetteUrl gazette search template; {@code {processo}} is replaced by the canonical processo
 * @param settle fixed wait after an action before polling starts
 * @param poll interval between settledness checks
 * @param maxScrollPasses scroll passes allowed per listing sweep
 * @param captchaAutoAttempts automated CAPTCHA attempts before the manual wait
 * @param captchaManualTimeout bound on the manual CAPTCHA wait
 * @param maxCandidates gazette candidates downloaded per processo
 * @param extractionEndpoint chat-completions endpoint of the extraction service
 * @param extractionModel model name sent to the extraction service
 * @param extractionApiKeyEnv environment variable holding the extraction API key
 * @param retryBaseDelay first backoff after a rate-limited extraction call
 * @param retryMultiplier backoff growth factor
 * @param retryJitter relative jitter applied to each backoff
 * @param retryMaxAttempts total extraction attempts when rate limited
 * @param retryMaxDelay upper bound on any single backoff, including server-requested waits
 * @see DefaultsForMode
 * @see ConfigMerger
 */
public record PipelineConfig(
    int filterYear,
    Duration timeout,
    boolean headless,
    int maxCompanies,
    Optional<Path> csvSeed,
    String runId,
    Path outputDirectory,
    Path checkpointDirectory,
    Path tempDirectory,
    String portalUrl,
    String gazetteUrl,
    Duration settle,
    Duration poll,
    int maxScrollPasses,
    int captchaAutoAttempts,
    Duration captchaManualTimeout,
    int maxCandidates,
    String extractionEndpoint,
    String extractionModel,
    String extractionApiKeyEnv,
    Duration retryBaseDelay,
    double retryMultiplier,
    double retryJitter,
    int retryMaxAttempts,
    Duration retryMaxDelay) {

  static final String DEFAULT_PORTAL_URL =
      "https://contasrio.rio.rj.gov.br/ContasRio/#!Contratos/Contrato%20por%20Favorecido";
  static final String DEFAULT_GAZETTE_URL = "https://doweb.rio.rj.gov.br/buscanova/#/p=1&q={processo}";
  static final String DEFAULT_EXTRACTION_ENDPOINT = "https://api.groq.com/openai/v1/chat/completions";
  static final String DEFAULT_EXTRACTION_MODEL = "llama-3.3-70b-versatile";
  static final String DEFAULT_API_KEY_ENV = "GROQ_API_KEY";

  private static final Path DEFAULT_BASE = Path.of(System.getProperty("user.home", "."), ".confere");
  private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

  public PipelineConfig {
    Numbers.requireRange("filterYear", filterYear, 2000, 2100);
    requirePositive("timeout", timeout);
    Numbers.requireRange("max", maxCompanies, 0, Integer.MAX_VALUE);
    csvSeed = Objects.requireNonNullElse(csvSeed, Optional.empty());
    runId = Strings.sanitizeIdentifier("runId", runId);
    outputDirectory = normalize("out", outputDirectory);
    checkpointDirectory = normalize("checkpointDir", checkpointDirectory);
    tempDirectory = normalize("tempDir", tempDirectory);
    portalUrl = requireHttpUrl("portalUrl", portalUrl);
    gazetteUrl = requireHttpUrl("gazetteUrl", gazetteUrl);
    if (!gazetteUrl.contains("{processo}")) {
      throw new IllegalArgumentException("gazetteUrl must contain the {processo} placeholder");
    }
    requireNonNegative("settleMillis", settle);
    requirePositive("pollMillis", poll);
    Numbers.requireRange("maxScrollPasses", maxScrollPasses, 2, 10_000);
    Numbers.requireRange("captchaAutoAttempts", captchaAutoAttempts, 0, 20);
    requirePositive("captchaManualTimeoutSeconds", captchaManualTimeout);
    Numbers.requireRange("maxCandidates", maxCandidates, 1, 100);
    extractionEndpoint = requireHttpUrl("extractionEndpoint", extractionEndpoint);
    extractionModel = Strings.requirePrintableAscii("extractionModel", extractionModel, 200);
    extractionApiKeyEnv = Strings.sanitizeIdentifier("extractionApiKeyEnv", extractionApiKeyEnv);
    requireNonNegative("retryBaseDelayMillis", retryBaseDelay);
    Numbers.requireRange("retryMaxAttempts", retryMaxAttempts, 1, 50);
    requirePositive("retryMaxDelayMillis", retryMaxDelay);
  }

  /**
   * Returns the configuration used when no option is supplied.
   *
   * @return defaults rooted at {@code ~/.confere}, with a timestamped run id
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(
        Year.now().getValue(),
        Duration.ofSeconds(10),
        false,
        0,
        Optional.empty(),
        newRunId(),
        DEFAULT_BASE.resolve("out"),
        DEFAULT_BASE.resolve("checkpoints"),
        DEFAULT_BASE.resolve("tmp"),
        DEFAULT_PORTAL_URL,
        DEFAULT_GAZETTE_URL,
        Duration.ofMillis(1_500),
        Duration.ofMillis(250),
        200,
        2,
        Duration.ofMinutes(5),
        5,
        DEFAULT_EXTRACTION_ENDPOINT,
        DEFAULT_EXTRACTION_MODEL,
        DEFAULT_API_KEY_ENV,
        Duration.ofSeconds(2),
        2.0,
        0.2,
        5,
        Duration.ofSeconds(60));
  }

  /**
   * Creates a configuration from merged key/value options, falling back to {@link #defaults()} per key.
   *
   * @param options flat option map as produced by {@link ConfigMerger}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PipelineConfig d = defaults();
    return new PipelineConfig(
        intOption(options, "filterYear", d.filterYear(), 2000, 2100),
        Duration.ofSeconds(intOption(options, "timeoutSeconds", (int) d.timeout().toSeconds(), 1, 3_600)),
        boolOption(options, "headless", d.headless()),
        intOption(options, "max", d.maxCompanies(), 0, Integer.MAX_VALUE),
        optionalPath(options, "csv"),
        stringOption(options, "runId", d.runId()),
        pathOption(options, "out", d.outputDirectory()),
        pathOption(options, "checkpointDir", d.checkpointDirectory()),
        pathOption(options, "tempDir", d.tempDirectory()),
        stringOption(options, "portalUrl", d.portalUrl()),
        stringOption(options, "gazetteUrl", d.gazetteUrl()),
        Duration.ofMillis(intOption(options, "settleMillis", (int) d.settle().toMillis(), 0, 600_000)),
        Duration.ofMillis(intOption(options, "pollMillis", (int) d.poll().toMillis(), 1, 60_000)),
        intOption(options, "maxScrollPasses", d.maxScrollPasses(), 2, 10_000),
        intOption(options, "captchaAutoAttempts", d.captchaAutoAttempts(), 0, 20),
        Duration.ofSeconds(intOption(options, "captchaManualTimeoutSeconds",
            (int) d.captchaManualTimeout().toSeconds(), 1, 86_400)),
        intOption(options, "maxCandidates", d.maxCandidates(), 1, 100),
        stringOption(options, "extractionEndpoint", d.extractionEndpoint()),
        stringOption(options, "extractionModel", d.extractionModel()),
        stringOption(options, "extractionApiKeyEnv", d.extractionApiKeyEnv()),
        Duration.ofMillis(intOption(options, "retryBaseDelayMillis",
            (int) d.retryBaseDelay().toMillis(), 0, 600_000)),
        doubleOption(options, "retryMultiplier", d.retryMultiplier(), 1.0, 10.0),
        doubleOption(options, "retryJitter", d.retryJitter(), 0.0, 0.99),
        intOption(options, "retryMaxAttempts", d.retryMaxAttempts(), 1, 50),
        Duration.ofMillis(intOption(options, "retryMaxDelayMillis",
            (int) d.retryMaxDelay().toMillis(), 1, 3_600_000)));
  }

  /**
   * Directory receiving the artifacts of this run.
   *
   * @return {@code <out>/<runId>}
   */
  public Path runDirectory() {
    return outputDirectory.resolve(runId);
  }

  /**
   * Gazette search URL for a canonical processo.
   *
   * @param processo canonical processo text
   * @return search URL
   */
  public String gazetteSearchUrl(String processo) {
    return gazetteUrl.replace("{processo}", processo);
  }

  /**
   * Returns a copy with a different run id; used by {@code resume}.
   *
   * @param newRunId run identifier
   * @return updated configuration
   */
  public PipelineConfig withRunId(String newRunId) {
    return new PipelineConfig(filterYear, timeout, headless, maxCompanies, csvSeed, newRunId,
        outputDirectory, checkpointDirectory, tempDirectory, portalUrl, gazetteUrl, settle, poll,
        maxScrollPasses, captchaAutoAttempts, captchaManualTimeout, maxCandidates, extractionEndpoint,
        extractionModel, extractionApiKeyEnv, retryBaseDelay, retryMultiplier, retryJitter, retryMaxAttempts,
        retryMaxDelay);
  }

  static String newRunId() {
    return "run-" + LocalDateTime.now().format(RUN_ID_FORMAT);
  }

  private static int intOption(Map<String, String> options, String key, int fallback, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseInt(key, raw, min, max);
  }

  private static double doubleOption(
      Map<String, String> options, String key, double fallback, double min, double max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseDouble(key, raw, min, max);
  }

  private static boolean boolOption(Map<String, String> options, String key, boolean fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim();
    if (normalized.equalsIgnoreCase("true")) {
      return true;
    }
    if (normalized.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
  }

  private static String stringOption(Map<String, String> options, String key, String fallback) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  private static Path pathOption(Map<String, String> options, String key, Path fallback) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? fallback : parsePath(key, raw);
  }

  private static Optional<Path> optionalPath(Map<String, String> options, String key) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(parsePath(key, raw));
  }

  private static Path parsePath(String key, String raw) {
    try {
      return Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static Path normalize(String key, Path path) {
    Objects.requireNonNull(path, key);
    return path.toAbsolutePath().normalize();
  }

  private static String requireHttpUrl(String key, String raw) {
    String value = Strings.requireNonBlank(key, raw);
    try {
      // The placeholder is not valid URI syntax.
      URI uri = new URI(value.replace("{processo}", "x"));
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(key + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(key + " must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(key + " must be a valid URI", ex);
    }
    return value;
  }

  private static void requirePositive(String key, Duration value) {
    Objects.requireNonNull(value, key);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(key + " must be positive");
    }
  }

  private static void requireNonNegative(String key, Duration value) {
    Objects.requireNonNull(value, key);
    if (value.isNegative()) {
      throw new IllegalArgumentException(key + " must not be negative");
    }
  }
}
