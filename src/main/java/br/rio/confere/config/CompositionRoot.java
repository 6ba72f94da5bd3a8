package br.rio.confere.config;

import br.rio.confere.application.extraction.ExtractionService;
import br.rio.confere.application.extraction.RetryPolicy;
import br.rio.confere.application.navigation.CompanySequence;
import br.rio.confere.application.navigation.PathDiscoveryNavigator;
import br.rio.confere.application.navigation.RenderWait;
import br.rio.confere.application.navigation.RowCollector;
import br.rio.confere.application.pipeline.ConformityOnlyUseCase;
import br.rio.confere.application.pipeline.ConformityPipelineUseCase;
import br.rio.confere.application.port.ClockPort;
import br.rio.confere.application.port.MetricsPort;
import br.rio.confere.application.publication.CandidateRanker;
import br.rio.confere.application.publication.CaptchaGate;
import br.rio.confere.application.publication.PublicationSearchEngine;
import br.rio.confere.domain.company.CompanyRowParser;
import br.rio.confere.domain.conformity.ConformityEngine;
import br.rio.confere.infrastructure.extraction.HttpExtractionAdapter;
import br.rio.confere.infrastructure.persistence.CsvCompanySeed;
import br.rio.confere.infrastructure.persistence.JsonCheckpointStore;
import br.rio.confere.infrastructure.persistence.JsonPairSource;
import br.rio.confere.infrastructure.persistence.JsonResultRepository;
import br.rio.confere.infrastructure.text.PdfBoxTextExtractor;
import br.rio.confere.infrastructure.time.SystemClockAdapter;
import br.rio.confere.infrastructure.web.BrowserManualCaptchaSignal;
import br.rio.confere.infrastructure.web.ContasRioPortalAdapter;
import br.rio.confere.infrastructure.web.DoWebGazetteAdapter;
import br.rio.confere.infrastructure.web.HttpContractSource;
import br.rio.confere.infrastructure.web.HttpDocumentDownloader;
import br.rio.confere.infrastructure.web.RecaptchaCheckboxSolver;
import br.rio.confere.infrastructure.web.SeleniumSession;
import br.rio.confere.logging.Logs;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires CONFERE use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from {@link PipelineConfig} to runnable pipelines in one place so
 * the application layer only ever sees ports.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning portal navigation, gazette search, extraction,
 * conformity, and persistence.</p>
 * <p><strong>Lifecycle:</strong> Browser sessions are created on first use and closed, newest first, by
 * {@link #close()}.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 *
 * @see ConformityPipelineUseCase
 * @see ConformityOnlyUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final Duration MANUAL_CAPTCHA_POLL = Duration.ofSeconds(1);

  private final PipelineConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Deque<AutoCloseable> resources = new ArrayDeque<>();

  /**
   * Creates a composition root with the system clock.
   *
   * @param config effective configuration
   * @param metrics metrics adapter shared by every component
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics) {
    this(config, new SystemClockAdapter(), metrics);
  }

  CompositionRoot(PipelineConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Builds the full pipeline: portal listing, path discovery, contract extraction, gazette search, and
   * conformity evaluation.
   *
   * @return pipeline use case
   */
  public ConformityPipelineUseCase pipelineUseCase() {
    HttpDocumentDownloader downloader = new HttpDocumentDownloader(config.timeout());
    PdfBoxTextExtractor textExtractor = new PdfBoxTextExtractor();
    ExtractionService extraction = extractionService();
    RenderWait renderWait = new RenderWait(clock, config.settle(), config.poll(), config.timeout());

    SeleniumSession portalSession = register(new SeleniumSession("portal", config.headless(), config.timeout()));
    ContasRioPortalAdapter portal = new ContasRioPortalAdapter(portalSession, config.portalUrl());

    SeleniumSession gazetteSession = register(new SeleniumSession("gazette", config.headless(), config.timeout()));
    DoWebGazetteAdapter gazette = new DoWebGazetteAdapter(
        gazetteSession, config.gazetteUrl(), DoWebGazetteAdapter.DEFAULT_DOWNLOAD_TEMPLATE, downloader,
        config.timeout());
    if (config.headless()) {
      log.warn("Headless browsers cannot show a CAPTCHA for manual resolution; blocked searches will be skipped");
    }
    CaptchaGate captchaGate = new CaptchaGate(
        gazette,
        new RecaptchaCheckboxSolver(gazetteSession, clock),
        new BrowserManualCaptchaSignal(gazette::captchaPresent, clock, MANUAL_CAPTCHA_POLL),
        metrics,
        config.captchaAutoAttempts(),
        config.captchaManualTimeout());
    PublicationSearchEngine search = new PublicationSearchEngine(
        gazette, captchaGate, new CandidateRanker(), textExtractor, extraction, metrics,
        config.tempDirectory(), config.maxCandidates());

    return new ConformityPipelineUseCase(
        config,
        companies(portal, renderWait),
        portal,
        new PathDiscoveryNavigator(portal, renderWait, config.filterYear()),
        new HttpContractSource(downloader, textExtractor, config.tempDirectory()),
        extraction,
        search,
        new ConformityEngine(),
        new JsonResultRepository(config.runDirectory()),
        new JsonCheckpointStore(config.checkpointDirectory()),
        metrics,
        clock);
  }

  /**
   * Builds the offline use case that evaluates stored contract/publication pairs.
   *
   * @param pairsDirectory directory of {@code *.pair.json} documents
   * @return conformity-only use case
   */
  public ConformityOnlyUseCase conformityOnlyUseCase(Path pairsDirectory) {
    return new ConformityOnlyUseCase(
        config.runId(),
        new JsonPairSource(pairsDirectory),
        new ConformityEngine(),
        new JsonResultRepository(config.runDirectory()),
        metrics,
        clock);
  }

  ExtractionService extractionService() {
    String apiKey = System.getenv(config.extractionApiKeyEnv());
    if (apiKey == null || apiKey.isBlank()) {
      log.warn("Environment variable {} is not set; extraction calls are sent without credentials",
          config.extractionApiKeyEnv());
    }
    log.info("Extraction service {} with model {}; API key from {}: {}",
        config.extractionEndpoint(), config.extractionModel(), config.extractionApiKeyEnv(), Logs.redact(apiKey));
    HttpExtractionAdapter adapter = new HttpExtractionAdapter(
        URI.create(config.extractionEndpoint()), config.extractionModel(), apiKey, config.timeout());
    RetryPolicy policy = RetryPolicy.rateLimited(
        config.retryMaxAttempts(), config.retryBaseDelay(), config.retryMultiplier(), config.retryJitter(),
        config.retryMaxDelay());
    return new ExtractionService(adapter, policy, clock, metrics);
  }

  private CompanySequence companies(ContasRioPortalAdapter portal, RenderWait renderWait) {
    CompanyRowParser parser = new CompanyRowParser();
    if (config.csvSeed().isPresent()) {
      Path seedFile = config.csvSeed().get();
      log.info("Company listing seeded from {}", seedFile);
      CsvCompanySeed seed = new CsvCompanySeed(seedFile, parser);
      return new CompanySequence(seed::load);
    }
    return new RowCollector(portal, renderWait, parser, config.maxScrollPasses()).companies(config.filterYear());
  }

  private <T extends AutoCloseable> T register(T resource) {
    resources.push(resource);
    return resource;
  }

  /** Closes browser sessions in reverse creation order; failures are logged and do not stop the others. */
  @Override
  public void close() {
    while (!resources.isEmpty()) {
      AutoCloseable resource = resources.pop();
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource, ex);
      }
    }
  }
}
