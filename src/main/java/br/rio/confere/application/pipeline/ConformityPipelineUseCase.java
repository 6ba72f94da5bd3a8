package br.rio.confere.application.pipeline;

import br.rio.confere.application.error.ConfereException;
import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.application.error.PortalUnavailableException;
import br.rio.confere.application.extraction.ExtractionService;
import br.rio.confere.application.navigation.CompanyDiscovery;
import br.rio.confere.application.navigation.CompanySequence;
import br.rio.confere.application.navigation.PathDiscoveryNavigator;
import br.rio.confere.application.port.CheckpointStore;
import br.rio.confere.application.port.ClockPort;
import br.rio.confere.application.port.ContractSource;
import br.rio.confere.application.port.MetricsPort;
import br.rio.confere.application.port.PortalAdapter;
import br.rio.confere.application.port.ResultRepository;
import br.rio.confere.application.publication.PublicationSearchEngine;
import br.rio.confere.config.PipelineConfig;
import br.rio.confere.domain.checkpoint.Checkpoint;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.conformity.ConformityEngine;
import br.rio.confere.domain.conformity.ConformityResult;
import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.processo.ProcessoLink;
import br.rio.confere.domain.publication.PublicationResult;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs discovery, publication search, and conformity for every company of a run.
 * <p><strong>Why:</strong> Auditors need one resumable batch that leaves an auditable trail per processo.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating navigation, search, extraction, and storage.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the company listing, retrying once after a hard portal reset.</li>
 *   <li>Walk each company, skipping companies and processos the checkpoint already holds.</li>
 *   <li>Isolate unit and company failures into skip categories; stop only on fatal failures.</li>
 *   <li>Persist the checkpoint after every unit and on cancellation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one sequential worker per browser session.</p>
 * <p><strong>Observability:</strong> MDC keys {@code company}, {@code processo}, {@code state}; counters
 * {@code pipeline.unit.processed}, {@code pipeline.unit.skipped}, {@code pipeline.company.completed}.</p>
 */
public final class ConformityPipelineUseCase {
  private static final Logger log = LoggerFactory.getLogger(ConformityPipelineUseCase.class);
  static final String MDC_COMPANY = "company";
  static final String MDC_PROCESSO = "processo";
  static final String MDC_STATE = "state";

  private final PipelineConfig config;
  private final CompanySequence companies;
  private final PortalAdapter portal;
  private final PathDiscoveryNavigator navigator;
  private final ContractSource contractSource;
  private final ExtractionService extraction;
  private final PublicationSearchEngine searchEngine;
  private final ConformityEngine conformityEngine;
  private final ResultRepository repository;
  private final CheckpointStore checkpoints;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public ConformityPipelineUseCase(
      PipelineConfig config,
      CompanySequence companies,
      PortalAdapter portal,
      PathDiscoveryNavigator navigator,
      ContractSource contractSource,
      ExtractionService extraction,
      PublicationSearchEngine searchEngine,
      ConformityEngine conformityEngine,
      ResultRepository repository,
      CheckpointStore checkpoints,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.companies = Objects.requireNonNull(companies, "companies");
    this.portal = Objects.requireNonNull(portal, "portal");
    this.navigator = Objects.requireNonNull(navigator, "navigator");
    this.contractSource = Objects.requireNonNull(contractSource, "contractSource");
    this.extraction = Objects.requireNonNull(extraction, "extraction");
    this.searchEngine = Objects.requireNonNull(searchEngine, "searchEngine");
    this.conformityEngine = Objects.requireNonNull(conformityEngine, "conformityEngine");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Executes the run.
   *
   * @param resume when {@code true} continue from the stored checkpoint of {@code runId}
   * @param cancellation checked between units
   * @return run totals, also persisted as the run summary
   * @throws PortalUnavailableException when the company listing cannot be loaded after a reset; page load
   *     failures later in the run only skip the affected unit or company
   * @throws br.rio.confere.application.error.PersistenceException when results or checkpoints cannot be written
   * @throws InterruptedException when the worker thread is interrupted
   */
  public RunSummary run(boolean resume, CancellationToken cancellation) throws InterruptedException {
    Objects.requireNonNull(cancellation, "cancellation");
    String runId = config.runId();
    Checkpoint checkpoint = resume
        ? checkpoints.load(runId).orElseGet(() -> Checkpoint.start(runId))
        : Checkpoint.start(runId);
    if (resume) {
      log.info("Resuming run {}: {} companies and {} processos already handled",
          runId, checkpoint.processedCompanyIds().size(), checkpoint.processedProcessoIds().size());
    }

    RunSummary.Builder summary = new RunSummary.Builder(runId, Instant.ofEpochMilli(clock.nowMillis()));
    List<CompanyRecord> listing = limit(loadCompanies());
    summary.companiesListed(listing.size());
    log.info("Run {} covering {} companies for year {}", runId, listing.size(), config.filterYear());

    for (CompanyRecord company : listing) {
      if (cancellation.cancelled()) {
        break;
      }
      if (checkpoint.companyDone(company.companyId())) {
        summary.companyResumed();
        continue;
      }
      MDC.put(MDC_COMPANY, company.companyId());
      try {
        checkpoint = processCompany(company, checkpoint, summary, cancellation);
      } finally {
        MDC.remove(MDC_COMPANY);
      }
    }
    // Units already saved their own checkpoints; this flush covers cancellation and empty runs.
    checkpoints.save(checkpoint);

    if (cancellation.cancelled()) {
      summary.cancelled();
      log.warn("Run {} cancelled; checkpoint flushed", runId);
    }
    RunSummary result = summary.build(Instant.ofEpochMilli(clock.nowMillis()));
    repository.saveRunSummary(result);
    log.info("Run {} finished: {} processed ({} conforme, {} parcial, {} nao conforme), {} skipped",
        runId,
        result.processed().total(),
        result.processed().conforme(),
        result.processed().parcial(),
        result.processed().naoConforme(),
        result.skipped().total());
    return result;
  }

  private Checkpoint processCompany(
      CompanyRecord company, Checkpoint checkpoint, RunSummary.Builder summary, CancellationToken cancellation)
      throws InterruptedException {
    CompanyDiscovery discovery;
    try {
      discovery = navigator.discover(company);
    } catch (RuntimeException ex) {
      rethrowFatal(ex);
      // left out of the checkpoint so a resume walks the company again
      SkipReason reason = reasonFor(ex);
      summary.skipped(null, company.companyId(), reason, describe(ex));
      metrics.increment("pipeline.company.failed");
      log.warn("Skipping company {} ({}): discovery failed in state {}",
          company.companyId(), reason, MDC.get(MDC_STATE), ex);
      return checkpoint;
    } finally {
      MDC.remove(MDC_STATE);
    }
    summary.discovered(discovery.links().size(), discovery.skippedBranches().size());

    Checkpoint current = checkpoint;
    for (ProcessoLink link : discovery.links()) {
      if (cancellation.cancelled()) {
        return current;
      }
      if (current.processoDone(link.processo())) {
        continue;
      }
      MDC.put(MDC_PROCESSO, link.processo());
      try {
        processUnit(company, link, summary);
      } finally {
        MDC.remove(MDC_PROCESSO);
        MDC.remove(MDC_STATE);
      }
      current = current.withProcesso(link.processo());
      checkpoints.save(current);
    }
    current = current.withCompany(company.companyId());
    checkpoints.save(current);
    summary.companyCompleted();
    metrics.increment("pipeline.company.completed");
    return current;
  }

  private void processUnit(CompanyRecord company, ProcessoLink link, RunSummary.Builder summary)
      throws InterruptedException {
    String processo = link.processo();
    try {
      ContractRecord contract = extraction.extractContract(contractSource.contractText(link), processo);
      repository.saveContract(processo, contract);

      PublicationResult publication = searchEngine.search(processo);
      repository.savePublication(publication);

      ConformityResult result = conformityEngine.evaluate(contract, publication);
      repository.saveConformity(result, company);
      summary.processed(result);
      metrics.increment("pipeline.unit.processed");
      log.info("Processo {} evaluated: {} (score {}, timely {})",
          processo, result.overallStatus(), result.conformityScore(), result.timely());
    } catch (RuntimeException ex) {
      rethrowFatal(ex);
      SkipReason reason = reasonFor(ex);
      summary.skipped(processo, company.companyId(), reason, describe(ex));
      metrics.increment("pipeline.unit.skipped");
      if (ex instanceof ConfereException) {
        log.warn("Skipping processo {} ({}) in state {}: {}",
            processo, reason, MDC.get(MDC_STATE), ex.getMessage());
      } else {
        log.error("Skipping processo {} ({}) after unexpected failure in state {}",
            processo, reason, MDC.get(MDC_STATE), ex);
      }
    }
  }

  private static void rethrowFatal(RuntimeException ex) {
    if (ex instanceof ConfereException && ((ConfereException) ex).fatal()) {
      throw ex;
    }
  }

  /** Unexpected runtime failures come from pages or documents the adapters could not interpret. */
  private static SkipReason reasonFor(RuntimeException ex) {
    return ex instanceof ConfereException ? SkipReason.of((ConfereException) ex) : SkipReason.PARSE_ERROR;
  }

  private static String describe(RuntimeException ex) {
    if (ex instanceof ConfereException) {
      return ex.getMessage();
    }
    String type = ex.getClass().getSimpleName();
    return ex.getMessage() == null ? type : type + ": " + ex.getMessage();
  }

  private List<CompanyRecord> loadCompanies() throws InterruptedException {
    try {
      return companies.records();
    } catch (NavigationTimeoutException first) {
      log.warn("Company listing failed ({}); retrying after a hard reset", first.getMessage());
      companies.restart();
      try {
        portal.reset();
        return companies.records();
      } catch (NavigationTimeoutException second) {
        throw new PortalUnavailableException("company listing could not be loaded after reset", second);
      }
    }
  }

  private List<CompanyRecord> limit(List<CompanyRecord> listing) {
    int max = config.maxCompanies();
    if (max > 0 && listing.size() > max) {
      return listing.subList(0, max);
    }
    return listing;
  }
}
