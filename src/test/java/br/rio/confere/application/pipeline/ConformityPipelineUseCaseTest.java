package br.rio.confere.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.application.error.PageLoadException;
import br.rio.confere.application.error.ParsingException;
import br.rio.confere.application.error.PersistenceException;
import br.rio.confere.application.error.PortalUnavailableException;
import br.rio.confere.application.extraction.ExtractionService;
import br.rio.confere.application.extraction.RetryPolicy;
import br.rio.confere.application.navigation.CompanySequence;
import br.rio.confere.application.navigation.PathDiscoveryNavigator;
import br.rio.confere.application.navigation.RenderWait;
import br.rio.confere.application.port.ContractSource;
import br.rio.confere.application.publication.CandidateRanker;
import br.rio.confere.application.publication.CaptchaGate;
import br.rio.confere.application.publication.PublicationSearchEngine;
import br.rio.confere.config.PipelineConfig;
import br.rio.confere.domain.checkpoint.Checkpoint;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.conformity.ConformityEngine;
import br.rio.confere.domain.conformity.ConformityResult;
import br.rio.confere.domain.navigation.NavigationState;
import br.rio.confere.testing.FakeGazette;
import br.rio.confere.testing.FakePortal;
import br.rio.confere.testing.InMemoryResults;
import br.rio.confere.testing.ManualClock;
import br.rio.confere.testing.RecordingMetrics;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConformityPipelineUseCaseTest {
  private static final String P1 = "SMS-PRO-2025/00001";
  private static final String P2 = "SMS-PRO-2025/00002";
  private static final String P3 = "SME-PRO-2025/00003";
  private static final CompanyRecord ACME = new CompanyRecord("11.111.111/0001-11", "ACME LTDA");
  private static final CompanyRecord BETA = new CompanyRecord("22.222.222/0001-22", "BETA SA");
  private static final Map<String, String> FIELDS = Map.of(
      "numero_contrato", "001/2025",
      "valor_contrato", "R$ 10.000,00",
      "data_assinatura", "01/03/2025",
      "objeto", "Manutenção predial");

  @TempDir
  Path temp;

  private final ManualClock clock = new ManualClock();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final InMemoryResults results = new InMemoryResults();
  private FakePortal portal;
  private FakeGazette gazette;
  private ContractSource contracts;

  @BeforeEach
  void setUp() {
    portal = new FakePortal()
        .links(ACME.companyId(), P1, P2)
        .links(BETA.companyId(), P3);
    gazette = new FakeGazette()
        .result(P1, 0, "10/03/2025", "EXTRATO DO CONTRATO " + P1, "EXTRATO DO CONTRATO processo " + P1)
        .result(P3, 0, "12/03/2025", "EXTRATO DO CONTRATO " + P3, "EXTRATO DO CONTRATO processo " + P3);
    contracts = link -> "CONTRATO processo " + link.processo();
  }

  @Test
  void fullRunEvaluatesEveryDiscoveredProcesso() throws Exception {
    RunSummary summary = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(false, new CancellationToken());

    assertEquals(2, summary.companiesListed());
    assertEquals(2, summary.companiesCompleted());
    assertEquals(3, summary.processosDiscovered());
    assertEquals(new RunSummary.Processed(2, 0, 1, 1), summary.processed());
    assertEquals(0, summary.skipped().total());
    assertFalse(summary.cancelled());
    assertEquals(List.of(P1, P2, P3), evaluated());
    assertEquals(3, results.contracts().size());
    assertEquals(List.of(summary), results.summaries());

    Checkpoint checkpoint = results.load("audit-1").orElseThrow();
    assertEquals(BETA.companyId(), checkpoint.lastProcessedCompanyId());
    assertEquals(3, checkpoint.processedProcessoIds().size());
    assertEquals(3, metrics.count("pipeline.unit.processed"));
  }

  @Test
  void unitFailuresAreSkippedByCategoryAndTheRunContinues() throws Exception {
    contracts = link -> {
      if (link.processo().equals(P1)) {
        throw new ParsingException("contract PDF has no text layer");
      }
      if (link.processo().equals(P2)) {
        throw new NavigationTimeoutException(null, "contract page did not render");
      }
      return "CONTRATO processo " + link.processo();
    };

    RunSummary summary = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(false, new CancellationToken());

    assertEquals(new RunSummary.Skipped(0, 1, 1, 0), summary.skipped());
    assertEquals(1, summary.processed().total());
    assertEquals(SkipReason.PARSE_ERROR, summary.skippedUnits().get(0).reason());
    assertEquals(ACME.companyId(), summary.skippedUnits().get(0).companyId());
    assertTrue(results.load("audit-1").orElseThrow().processoDone(P1));
    assertEquals(2, metrics.count("pipeline.unit.skipped"));
  }

  @Test
  void pageLoadFailureForOneProcessoSkipsOnlyThatUnit() throws Exception {
    contracts = link -> {
      if (link.processo().equals(P1)) {
        throw new PageLoadException("https://doweb.test/contrato/1", null);
      }
      return "CONTRATO processo " + link.processo();
    };

    RunSummary summary = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(false, new CancellationToken());

    assertEquals(List.of(P2, P3), evaluated());
    assertEquals(new RunSummary.Skipped(0, 1, 0, 0), summary.skipped());
    assertEquals(P1, summary.skippedUnits().get(0).processo());
    assertEquals(2, summary.companiesCompleted());
  }

  @Test
  void gazetteLoadFailureForOneProcessoSkipsOnlyThatUnit() throws Exception {
    gazette.failSearch(P1, new PageLoadException("https://doweb.test/buscanova/" + P1, null));

    RunSummary summary = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(false, new CancellationToken());

    assertEquals(List.of(P2, P3), evaluated());
    assertEquals(SkipReason.TIMEOUT, summary.skippedUnits().get(0).reason());
    assertTrue(results.load("audit-1").orElseThrow().processoDone(P1));
  }

  @Test
  void unexpectedRuntimeFailureInAUnitIsRecordedAsParseError() throws Exception {
    contracts = link -> {
      if (link.processo().equals(P1)) {
        throw new IllegalStateException("stale element reference: element is not attached to the page");
      }
      return "CONTRATO processo " + link.processo();
    };

    RunSummary summary = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(false, new CancellationToken());

    assertEquals(List.of(P2, P3), evaluated());
    RunSummary.SkippedUnit skipped = summary.skippedUnits().get(0);
    assertEquals(SkipReason.PARSE_ERROR, skipped.reason());
    assertTrue(skipped.message().startsWith("IllegalStateException: stale element"));
  }

  @Test
  void resetFailingForOneBranchSkipsThatBranchOnly() throws Exception {
    // first visit and its retry both fail to reload the portal
    portal.failResets(new PageLoadException("https://portal.test", null), 2);

    RunSummary summary = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(false, new CancellationToken());

    assertEquals(1, summary.branchesSkipped());
    assertEquals(List.of(P3), evaluated());
    assertEquals(2, summary.companiesCompleted());
  }

  @Test
  void discoveryFailureSkipsTheCompanyAndLeavesItForResume() throws Exception {
    portal.failResets(new IllegalStateException("browser session lost"), 1);

    RunSummary summary = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(false, new CancellationToken());

    assertEquals(List.of(P3), evaluated());
    assertEquals(1, summary.companiesCompleted());
    RunSummary.SkippedUnit skipped = summary.skippedUnits().get(0);
    assertNull(skipped.processo());
    assertEquals(ACME.companyId(), skipped.companyId());
    assertEquals(1, metrics.count("pipeline.company.failed"));
    Checkpoint checkpoint = results.load("audit-1").orElseThrow();
    assertFalse(checkpoint.companyDone(ACME.companyId()));
    assertTrue(checkpoint.companyDone(BETA.companyId()));
  }

  @Test
  void persistenceFailureStopsTheRun() {
    InMemoryResults failing = new InMemoryResults().failWrites();
    ConformityPipelineUseCase useCase =
        useCase(config(0), CompanySequence.of(List.of(ACME)), failing);

    assertThrows(PersistenceException.class, () -> useCase.run(false, new CancellationToken()));
  }

  @Test
  void maxLimitsTheCompaniesProcessed() throws Exception {
    RunSummary summary = useCase(config(1), CompanySequence.of(List.of(ACME, BETA)))
        .run(false, new CancellationToken());

    assertEquals(1, summary.companiesListed());
    assertEquals(List.of(P1, P2), evaluated());
  }

  @Test
  void cancelledRunResumesWithoutRepeatingOrLosingUnits() throws Exception {
    CancellationToken cancellation = new CancellationToken();
    ContractSource cancelAfterFirst = link -> {
      cancellation.cancel();
      return "CONTRATO processo " + link.processo();
    };
    contracts = cancelAfterFirst;

    RunSummary first = useCase(config(0), CompanySequence.of(List.of(ACME, BETA))).run(false, cancellation);

    assertTrue(first.cancelled());
    assertEquals(List.of(P1), evaluated());
    Checkpoint saved = results.load("audit-1").orElseThrow();
    assertEquals(List.of(P1), List.copyOf(saved.processedProcessoIds()));
    assertTrue(saved.processedCompanyIds().isEmpty());

    contracts = link -> "CONTRATO processo " + link.processo();
    RunSummary second = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(true, new CancellationToken());

    assertFalse(second.cancelled());
    assertEquals(List.of(P1, P2, P3), evaluated());
    assertEquals(2, second.processed().total());

    RunSummary third = useCase(config(0), CompanySequence.of(List.of(ACME, BETA)))
        .run(true, new CancellationToken());
    assertEquals(2, third.companiesResumed());
    assertEquals(0, third.processed().total());
    assertEquals(3, evaluated().size());
  }

  @Test
  void listingIsRetriedOnceAfterAHardReset() throws Exception {
    AtomicInteger loads = new AtomicInteger();
    CompanySequence flaky = new CompanySequence(() -> {
      if (loads.incrementAndGet() == 1) {
        throw new NavigationTimeoutException(NavigationState.FILTERED, "grid did not render");
      }
      return List.of(ACME);
    });

    RunSummary summary = useCase(config(0), flaky).run(false, new CancellationToken());

    assertEquals(2, loads.get());
    assertEquals(1, summary.companiesListed());
    // one reset for the listing retry, one for the company's discovery walk
    assertEquals(2, portal.resets());
  }

  @Test
  void listingFailingTwiceMeansThePortalIsUnavailable() {
    CompanySequence broken = new CompanySequence(() -> {
      throw new NavigationTimeoutException(NavigationState.FILTERED, "grid did not render");
    });

    PortalUnavailableException ex = assertThrows(PortalUnavailableException.class,
        () -> useCase(config(0), broken).run(false, new CancellationToken()));

    assertTrue(ex.fatal());
    assertTrue(results.load("audit-1").isEmpty());
  }

  private List<String> evaluated() {
    return results.conformity().stream().map(ConformityResult::processo).collect(Collectors.toList());
  }

  private PipelineConfig config(int max) {
    return PipelineConfig.fromMap(Map.of(
        "runId", "audit-1",
        "filterYear", "2025",
        "max", Integer.toString(max),
        "out", temp.resolve("out").toString(),
        "checkpointDir", temp.resolve("checkpoints").toString(),
        "tempDir", temp.resolve("tmp").toString()));
  }

  private ConformityPipelineUseCase useCase(PipelineConfig config, CompanySequence companies) {
    return useCase(config, companies, results);
  }

  private ConformityPipelineUseCase useCase(
      PipelineConfig config, CompanySequence companies, InMemoryResults store) {
    try {
      Files.createDirectories(config.tempDirectory());
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    RenderWait wait = new RenderWait(clock, Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofSeconds(1));
    ExtractionService extraction = new ExtractionService(
        request -> FIELDS, RetryPolicy.rateLimited(2, Duration.ofMillis(100), 2.0, 0.0), clock, metrics);
    CaptchaGate gate = new CaptchaGate(gazette, gazette::solveOnce, timeout -> false, metrics, 1, Duration.ofSeconds(5));
    PublicationSearchEngine search = new PublicationSearchEngine(
        gazette, gate, new CandidateRanker(), file -> readText(file), extraction, metrics, config.tempDirectory(), 3);
    return new ConformityPipelineUseCase(
        config,
        companies,
        portal,
        new PathDiscoveryNavigator(portal, wait, config.filterYear()),
        link -> contracts.contractText(link),
        extraction,
        search,
        new ConformityEngine(),
        store,
        store,
        metrics,
        clock);
  }

  private static String readText(Path file) {
    try {
      return Files.readString(file);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
