package br.rio.confere.application.pipeline;

import br.rio.confere.application.error.ConfereException;
import br.rio.confere.application.port.ClockPort;
import br.rio.confere.application.port.ConformityPairSource;
import br.rio.confere.application.port.MetricsPort;
import br.rio.confere.application.port.ResultRepository;
import br.rio.confere.domain.conformity.ConformityEngine;
import br.rio.confere.domain.conformity.ConformityPair;
import br.rio.confere.domain.conformity.ConformityResult;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Evaluates pre-extracted contract/publication pairs without touching either portal.
 */
public final class ConformityOnlyUseCase {
  private static final Logger log = LoggerFactory.getLogger(ConformityOnlyUseCase.class);

  private final String runId;
  private final ConformityPairSource pairs;
  private final ConformityEngine engine;
  private final ResultRepository repository;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public ConformityOnlyUseCase(
      String runId,
      ConformityPairSource pairs,
      ConformityEngine engine,
      ResultRepository repository,
      MetricsPort metrics,
      ClockPort clock) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.pairs = Objects.requireNonNull(pairs, "pairs");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Evaluates every pair.
   *
   * @param cancellation checked between pairs
   * @return run totals; unreadable pairs are counted as parse-error skips
   */
  public RunSummary run(CancellationToken cancellation) {
    RunSummary.Builder summary = new RunSummary.Builder(runId, Instant.ofEpochMilli(clock.nowMillis()));
    List<String> names = pairs.names();
    log.info("Evaluating {} conformity pairs", names.size());
    for (String name : names) {
      if (cancellation.cancelled()) {
        summary.cancelled();
        break;
      }
      try {
        ConformityPair pair = pairs.read(name);
        MDC.put(ConformityPipelineUseCase.MDC_PROCESSO, pair.publication().processo());
        ConformityResult result = engine.evaluate(pair.contract(), pair.publication());
        repository.saveConformity(result, null);
        summary.processed(result);
        metrics.increment("pipeline.unit.processed");
        log.info("Pair {} evaluated: {} (score {})", name, result.overallStatus(), result.conformityScore());
      } catch (ConfereException ex) {
        if (ex.fatal()) {
          throw ex;
        }
        SkipReason reason = SkipReason.of(ex);
        summary.skipped(name, null, reason, ex.getMessage());
        metrics.increment("pipeline.unit.skipped");
        log.warn("Skipping pair {} ({}): {}", name, reason, ex.getMessage());
      } finally {
        MDC.remove(ConformityPipelineUseCase.MDC_PROCESSO);
      }
    }
    RunSummary result = summary.build(Instant.ofEpochMilli(clock.nowMillis()));
    repository.saveRunSummary(result);
    return result;
  }
}
