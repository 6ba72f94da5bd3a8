package br.rio.confere.domain.checkpoint;

import br.rio.confere.domain.processo.ProcessoId;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Durable cursor over the companies and processos a run has already handled.
 * <p><strong>Why:</strong> Long runs are interrupted by CAPTCHA fatigue, portal outages, and operators;
 * resuming must neither repeat nor drop work.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@code with*} methods return new instances.</p>
 *
 * @param runId run identifier
 * @param lastProcessedCompanyId most recently completed company, {@code null} before the first one
 * @param processedCompanyIds completed companies in completion order
 * @param processedProcessoIds handled processos (processed or terminally skipped) in completion order
 */
public record Checkpoint(
    @JsonProperty("run_id") String runId,
    @JsonProperty("last_processed_company_id") String lastProcessedCompanyId,
    @JsonProperty("processed_company_ids") Set<String> processedCompanyIds,
    @JsonProperty("processed_processo_ids") Set<String> processedProcessoIds) {

  public Checkpoint {
    Objects.requireNonNull(runId, "runId");
    processedCompanyIds = freeze(processedCompanyIds);
    processedProcessoIds = freeze(processedProcessoIds);
  }

  /** Empty checkpoint for a fresh run. */
  public static Checkpoint start(String runId) {
    return new Checkpoint(runId, null, Set.of(), Set.of());
  }

  /** Records a handled processo. */
  public Checkpoint withProcesso(String processo) {
    Set<String> next = new LinkedHashSet<>(processedProcessoIds);
    next.add(ProcessoId.normalize(processo));
    return new Checkpoint(runId, lastProcessedCompanyId, processedCompanyIds, next);
  }

  /** Records a completed company. */
  public Checkpoint withCompany(String companyId) {
    Objects.requireNonNull(companyId, "companyId");
    Set<String> next = new LinkedHashSet<>(processedCompanyIds);
    next.add(companyId);
    return new Checkpoint(runId, companyId, next, processedProcessoIds);
  }

  public boolean companyDone(String companyId) {
    return processedCompanyIds.contains(companyId);
  }

  public boolean processoDone(String processo) {
    return processedProcessoIds.contains(ProcessoId.normalize(processo));
  }

  private static Set<String> freeze(Set<String> values) {
    if (values == null || values.isEmpty()) {
      return Set.of();
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(values));
  }
}
