package br.rio.confere.application.pipeline;

import br.rio.confere.domain.conformity.ConformityResult;
import br.rio.confere.domain.conformity.OverallStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Totals of one run, written as {@code run-summary.json}.
 * <p><strong>Why:</strong> Processed verdicts and skipped units are reported separately so a skipped unit is never
 * read as a non-conformity.</p>
 *
 * @param runId run identifier
 * @param startedAt start time
 * @param finishedAt end time
 * @param cancelled whether the run stopped on a cancellation request
 * @param companiesListed companies in the listing after the limit
 * @param companiesCompleted companies fully walked in this invocation
 * @param companiesResumed companies skipped because a previous invocation completed them
 * @param processosDiscovered processo links discovered in this invocation
 * @param branchesSkipped navigation branches abandoned after a retried timeout
 * @param processed verdict counts
 * @param skipped skip counts by category
 * @param skippedUnits detail of every skipped unit
 */
public record RunSummary(
    @JsonProperty("run_id") String runId,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("cancelled") boolean cancelled,
    @JsonProperty("companies_listed") int companiesListed,
    @JsonProperty("companies_completed") int companiesCompleted,
    @JsonProperty("companies_resumed") int companiesResumed,
    @JsonProperty("processos_discovered") int processosDiscovered,
    @JsonProperty("branches_skipped") int branchesSkipped,
    @JsonProperty("processed") Processed processed,
    @JsonProperty("skipped") Skipped skipped,
    @JsonProperty("skipped_units") List<SkippedUnit> skippedUnits) {

  public RunSummary {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(processed, "processed");
    Objects.requireNonNull(skipped, "skipped");
    skippedUnits = skippedUnits == null ? List.of() : List.copyOf(skippedUnits);
  }

  /**
   * Verdict counts. {@code notLocated} is a subset of {@code naoConforme}.
   *
   * @param conforme CONFORME verdicts
   * @param parcial PARCIAL verdicts
   * @param naoConforme NAO_CONFORME verdicts
   * @param notLocated verdicts whose publication was not located
   */
  public record Processed(
      @JsonProperty("conforme") int conforme,
      @JsonProperty("parcial") int parcial,
      @JsonProperty("nao_conforme") int naoConforme,
      @JsonProperty("not_located") int notLocated) {
    public int total() {
      return conforme + parcial + naoConforme;
    }
  }

  /**
   * Skip counts by category.
   *
   * @param captcha CAPTCHA not resolved
   * @param timeout navigation timeouts
   * @param parseError unreadable documents
   * @param extraction extraction service failures
   */
  public record Skipped(
      @JsonProperty("captcha") int captcha,
      @JsonProperty("timeout") int timeout,
      @JsonProperty("parse_error") int parseError,
      @JsonProperty("extraction") int extraction) {
    public int total() {
      return captcha + timeout + parseError + extraction;
    }
  }

  /**
   * One skipped unit. A company whose discovery failed is recorded with a {@code null} processo.
   *
   * @param processo processo, {@code null} for a company-level skip
   * @param companyId owning company, may be {@code null}
   * @param reason category
   * @param message failure message
   */
  public record SkippedUnit(
      @JsonProperty("processo") String processo,
      @JsonProperty("company_id") String companyId,
      @JsonProperty("reason") SkipReason reason,
      @JsonProperty("message") String message) {}

  /** Mutable accumulator used while a run is in progress. Not thread-safe. */
  public static final class Builder {
    private final String runId;
    private final Instant startedAt;
    private final Map<OverallStatus, Integer> verdicts = new EnumMap<>(OverallStatus.class);
    private final Map<SkipReason, Integer> skips = new EnumMap<>(SkipReason.class);
    private final List<SkippedUnit> skippedUnits = new ArrayList<>();
    private int notLocated;
    private int companiesListed;
    private int companiesCompleted;
    private int companiesResumed;
    private int processosDiscovered;
    private int branchesSkipped;
    private boolean cancelled;

    public Builder(String runId, Instant startedAt) {
      this.runId = Objects.requireNonNull(runId, "runId");
      this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public Builder companiesListed(int count) {
      this.companiesListed = count;
      return this;
    }

    public Builder companyCompleted() {
      companiesCompleted++;
      return this;
    }

    public Builder companyResumed() {
      companiesResumed++;
      return this;
    }

    public Builder discovered(int links, int skippedBranches) {
      processosDiscovered += links;
      branchesSkipped += skippedBranches;
      return this;
    }

    public Builder processed(ConformityResult result) {
      verdicts.merge(result.overallStatus(), 1, Integer::sum);
      if (!result.publicationLocated()) {
        notLocated++;
      }
      return this;
    }

    public Builder skipped(String processo, String companyId, SkipReason reason, String message) {
      skips.merge(reason, 1, Integer::sum);
      skippedUnits.add(new SkippedUnit(processo, companyId, reason, message));
      return this;
    }

    public Builder cancelled() {
      this.cancelled = true;
      return this;
    }

    public RunSummary build(Instant finishedAt) {
      return new RunSummary(
          runId,
          startedAt,
          finishedAt,
          cancelled,
          companiesListed,
          companiesCompleted,
          companiesResumed,
          processosDiscovered,
          branchesSkipped,
          new Processed(
              count(verdicts, OverallStatus.CONFORME),
              count(verdicts, OverallStatus.PARCIAL),
              count(verdicts, OverallStatus.NAO_CONFORME),
              notLocated),
          new Skipped(
              count(skips, SkipReason.CAPTCHA),
              count(skips, SkipReason.TIMEOUT),
              count(skips, SkipReason.PARSE_ERROR),
              count(skips, SkipReason.EXTRACTION)),
          skippedUnits);
    }

    private static <K> int count(Map<K, Integer> counts, K key) {
      return counts.getOrDefault(key, 0);
    }
  }
}
