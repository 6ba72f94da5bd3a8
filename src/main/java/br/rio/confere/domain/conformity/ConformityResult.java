package br.rio.confere.domain.conformity;

import br.rio.confere.domain.processo.ProcessoId;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Conformity verdict for one processo, the unit reported to auditors.
 * <p><strong>Invariant:</strong> when the publication was not located the status is
 * {@link OverallStatus#NAO_CONFORME}, field checks are empty, and timeliness is unknown.</p>
 *
 * @param processo canonical processo
 * @param overallStatus verdict
 * @param conformityScore mean field ratio scaled to {@code [0, 100]}
 * @param timely {@code true}/{@code false}, or {@code null} when unknown
 * @param daysDifference publication date minus signing date, or {@code null} when unknown
 * @param publicationLocated whether a matching publication was confirmed
 * @param fieldChecks per-field comparisons
 */
public record ConformityResult(
    @JsonProperty("processo") String processo,
    @JsonProperty("overall_status") OverallStatus overallStatus,
    @JsonProperty("conformity_score") int conformityScore,
    @JsonProperty("timely") Boolean timely,
    @JsonProperty("days_difference") Integer daysDifference,
    @JsonProperty("publication_located") boolean publicationLocated,
    @JsonProperty("field_checks") List<FieldCheck> fieldChecks) {

  public ConformityResult {
    processo = ProcessoId.normalize(Objects.requireNonNull(processo, "processo"));
    Objects.requireNonNull(overallStatus, "overallStatus");
    fieldChecks = fieldChecks == null ? List.of() : List.copyOf(fieldChecks);
    if (conformityScore < 0 || conformityScore > 100) {
      throw new IllegalArgumentException("conformityScore must be within [0, 100]");
    }
    if (!publicationLocated) {
      if (overallStatus != OverallStatus.NAO_CONFORME
          || !fieldChecks.isEmpty()
          || timely != null
          || daysDifference != null) {
        throw new IllegalArgumentException(
            "a publication that was not located cannot carry timeliness or field checks");
      }
    }
  }

  /**
   * Result for a publication that was not located.
   *
   * @param processo canonical processo
   * @return not-located verdict
   */
  public static ConformityResult notLocated(String processo) {
    return new ConformityResult(processo, OverallStatus.NAO_CONFORME, 0, null, null, false, List.of());
  }
}
