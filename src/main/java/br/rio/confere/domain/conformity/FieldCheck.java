package br.rio.confere.domain.conformity;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Comparison of one field between contract and publication.
 *
 * @param fieldName compared field, e.g. {@code contratante}
 * @param contractValue value from the contract, may be {@code null}
 * @param publicationValue value from the publication, may be {@code null}
 * @param matchLevel level derived from the score
 * @param similarityScore ratio in {@code [0, 1]}
 */
public record FieldCheck(
    @JsonProperty("field_name") String fieldName,
    @JsonProperty("contract_value") String contractValue,
    @JsonProperty("publication_value") String publicationValue,
    @JsonProperty("match_level") MatchLevel matchLevel,
    @JsonProperty("similarity_score") double similarityScore) {

  public FieldCheck {
    Objects.requireNonNull(fieldName, "fieldName");
    Objects.requireNonNull(matchLevel, "matchLevel");
    if (matchLevel != MatchLevel.fromRatio(similarityScore)) {
      throw new IllegalArgumentException(
          "match level " + matchLevel + " does not agree with score " + similarityScore);
    }
  }

  /**
   * Creates a check whose level is derived from {@code score}.
   *
   * @param fieldName compared field
   * @param contractValue contract side
   * @param publicationValue publication side
   * @param score similarity ratio
   * @return field check
   */
  public static FieldCheck of(String fieldName, String contractValue, String publicationValue, double score) {
    return new FieldCheck(fieldName, contractValue, publicationValue, MatchLevel.fromRatio(score), score);
  }
}
