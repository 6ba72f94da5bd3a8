package br.rio.confere.domain.publication;

import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.processo.ProcessoId;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of searching the gazette for one processo.
 * <p><strong>Why:</strong> Auditors need the candidates that were considered, not only the winner.</p>
 * <p><strong>Auditability:</strong> {@code publicationFound == false} means no confirmed match was located;
 * it never states that the contract was not published.</p>
 *
 * @param processo canonical processo searched
 * @param publicationFound whether a matching publication was confirmed
 * @param publicationDate edition date text of the confirmed match
 * @param publicationUrl document URL of the confirmed match
 * @param editionNumber edition of the confirmed match
 * @param pageNumber page of the confirmed match
 * @param tipoExtrato extract heading recognized in the match, e.g. {@code EXTRATO DO CONTRATO}
 * @param extractedFields fields extracted from the publication, {@code null} when not located
 * @param searchResultItems ranked candidates returned by the search
 */
public record PublicationResult(
    @JsonProperty("processo") String processo,
    @JsonProperty("publication_found") boolean publicationFound,
    @JsonProperty("publication_date") String publicationDate,
    @JsonProperty("publication_url") String publicationUrl,
    @JsonProperty("edition_number") String editionNumber,
    @JsonProperty("page_number") String pageNumber,
    @JsonProperty("tipo_extrato") String tipoExtrato,
    @JsonProperty("extracted_fields") ContractRecord extractedFields,
    @JsonProperty("search_result_items") List<SearchResultItem> searchResultItems) {

  public PublicationResult {
    processo = ProcessoId.normalize(Objects.requireNonNull(processo, "processo"));
    searchResultItems = searchResultItems == null ? List.of() : List.copyOf(searchResultItems);
    if (publicationFound && extractedFields == null) {
      throw new IllegalArgumentException("a located publication must carry extracted fields");
    }
  }

  /**
   * Creates a result for a search that located no confirmed match.
   *
   * @param processo processo searched
   * @param candidates candidates seen, possibly empty
   * @return not-located result
   */
  public static PublicationResult notLocated(String processo, List<SearchResultItem> candidates) {
    return new PublicationResult(processo, false, null, null, null, null, null, null, candidates);
  }

  /**
   * Creates a result for a confirmed match.
   *
   * @param processo processo searched
   * @param match the candidate whose document mentioned the processo
   * @param publicationUrl document URL
   * @param tipoExtrato extract heading, may be {@code null}
   * @param fields extracted fields
   * @param candidates all ranked candidates
   * @return located result
   */
  public static PublicationResult located(
      String processo,
      SearchResultItem match,
      String publicationUrl,
      String tipoExtrato,
      ContractRecord fields,
      List<SearchResultItem> candidates) {
    Objects.requireNonNull(match, "match");
    return new PublicationResult(
        processo,
        true,
        match.publicationDate(),
        publicationUrl,
        match.editionNumber(),
        match.pageNumber(),
        tipoExtrato,
        Objects.requireNonNull(fields, "fields"),
        candidates);
  }
}
