package br.rio.confere.domain.publication;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * One row of the gazette search results page.
 *
 * @param index position on the results page, zero-based
 * @param publicationDate edition date text ({@code dd/MM/yyyy}) when shown
 * @param editionNumber edition identifier used for downloads
 * @param pageNumber page of the edition holding the match
 * @param previewText text snippet rendered for the result
 * @param downloadLink direct document link, if the portal exposes one
 * @param extrato whether the snippet is a contract extract entry
 * @param mentionsProcesso whether the snippet contains the searched processo
 */
public record SearchResultItem(
    @JsonProperty("index") int index,
    @JsonProperty("publication_date") String publicationDate,
    @JsonProperty("edition_number") String editionNumber,
    @JsonProperty("page_number") String pageNumber,
    @JsonProperty("preview_text") String previewText,
    @JsonProperty("download_link") String downloadLink,
    @JsonProperty("extrato") boolean extrato,
    @JsonProperty("mentions_processo") boolean mentionsProcesso) {

  public SearchResultItem {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    previewText = Objects.requireNonNullElse(previewText, "");
  }

  /** Returns a copy flagged with the classification computed by the ranker. */
  public SearchResultItem classified(boolean extrato, boolean mentionsProcesso) {
    return new SearchResultItem(
        index, publicationDate, editionNumber, pageNumber, previewText, downloadLink,
        extrato, mentionsProcesso);
  }
}
