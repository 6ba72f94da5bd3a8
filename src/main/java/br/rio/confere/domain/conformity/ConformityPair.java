package br.rio.confere.domain.conformity;

import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.publication.PublicationResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Pre-extracted contract and publication evaluated without touching the portals.
 *
 * @param contract contract fields
 * @param publication publication search outcome
 */
public record ConformityPair(
    @JsonProperty("contract") ContractRecord contract,
    @JsonProperty("publication") PublicationResult publication) {

  public ConformityPair {
    Objects.requireNonNull(contract, "contract");
    Objects.requireNonNull(publication, "publication");
  }
}
