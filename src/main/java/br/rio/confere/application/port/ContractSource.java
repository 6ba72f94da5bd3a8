package br.rio.confere.application.port;

import br.rio.confere.domain.processo.ProcessoLink;

/** Supplies the text of the signed contract behind a processo link. */
public interface ContractSource {
  /**
   * Fetches and extracts the contract document text.
   *
   * @param link discovered processo link
   * @return contract text
   * @throws br.rio.confere.application.error.ParsingException when the document cannot be fetched or read
   */
  String contractText(ProcessoLink link);
}
