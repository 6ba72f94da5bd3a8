package br.rio.confere.application.extraction;

import br.rio.confere.domain.contract.ContractRecord;
import java.util.List;

/**
 * Field sets requested from the extraction service for each document kind.
 */
public enum ExtractionSchema {
  /** Signed contract document. */
  CONTRACT(
      "contrato administrativo assinado",
      List.of(
          ContractRecord.PROCESSO,
          ContractRecord.NUMERO_CONTRATO,
          ContractRecord.VALOR_CONTRATO,
          ContractRecord.DATA_ASSINATURA,
          ContractRecord.OBJETO,
          ContractRecord.CONTRATANTE,
          ContractRecord.CONTRATADA,
          ContractRecord.DATA_INICIO,
          ContractRecord.DATA_FIM)),
  /** Extract of a contract published in the gazette. */
  PUBLICATION(
      "extrato de contrato publicado no Diário Oficial",
      List.of(
          ContractRecord.PROCESSO,
          ContractRecord.NUMERO_CONTRATO,
          ContractRecord.VALOR_CONTRATO,
          ContractRecord.DATA_ASSINATURA,
          ContractRecord.OBJETO,
          ContractRecord.CONTRATANTE,
          ContractRecord.CONTRATADA,
          ContractRecord.DATA_INICIO,
          ContractRecord.DATA_FIM));

  private final String documentKind;
  private final List<String> fields;

  ExtractionSchema(String documentKind, List<String> fields) {
    this.documentKind = documentKind;
    this.fields = fields;
  }

  /** Description of the document, used in the instructions sent to the service. */
  public String documentKind() {
    return documentKind;
  }

  /** Field names expected in the answer. */
  public List<String> fields() {
    return fields;
  }
}
