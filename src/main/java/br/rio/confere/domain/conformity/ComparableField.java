package br.rio.confere.domain.conformity;

import br.rio.confere.domain.contract.ContractRecord;
import java.util.function.Function;

/**
 * Fields compared between contract and publication, with the comparator kind each uses.
 */
public enum ComparableField {
  CONTRATANTE("contratante", Kind.TEXT, record -> record.partes().contratante()),
  CONTRATADA("contratada", Kind.TEXT, record -> record.partes().contratada()),
  OBJETO("objeto", Kind.TEXT, ContractRecord::objeto),
  VALOR_CONTRATO("valor_contrato", Kind.MONEY, ContractRecord::valorContrato),
  NUMERO_CONTRATO("numero_contrato", Kind.IDENTIFIER, ContractRecord::numeroContrato),
  DATA_ASSINATURA("data_assinatura", Kind.DATE, ContractRecord::dataAssinatura),
  PRAZO("prazo", Kind.PERIOD, record -> record.prazo().describe());

  /** How values of a field are compared. */
  public enum Kind {
    TEXT,
    MONEY,
    IDENTIFIER,
    DATE,
    PERIOD
  }

  private final String fieldName;
  private final Kind kind;
  private final Function<ContractRecord, String> accessor;

  ComparableField(String fieldName, Kind kind, Function<ContractRecord, String> accessor) {
    this.fieldName = fieldName;
    this.kind = kind;
    this.accessor = accessor;
  }

  public String fieldName() {
    return fieldName;
  }

  public Kind kind() {
    return kind;
  }

  /** Reads this field's display value from a record. */
  public String read(ContractRecord record) {
    return accessor.apply(record);
  }
}
