package br.rio.confere.domain.contract;

import br.rio.confere.domain.processo.ProcessoId;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * <strong>What:</strong> Structured contract fields as extracted from a document.
 * <p><strong>Why:</strong> Both the signed contract and the gazette extract are reduced to this shape so the
 * conformity engine compares like with like.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Values are kept as text exactly as extracted: money in Brazilian format ({@code 1.234,56}),
 * dates as {@code dd/MM/yyyy} or ISO. Any field may be {@code null} when the document omits it.</p>
 *
 * @param processo canonical processo text, when known
 * @param numeroContrato contract number
 * @param valorContrato contract value text
 * @param dataAssinatura signing date text
 * @param objeto contract object description
 * @param partes contracting parties
 * @param prazo validity period
 */
public record ContractRecord(
    @JsonProperty("processo") String processo,
    @JsonProperty("numero_contrato") String numeroContrato,
    @JsonProperty("valor_contrato") String valorContrato,
    @JsonProperty("data_assinatura") String dataAssinatura,
    @JsonProperty("objeto") String objeto,
    @JsonProperty("partes") Partes partes,
    @JsonProperty("prazo") Prazo prazo) {

  /** Field keys produced by the extraction schemas. */
  public static final String PROCESSO = "processo";
  public static final String NUMERO_CONTRATO = "numero_contrato";
  public static final String VALOR_CONTRATO = "valor_contrato";
  public static final String DATA_ASSINATURA = "data_assinatura";
  public static final String OBJETO = "objeto";
  public static final String CONTRATANTE = "contratante";
  public static final String CONTRATADA = "contratada";
  public static final String DATA_INICIO = "data_inicio";
  public static final String DATA_FIM = "data_fim";

  public ContractRecord {
    processo = blankToNull(processo);
    if (processo != null) {
      processo = ProcessoId.normalize(processo);
    }
    numeroContrato = blankToNull(numeroContrato);
    valorContrato = blankToNull(valorContrato);
    dataAssinatura = blankToNull(dataAssinatura);
    objeto = blankToNull(objeto);
    partes = partes == null ? Partes.EMPTY : partes;
    prazo = prazo == null ? Prazo.EMPTY : prazo;
  }

  /**
   * Builds a record from a flat extraction result keyed by the constants above.
   *
   * @param fields extracted fields; missing keys map to {@code null}
   * @param fallbackProcesso processo to use when the document does not state one
   * @return contract record
   */
  public static ContractRecord fromFields(Map<String, String> fields, String fallbackProcesso) {
    String processo = blankToNull(fields.get(PROCESSO));
    return new ContractRecord(
        processo != null ? processo : fallbackProcesso,
        fields.get(NUMERO_CONTRATO),
        fields.get(VALOR_CONTRATO),
        fields.get(DATA_ASSINATURA),
        fields.get(OBJETO),
        new Partes(fields.get(CONTRATANTE), fields.get(CONTRATADA)),
        new Prazo(fields.get(DATA_INICIO), fields.get(DATA_FIM)));
  }

  /**
   * Contracting parties.
   *
   * @param contratante contracting public body
   * @param contratada contracted company
   */
  public record Partes(
      @JsonProperty("contratante") String contratante,
      @JsonProperty("contratada") String contratada) {
    static final Partes EMPTY = new Partes(null, null);

    public Partes {
      contratante = blankToNull(contratante);
      contratada = blankToNull(contratada);
    }
  }

  /**
   * Validity period.
   *
   * @param dataInicio start date text
   * @param dataFim end date text
   */
  public record Prazo(
      @JsonProperty("data_inicio") String dataInicio,
      @JsonProperty("data_fim") String dataFim) {
    static final Prazo EMPTY = new Prazo(null, null);

    public Prazo {
      dataInicio = blankToNull(dataInicio);
      dataFim = blankToNull(dataFim);
    }

    /** Returns {@code true} when neither bound is known. */
    public boolean empty() {
      return dataInicio == null && dataFim == null;
    }

    /** Human-readable period used when dates cannot be parsed. */
    public String describe() {
      if (empty()) {
        return null;
      }
      return (dataInicio == null ? "?" : dataInicio) + " a " + (dataFim == null ? "?" : dataFim);
    }
  }

  private static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.strip();
    if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("null")) {
      return null;
    }
    return trimmed;
  }
}
