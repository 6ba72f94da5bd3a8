package br.rio.confere.domain.company;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Company (favorecido) listed by the contracts portal for the selected year.
 *
 * @param companyId tax identifier text (CNPJ or CPF) exactly as the portal renders it
 * @param name company name
 */
public record CompanyRecord(
    @JsonProperty("company_id") String companyId,
    @JsonProperty("name") String name) {

  @JsonCreator
  public CompanyRecord {
    companyId = requireText("companyId", companyId);
    name = requireText("name", name);
  }

  private static String requireText(String label, String value) {
    String trimmed = Objects.requireNonNull(value, label).trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    return trimmed;
  }
}
