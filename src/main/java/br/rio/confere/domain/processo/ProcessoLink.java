package br.rio.confere.domain.processo;

import br.rio.confere.domain.navigation.NavigationPath;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Processo reference discovered at the leaf of a navigation path.
 *
 * @param processo canonical processo text
 * @param url link to the processo document on the portal; may be {@code null}
 * @param companyId owning company identifier
 * @param companyName owning company name
 * @param path navigation path the link was collected under
 */
public record ProcessoLink(
    @JsonProperty("processo") String processo,
    @JsonProperty("url") String url,
    @JsonProperty("company_id") String companyId,
    @JsonProperty("company_name") String companyName,
    @JsonProperty("path") NavigationPath path) {

  public ProcessoLink {
    processo = ProcessoId.normalize(Objects.requireNonNull(processo, "processo"));
    Objects.requireNonNull(companyId, "companyId");
    Objects.requireNonNull(path, "path");
    if (!companyId.equals(path.companyId())) {
      throw new IllegalArgumentException(
          "link company " + companyId + " does not own path " + path);
    }
  }
}
