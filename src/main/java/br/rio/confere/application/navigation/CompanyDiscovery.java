package br.rio.confere.application.navigation;

import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.navigation.NavigationPath;
import br.rio.confere.domain.processo.ProcessoLink;
import java.util.List;
import java.util.Objects;

/**
 * Links discovered for one company, plus the branches that were abandoned after timing out twice.
 *
 * @param company company walked
 * @param links unique processo links in discovery order
 * @param skippedBranches branches skipped after a retried timeout
 */
public record CompanyDiscovery(
    CompanyRecord company, List<ProcessoLink> links, List<NavigationPath> skippedBranches) {

  public CompanyDiscovery {
    Objects.requireNonNull(company, "company");
    links = List.copyOf(links);
    skippedBranches = List.copyOf(skippedBranches);
  }
}
