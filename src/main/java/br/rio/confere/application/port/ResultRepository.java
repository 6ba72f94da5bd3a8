package br.rio.confere.application.port;

import br.rio.confere.application.pipeline.RunSummary;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.conformity.ConformityResult;
import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.publication.PublicationResult;

/**
 * Persists per-processo artifacts and the run summary.
 *
 * <p>All methods throw {@link br.rio.confere.application.error.PersistenceException} on write failure.</p>
 */
public interface ResultRepository {
  void saveContract(String processo, ContractRecord contract);

  void savePublication(PublicationResult publication);

  /**
   * Stores a verdict and appends its row to the tabular summary.
   *
   * @param result verdict
   * @param company owning company, {@code null} in conformity-only runs
   */
  void saveConformity(ConformityResult result, CompanyRecord company);

  void saveRunSummary(RunSummary summary);
}
