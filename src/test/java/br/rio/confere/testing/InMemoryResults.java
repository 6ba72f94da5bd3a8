package br.rio.confere.testing;

import br.rio.confere.application.error.PersistenceException;
import br.rio.confere.application.pipeline.RunSummary;
import br.rio.confere.application.port.CheckpointStore;
import br.rio.confere.application.port.ResultRepository;
import br.rio.confere.domain.checkpoint.Checkpoint;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.conformity.ConformityResult;
import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.publication.PublicationResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Result repository and checkpoint store kept in memory. */
public final class InMemoryResults implements ResultRepository, CheckpointStore {
  private final Map<String, ContractRecord> contracts = new HashMap<>();
  private final List<PublicationResult> publications = new ArrayList<>();
  private final List<ConformityResult> conformity = new ArrayList<>();
  private final List<RunSummary> summaries = new ArrayList<>();
  private final Map<String, Checkpoint> checkpoints = new HashMap<>();
  private int checkpointSaves;
  private boolean failWrites;

  public InMemoryResults failWrites() {
    this.failWrites = true;
    return this;
  }

  @Override
  public void saveContract(String processo, ContractRecord contract) {
    write();
    contracts.put(processo, contract);
  }

  @Override
  public void savePublication(PublicationResult publication) {
    write();
    publications.add(publication);
  }

  @Override
  public void saveConformity(ConformityResult result, CompanyRecord company) {
    write();
    conformity.add(result);
  }

  @Override
  public void saveRunSummary(RunSummary summary) {
    summaries.add(summary);
  }

  @Override
  public Optional<Checkpoint> load(String runId) {
    return Optional.ofNullable(checkpoints.get(runId));
  }

  @Override
  public void save(Checkpoint checkpoint) {
    checkpoints.put(checkpoint.runId(), checkpoint);
    checkpointSaves++;
  }

  public Map<String, ContractRecord> contracts() {
    return contracts;
  }

  public List<PublicationResult> publications() {
    return publications;
  }

  public List<ConformityResult> conformity() {
    return conformity;
  }

  public List<RunSummary> summaries() {
    return summaries;
  }

  public int checkpointSaves() {
    return checkpointSaves;
  }

  private void write() {
    if (failWrites) {
      throw new PersistenceException("disk full", null);
    }
  }
}
