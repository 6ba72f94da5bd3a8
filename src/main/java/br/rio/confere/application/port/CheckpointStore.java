package br.rio.confere.application.port;

import br.rio.confere.domain.checkpoint.Checkpoint;
import java.util.Optional;

/**
 * Durable storage for run checkpoints.
 *
 * <p>Writes must be atomic: a reader sees either the previous checkpoint or the new one.</p>
 */
public interface CheckpointStore {
  /**
   * Loads the checkpoint of a run.
   *
   * @param runId run identifier
   * @return stored checkpoint, or empty when the run has none
   * @throws br.rio.confere.application.error.PersistenceException when the stored file is unreadable
   */
  Optional<Checkpoint> load(String runId);

  /**
   * Replaces the stored checkpoint.
   *
   * @param checkpoint checkpoint to persist
   * @throws br.rio.confere.application.error.PersistenceException when the write fails
   */
  void save(Checkpoint checkpoint);
}
