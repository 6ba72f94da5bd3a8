package br.rio.confere.infrastructure.persistence;

import br.rio.confere.application.error.PersistenceException;
import br.rio.confere.application.port.CheckpointStore;
import br.rio.confere.domain.checkpoint.Checkpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CheckpointStore} keeping one JSON file per run,
 * {@code <dir>/<runId>.checkpoint.json}.
 * <p><strong>Why:</strong> A crash while writing must leave the previous checkpoint readable.</p>
 * <p><strong>Thread-safety:</strong> Not synchronized; the pipeline saves from its single worker.</p>
 *
 * @implNote Writes go to a sibling temp file which is then moved over the target with
 *     {@link StandardCopyOption#ATOMIC_MOVE}.
 */
public final class JsonCheckpointStore implements CheckpointStore {
  private static final Logger log = LoggerFactory.getLogger(JsonCheckpointStore.class);
  private static final String SUFFIX = ".checkpoint.json";

  private final Path directory;
  private final ObjectMapper mapper;

  public JsonCheckpointStore(Path directory) {
    this(directory, JsonMappers.artifacts());
  }

  JsonCheckpointStore(Path directory, ObjectMapper mapper) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public Optional<Checkpoint> load(String runId) {
    Path file = fileFor(runId);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      Checkpoint checkpoint = mapper.readValue(file.toFile(), Checkpoint.class);
      if (!runId.equals(checkpoint.runId())) {
        throw new PersistenceException(
            "checkpoint " + file + " belongs to run " + checkpoint.runId(), null);
      }
      log.info("Loaded checkpoint for run {}: {} companies, {} processos", runId,
          checkpoint.processedCompanyIds().size(), checkpoint.processedProcessoIds().size());
      return Optional.of(checkpoint);
    } catch (IOException ex) {
      throw new PersistenceException("unable to read checkpoint " + file, ex);
    }
  }

  @Override
  public void save(Checkpoint checkpoint) {
    Objects.requireNonNull(checkpoint, "checkpoint");
    Path target = fileFor(checkpoint.runId());
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      Files.createDirectories(directory);
      mapper.writeValue(tmp.toFile(), checkpoint);
      try {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.warn("Filesystem of {} has no atomic move; replacing checkpoint non-atomically", directory);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Checkpoint saved: {}", target);
    } catch (IOException ex) {
      throw new PersistenceException("unable to write checkpoint " + target, ex);
    }
  }

  Path fileFor(String runId) {
    return directory.resolve(JsonMappers.fileStem(runId) + SUFFIX);
  }
}
