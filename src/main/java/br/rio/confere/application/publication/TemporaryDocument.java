package br.rio.confere.application.publication;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloaded file that is deleted when closed, whatever happened while it was open.
 */
public final class TemporaryDocument implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TemporaryDocument.class);

  private final Path path;

  public TemporaryDocument(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() {
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      log.warn("Unable to delete temporary document {}", path, ex);
    }
  }
}
