package br.rio.confere.application.port;

import java.nio.file.Path;

/** Turns a downloaded document into plain text. */
public interface DocumentTextExtractor {
  /**
   * Extracts the text of a document.
   *
   * @param document downloaded file
   * @return document text
   * @throws br.rio.confere.application.error.ParsingException when the file is unreadable or has no text
   */
  String extractText(Path document);
}
