package br.rio.confere.application.extraction;

import java.util.Objects;

/**
 * One call to the extraction service.
 *
 * @param text document text
 * @param schema fields to extract
 * @param strict when {@code true} the adapter sends a stricter schema hint, used after a malformed answer
 */
public record ExtractionRequest(String text, ExtractionSchema schema, boolean strict) {
  public ExtractionRequest {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(schema, "schema");
  }
}
