package br.rio.confere.application.port;

import br.rio.confere.application.extraction.ExtractionRequest;
import java.util.Map;

/**
 * <strong>What:</strong> Contract with the external structured-extraction service.
 * <p><strong>Why:</strong> Only the input/output contract matters to the pipeline; retries are owned by
 * {@link br.rio.confere.application.extraction.ExtractionService}, never by adapters.</p>
 */
public interface ExtractionPort {
  /**
   * Extracts the schema fields from document text in a single call.
   *
   * @param request text, schema, and strictness
   * @return extracted values keyed by schema field name; absent fields are omitted
   * @throws br.rio.confere.application.error.ExtractionRateLimitedException when throttled
   * @throws br.rio.confere.application.error.ExtractionMalformedResponseException when the answer is not a JSON object
   * @throws br.rio.confere.application.error.ExtractionUnavailableException on transport or server failure
   */
  Map<String, String> extract(ExtractionRequest request);
}
