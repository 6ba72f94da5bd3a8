package br.rio.confere.application.error;

/** The extraction service answered with output that is not the requested JSON object. */
public class ExtractionMalformedResponseException extends ConfereException {
  public ExtractionMalformedResponseException(String message) {
    super(message);
  }

  public ExtractionMalformedResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
