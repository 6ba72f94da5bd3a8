package br.rio.confere.application.error;

/** The extraction service could not be reached or failed on its side. */
public class ExtractionUnavailableException extends ConfereException {
  public ExtractionUnavailableException(String message) {
    super(message);
  }

  public ExtractionUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
