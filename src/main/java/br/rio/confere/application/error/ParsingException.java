package br.rio.confere.application.error;

/** A downloaded document or rendered page could not be turned into usable text. */
public class ParsingException extends ConfereException {
  public ParsingException(String message) {
    super(message);
  }

  public ParsingException(String message, Throwable cause) {
    super(message, cause);
  }
}
