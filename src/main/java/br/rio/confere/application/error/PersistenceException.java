package br.rio.confere.application.error;

/** Results or checkpoints could not be written. Always fatal. */
public class PersistenceException extends ConfereException {
  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean fatal() {
    return true;
  }
}
