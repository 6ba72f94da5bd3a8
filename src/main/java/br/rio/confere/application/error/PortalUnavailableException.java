package br.rio.confere.application.error;

/** The contracts portal could not be reached or its listing could not be loaded. */
public class PortalUnavailableException extends ConfereException {
  public PortalUnavailableException(String message) {
    super(message);
  }

  public PortalUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean fatal() {
    return true;
  }
}
