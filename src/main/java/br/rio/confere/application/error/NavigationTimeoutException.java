package br.rio.confere.application.error;

import br.rio.confere.domain.navigation.NavigationState;

/** A portal or gazette page did not settle within the configured bound. */
public class NavigationTimeoutException extends ConfereException {
  private final NavigationState state;

  public NavigationTimeoutException(NavigationState state, String message) {
    super(message);
    this.state = state;
  }

  public NavigationTimeoutException(NavigationState state, String message, Throwable cause) {
    super(message, cause);
    this.state = state;
  }

  /** State the navigator was trying to reach; {@code null} for gazette page waits. */
  public NavigationState state() {
    return state;
  }
}
