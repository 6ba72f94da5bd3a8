package br.rio.confere.application.error;

/**
 * A page could not be loaded once the run was under way.
 *
 * <p>Unit-level: the unit or branch is skipped as a timeout. Only the company listing turns repeated load
 * failures into {@link PortalUnavailableException}.</p>
 */
public class PageLoadException extends NavigationTimeoutException {
  public PageLoadException(String url, Throwable cause) {
    super(null, "unable to load " + url + (cause == null ? "" : ": " + cause.getMessage()), cause);
  }
}
