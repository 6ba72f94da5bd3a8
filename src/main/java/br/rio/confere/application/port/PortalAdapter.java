package br.rio.confere.application.port;

import br.rio.confere.domain.company.CompanyRecord;
import java.util.List;

/**
 * <strong>What:</strong> Semantic operations on the contracts portal (ContasRio).
 * <p><strong>Why:</strong> Isolates selectors and rendering quirks of the portal from the navigation state
 * machine; the navigator and row collector depend only on this capability interface.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one adapter drives one browser session.</p>
 *
 * <p>Operations that change the page return immediately; callers wait for the re-render through
 * {@link #isSettled()}.</p>
 */
public interface PortalAdapter {

  /**
   * Loads the portal landing page.
   *
   * @throws br.rio.confere.application.error.PageLoadException when the page cannot be loaded
   * @throws br.rio.confere.application.error.PortalUnavailableException when no browser can be started
   */
  void open();

  /** Applies the contract year filter to the companies listing. */
  void applyYearFilter(int year);

  /** Scrolls the companies grid back to its first row. */
  void scrollToTop();

  /**
   * Scrolls the companies grid down by about one viewport.
   *
   * @return {@code false} when the grid was already at its end
   */
  boolean scrollDown();

  /** Text of the grid rows currently materialized in the DOM. */
  List<String> visibleRows();

  /** Returns {@code true} once the page has finished re-rendering. */
  boolean isSettled();

  /** Opens the hierarchy of one company from the listing. */
  void selectCompany(CompanyRecord company);

  /** Labels of the next hierarchy level under the current selection; empty at a leaf. */
  List<String> listChildren();

  /** Opens one child of the current selection. */
  void selectChild(String label);

  /** Processo links shown under the current selection. */
  List<PortalLink> collectLinks();

  /**
   * Hard reset: reloads the portal and clears every selection and filter.
   *
   * @throws br.rio.confere.application.error.PageLoadException when the reload fails
   */
  void reset();

  /**
   * Raw processo reference rendered by the portal.
   *
   * @param text processo text as shown
   * @param url document link, may be {@code null}
   */
  record PortalLink(String text, String url) {}
}
