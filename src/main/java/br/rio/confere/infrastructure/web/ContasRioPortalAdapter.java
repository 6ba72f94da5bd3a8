package br.rio.confere.infrastructure.web;

import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.application.error.PageLoadException;
import br.rio.confere.application.port.PortalAdapter;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.navigation.NavigationState;
import br.rio.confere.domain.processo.ProcessoId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.openqa.selenium.By;
import org.openqa.selenium.Keys;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PortalAdapter} for the ContasRio contracts portal.
 * <p><strong>Why:</strong> The portal is a Vaadin application: its grid virtualizes rows (only those near the
 * viewport exist in the DOM), drill-down replaces the grid contents in place, and every action re-renders
 * asynchronously behind a loading indicator.</p>
 * <p><strong>Settledness:</strong> the document is complete and the Vaadin loading indicator is hidden.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owns one browser session.</p>
 */
public final class ContasRioPortalAdapter implements PortalAdapter {
  private static final Logger log = LoggerFactory.getLogger(ContasRioPortalAdapter.class);
  private static final By GRID_ROWS = By.cssSelector(".v-grid-body .v-grid-row");
  private static final By TABLE_ROWS = By.cssSelector("table tbody tr");
  private static final By FIRST_CELL = By.cssSelector(".v-grid-cell, td");
  private static final By YEAR_INPUTS = By.cssSelector(".v-filterselect input, select");
  private static final By PROCESSO_ANCHORS = By.tagName("a");
  private static final String SCROLLER = """
      var grid = document.querySelector('.v-grid');
      if (!grid) { return null; }
      return grid.querySelector('.v-grid-scroller-vertical')
          || grid.querySelector('.v-grid-tablewrapper') || grid;
      """;
  private static final String LOADING = """
      var indicator = document.querySelector('.v-loading-indicator');
      return !!indicator && indicator.offsetParent !== null
          && window.getComputedStyle(indicator).display !== 'none';
      """;
  private static final int COMPANY_SEARCH_PASSES = 400;

  private final SeleniumSession session;
  private final String portalUrl;

  public ContasRioPortalAdapter(SeleniumSession session, String portalUrl) {
    this.session = Objects.requireNonNull(session, "session");
    this.portalUrl = Objects.requireNonNull(portalUrl, "portalUrl");
  }

  @Override
  public void open() {
    log.info("Opening contracts portal {}", portalUrl);
    session.open(portalUrl);
  }

  @Override
  public void applyYearFilter(int year) {
    String target = Integer.toString(year);
    for (WebElement input : session.findAll(YEAR_INPUTS)) {
      try {
        String current = Optional.ofNullable(input.getAttribute("value")).orElse("").trim();
        if (current.matches("\\d{4}")) {
          if (!current.equals(target)) {
            input.sendKeys(Keys.chord(Keys.CONTROL, "a"), target, Keys.ENTER);
            log.info("Applied year filter {}", target);
          }
          return;
        }
      } catch (WebDriverException ex) {
        throw new NavigationTimeoutException(NavigationState.FILTERED, "year filter could not be applied", ex);
      }
    }
    log.warn("Year filter control not found; listing is unfiltered");
  }

  @Override
  public void scrollToTop() {
    session.script("var s = (function(){" + SCROLLER + "})(); if (s) { s.scrollTop = 0; }");
  }

  @Override
  public boolean scrollDown() {
    Object moved = session.script("var s = (function(){" + SCROLLER + "})();"
        + " if (!s) { return false; }"
        + " var before = s.scrollTop;"
        + " s.scrollTop = before + Math.max(1, Math.floor(s.clientHeight * 0.8));"
        + " return s.scrollTop !== before;");
    return Boolean.TRUE.equals(moved);
  }

  @Override
  public List<String> visibleRows() {
    List<String> rows = new ArrayList<>();
    for (WebElement row : rowElements()) {
      try {
        String text = row.getText();
        if (text != null && !text.isBlank()) {
          rows.add(text.replace('\n', ' ').trim());
        }
      } catch (StaleElementReferenceException ex) {
        // the grid recycled the row while reading; the next pass sees it again
        log.trace("Stale grid row skipped");
      }
    }
    return rows;
  }

  @Override
  public boolean isSettled() {
    return session.documentReady() && !Boolean.TRUE.equals(session.script(LOADING));
  }

  @Override
  public void selectCompany(CompanyRecord company) {
    scrollToTop();
    for (int pass = 0; pass < COMPANY_SEARCH_PASSES; pass++) {
      Optional<WebElement> row = findRow(text -> text.startsWith(company.companyId()));
      if (row.isPresent()) {
        session.click(firstCell(row.get()));
        log.debug("Selected company {}", company.companyId());
        return;
      }
      if (!scrollDown()) {
        break;
      }
    }
    throw new NavigationTimeoutException(NavigationState.COMPANY_SELECTED,
        "company " + company.companyId() + " not found in the portal grid");
  }

  @Override
  public List<String> listChildren() {
    if (!collectLinks().isEmpty()) {
      return List.of();
    }
    Set<String> labels = new LinkedHashSet<>();
    for (WebElement row : rowElements()) {
      try {
        String label = firstCell(row).getText().trim();
        if (!label.isEmpty()) {
          labels.add(label);
        }
      } catch (StaleElementReferenceException ex) {
        log.trace("Stale grid row skipped");
      }
    }
    return List.copyOf(labels);
  }

  @Override
  public void selectChild(String label) {
    Optional<WebElement> row = findRow(text -> text.equals(label) || text.startsWith(label + " "));
    if (row.isEmpty()) {
      throw new NavigationTimeoutException(null, "branch '" + label + "' not found in the portal grid");
    }
    session.click(firstCell(row.get()));
  }

  @Override
  public List<PortalLink> collectLinks() {
    List<PortalLink> links = new ArrayList<>();
    for (WebElement anchor : session.findAll(PROCESSO_ANCHORS)) {
      try {
        String href = anchor.getAttribute("href");
        String text = anchor.getText() == null ? "" : anchor.getText().trim();
        boolean processoHref = href != null && href.toLowerCase(Locale.ROOT).contains("processo");
        if (processoHref || !ProcessoId.findAll(text).isEmpty()) {
          links.add(new PortalLink(text.isEmpty() ? href : text, href));
        }
      } catch (StaleElementReferenceException ex) {
        log.trace("Stale anchor skipped");
      }
    }
    return links;
  }

  @Override
  public void reset() {
    log.debug("Resetting portal session");
    try {
      session.driver().manage().deleteAllCookies();
      session.open(portalUrl);
      session.driver().navigate().refresh();
    } catch (WebDriverException ex) {
      throw new PageLoadException(portalUrl, ex);
    }
  }

  private List<WebElement> rowElements() {
    List<WebElement> rows = session.findAll(GRID_ROWS);
    return rows.isEmpty() ? session.findAll(TABLE_ROWS) : rows;
  }

  private Optional<WebElement> findRow(Predicate<String> matches) {
    for (WebElement row : rowElements()) {
      try {
        String text = row.getText().replace('\n', ' ').trim();
        if (matches.test(text)) {
          return Optional.of(row);
        }
      } catch (StaleElementReferenceException ex) {
        log.trace("Stale grid row skipped");
      }
    }
    return Optional.empty();
  }

  private static WebElement firstCell(WebElement row) {
    try {
      List<WebElement> cells = row.findElements(FIRST_CELL);
      return cells.isEmpty() ? row : cells.get(0);
    } catch (StaleElementReferenceException ex) {
      throw new NavigationTimeoutException(null, "grid row was re-rendered before it could be opened", ex);
    }
  }
}
