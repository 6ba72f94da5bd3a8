package br.rio.confere.application.navigation;

import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.application.port.PortalAdapter;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.company.CompanyRowParser;
import br.rio.confere.domain.navigation.NavigationState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Enumerates every company row of the portal's virtualized grid.
 * <p><strong>Why:</strong> The grid only materializes rows near the viewport, and a single pass regularly misses
 * rows that render late.</p>
 * <p><strong>Algorithm:</strong> scroll, read the materialized rows, dedupe by company id; a sweep converges
 * after two consecutive passes add nothing. A second full sweep from the top always follows and is merged
 * into the first.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; drives one portal session.</p>
 */
public final class RowCollector {
  private static final Logger log = LoggerFactory.getLogger(RowCollector.class);
  private static final int IDLE_PASSES_TO_CONVERGE = 2;

  private final PortalAdapter portal;
  private final RenderWait renderWait;
  private final CompanyRowParser parser;
  private final int maxScrollPasses;

  /**
   * Creates a collector.
   *
   * @param portal portal adapter
   * @param renderWait wait applied after filtering and after every scroll
   * @param parser row text parser
   * @param maxScrollPasses upper bound on passes per sweep
   */
  public RowCollector(PortalAdapter portal, RenderWait renderWait, CompanyRowParser parser, int maxScrollPasses) {
    this.portal = Objects.requireNonNull(portal, "portal");
    this.renderWait = Objects.requireNonNull(renderWait, "renderWait");
    this.parser = Objects.requireNonNull(parser, "parser");
    if (maxScrollPasses < IDLE_PASSES_TO_CONVERGE) {
      throw new IllegalArgumentException("maxScrollPasses must be >= " + IDLE_PASSES_TO_CONVERGE);
    }
    this.maxScrollPasses = maxScrollPasses;
  }

  /**
   * Returns a lazy sequence over the companies listed for {@code year}.
   *
   * @param year contract year filter
   * @return sequence collected on first use
   */
  public CompanySequence companies(int year) {
    return new CompanySequence(() -> collect(year));
  }

  /**
   * Collects the companies listed for {@code year} now.
   *
   * @param year contract year filter
   * @return companies in first-seen order
   * @throws NavigationTimeoutException when a sweep does not converge within the pass bound
   * @throws InterruptedException when interrupted while waiting for renders
   */
  public List<CompanyRecord> collect(int year) throws InterruptedException {
    portal.open();
    portal.applyYearFilter(year);
    renderWait.await(NavigationState.FILTERED, portal::isSettled);

    Map<String, CompanyRecord> merged = new LinkedHashMap<>();
    int first = sweep(merged);
    int second = sweep(merged);
    log.info("Collected {} companies for {} (first sweep {}, second sweep added {})",
        merged.size(), year, first, merged.size() - first);
    if (second < first) {
      log.debug("Second sweep saw {} rows, fewer than the first sweep's {}", second, first);
    }
    return new ArrayList<>(merged.values());
  }

  private int sweep(Map<String, CompanyRecord> merged) throws InterruptedException {
    portal.scrollToTop();
    renderWait.await(NavigationState.FILTERED, portal::isSettled);
    Map<String, CompanyRecord> seen = new LinkedHashMap<>();
    int idle = 0;
    for (int pass = 1; pass <= maxScrollPasses; pass++) {
      int before = seen.size();
      for (String row : portal.visibleRows()) {
        parser.parse(row).ifPresent(company -> seen.putIfAbsent(company.companyId(), company));
      }
      idle = seen.size() == before ? idle + 1 : 0;
      log.debug("Scroll pass {}: {} rows known", pass, seen.size());
      if (idle >= IDLE_PASSES_TO_CONVERGE) {
        seen.forEach(merged::putIfAbsent);
        return seen.size();
      }
      portal.scrollDown();
      renderWait.await(NavigationState.FILTERED, portal::isSettled);
    }
    throw new NavigationTimeoutException(
        NavigationState.FILTERED,
        "company listing did not converge within " + maxScrollPasses + " scroll passes");
  }
}
