package br.rio.confere.application.navigation;

import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.application.port.PortalAdapter;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.navigation.NavigationPath;
import br.rio.confere.domain.navigation.NavigationState;
import br.rio.confere.domain.processo.ProcessoId;
import br.rio.confere.domain.processo.ProcessoLink;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Walks one company's organ → unit → object hierarchy and yields every processo link.
 * <p><strong>Why:</strong> The portal keeps expansion state in the page; walking siblings without a reset lets
 * one organ's links bleed into another's.</p>
 * <p><strong>Branch isolation:</strong> every branch replays from a hard reset through the filter and company
 * selection before opening its own nodes, so no UI state is carried between siblings. Links are collected
 * where the hierarchy ends, which may be above the object level.</p>
 * <p><strong>Failure model:</strong> a branch that times out is retried once, then logged and skipped; siblings
 * and other companies continue.</p>
 * <p><strong>Observability:</strong> the current state is published under the MDC key {@code state}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; drives one portal session.</p>
 */
public final class PathDiscoveryNavigator {
  private static final Logger log = LoggerFactory.getLogger(PathDiscoveryNavigator.class);
  static final String MDC_STATE = "state";

  private final PortalAdapter portal;
  private final RenderWait renderWait;
  private final int filterYear;
  private NavigationState state = NavigationState.INIT;

  /**
   * Creates a navigator.
   *
   * @param portal portal adapter
   * @param renderWait wait applied after every transition
   * @param filterYear contract year filter replayed for every branch
   */
  public PathDiscoveryNavigator(PortalAdapter portal, RenderWait renderWait, int filterYear) {
    this.portal = Objects.requireNonNull(portal, "portal");
    this.renderWait = Objects.requireNonNull(renderWait, "renderWait");
    this.filterYear = filterYear;
  }

  /**
   * Discovers every processo link reachable for a company.
   *
   * @param company company to walk
   * @return unique links and skipped branches
   * @throws InterruptedException when interrupted while waiting for renders
   */
  public CompanyDiscovery discover(CompanyRecord company) throws InterruptedException {
    Objects.requireNonNull(company, "company");
    Map<String, ProcessoLink> links = new LinkedHashMap<>();
    List<NavigationPath> skipped = new ArrayList<>();
    walk(company, NavigationPath.company(company.companyId()), links, skipped);
    log.info("Discovered {} processo links for {} ({} branches skipped)",
        links.size(), company.companyId(), skipped.size());
    return new CompanyDiscovery(company, new ArrayList<>(links.values()), skipped);
  }

  /** Current position of the walk. */
  public NavigationState state() {
    return state;
  }

  private void walk(
      CompanyRecord company,
      NavigationPath path,
      Map<String, ProcessoLink> links,
      List<NavigationPath> skipped) throws InterruptedException {
    List<String> children;
    try {
      children = visitWithRetry(company, path, links);
    } catch (NavigationTimeoutException ex) {
      log.warn("Skipping branch {} after retry: {}", path, ex.getMessage());
      skipped.add(path);
      return;
    }
    for (String child : children) {
      walk(company, extend(path, child), links, skipped);
    }
  }

  private List<String> visitWithRetry(
      CompanyRecord company, NavigationPath path, Map<String, ProcessoLink> links)
      throws InterruptedException {
    try {
      return visit(company, path, links);
    } catch (NavigationTimeoutException first) {
      log.info("Branch {} timed out entering {}; retrying once", path, first.state());
      return visit(company, path, links);
    }
  }

  /**
   * Replays {@code path} from a reset. Returns the labels below it, or collects links when it is a leaf.
   */
  private List<String> visit(CompanyRecord company, NavigationPath path, Map<String, ProcessoLink> links)
      throws InterruptedException {
    replay(company, path);
    List<String> children = path.object() == null ? portal.listChildren() : List.of();
    if (!children.isEmpty()) {
      return children;
    }
    for (PortalAdapter.PortalLink raw : portal.collectLinks()) {
      if (raw.text() == null || raw.text().isBlank()) {
        continue;
      }
      String processo = ProcessoId.normalize(raw.text());
      links.putIfAbsent(processo,
          new ProcessoLink(processo, raw.url(), company.companyId(), company.name(), path));
    }
    transition(NavigationState.LEAF_COLLECTED);
    return List.of();
  }

  private void replay(CompanyRecord company, NavigationPath path) throws InterruptedException {
    transition(NavigationState.RESET);
    portal.reset();
    transition(NavigationState.INIT);
    portal.applyYearFilter(filterYear);
    enter(NavigationState.FILTERED);
    portal.selectCompany(company);
    enter(NavigationState.COMPANY_SELECTED);
    if (path.organ() != null) {
      portal.selectChild(path.organ());
      enter(NavigationState.ORGAN_SELECTED);
    }
    if (path.unit() != null) {
      portal.selectChild(path.unit());
      enter(NavigationState.UNIT_SELECTED);
    }
    if (path.object() != null) {
      portal.selectChild(path.object());
      renderWait.await(NavigationState.LEAF_COLLECTED, portal::isSettled);
    }
  }

  private void enter(NavigationState next) throws InterruptedException {
    renderWait.await(next, portal::isSettled);
    transition(next);
  }

  private void transition(NavigationState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("illegal navigation transition " + state + " -> " + next);
    }
    state = next;
    MDC.put(MDC_STATE, next.name());
  }

  private static NavigationPath extend(NavigationPath path, String label) {
    return switch (path.depth()) {
      case COMPANY_SELECTED -> path.withOrgan(label);
      case ORGAN_SELECTED -> path.withUnit(label);
      default -> path.withObject(label);
    };
  }
}
