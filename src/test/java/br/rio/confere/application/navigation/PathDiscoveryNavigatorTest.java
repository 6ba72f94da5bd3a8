package br.rio.confere.application.navigation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.navigation.NavigationPath;
import br.rio.confere.domain.navigation.NavigationState;
import br.rio.confere.domain.processo.ProcessoLink;
import br.rio.confere.testing.FakePortal;
import br.rio.confere.testing.ManualClock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class PathDiscoveryNavigatorTest {
  private static final CompanyRecord COMPANY = new CompanyRecord("11", "EMPRESA X LTDA");

  private final RenderWait wait =
      new RenderWait(new ManualClock(), Duration.ofMillis(100), Duration.ofMillis(50), Duration.ofSeconds(2));

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void collectsLinksWhereverTheHierarchyEnds() throws Exception {
    FakePortal portal = new FakePortal()
        .children("11", "SMS", "SME")
        .children("11/SMS", "Hospital")
        .children("11/SMS/Hospital", "Obra")
        .links("11/SMS/Hospital/Obra", "SMS-PRO-2025/01234")
        .links("11/SME", "sme pro 2025 00077");
    PathDiscoveryNavigator navigator = new PathDiscoveryNavigator(portal, wait, 2025);

    CompanyDiscovery discovery = navigator.discover(COMPANY);

    List<ProcessoLink> links = discovery.links();
    assertEquals(List.of("SMS-PRO-2025/01234", "SME-PRO-2025/00077"), processos(links));
    assertEquals(NavigationPath.company("11").withOrgan("SMS").withUnit("Hospital").withObject("Obra"),
        links.get(0).path());
    assertEquals(NavigationPath.company("11").withOrgan("SME"), links.get(1).path());
    assertEquals("EMPRESA X LTDA", links.get(1).companyName());
    assertTrue(discovery.skippedBranches().isEmpty());
    assertEquals(NavigationState.LEAF_COLLECTED, navigator.state());
    assertEquals("LEAF_COLLECTED", MDC.get("state"));
  }

  @Test
  void everyBranchReplaysFromAHardReset() throws Exception {
    FakePortal portal = new FakePortal()
        .children("11", "SMS", "SME")
        .links("11/SMS", "SMS-PRO-2025/00001")
        .links("11/SME", "SME-PRO-2025/00002");

    new PathDiscoveryNavigator(portal, wait, 2024).discover(COMPANY);

    assertEquals(3, portal.resets());
    List<String> events = portal.events();
    int sme = events.indexOf("select 11/SME");
    assertEquals(List.of("reset", "filter 2024", "select 11", "select 11/SME"), events.subList(sme - 3, sme + 1));
  }

  @Test
  void duplicateLinksKeepTheFirstPath() throws Exception {
    FakePortal portal = new FakePortal()
        .children("11", "SMS", "SME")
        .links("11/SMS", "SMS-PRO-2025/01234", "  ")
        .links("11/SME", "SMS PRO 2025 01234");

    CompanyDiscovery discovery = new PathDiscoveryNavigator(portal, wait, 2025).discover(COMPANY);

    assertEquals(1, discovery.links().size());
    assertEquals("SMS", discovery.links().get(0).path().organ());
  }

  @Test
  void branchTimingOutOnceIsRetried() throws Exception {
    FakePortal portal = new FakePortal()
        .children("11", "SMS")
        .links("11/SMS", "SMS-PRO-2025/01234")
        .failSelecting("11/SMS", 1);

    CompanyDiscovery discovery = new PathDiscoveryNavigator(portal, wait, 2025).discover(COMPANY);

    assertEquals(1, discovery.links().size());
    assertTrue(discovery.skippedBranches().isEmpty());
  }

  @Test
  void branchTimingOutTwiceIsSkippedAndSiblingsContinue() throws Exception {
    FakePortal portal = new FakePortal()
        .children("11", "SMS", "SME")
        .links("11/SMS", "SMS-PRO-2025/01234")
        .links("11/SME", "SME-PRO-2025/00002")
        .failSelecting("11/SMS", 2);

    CompanyDiscovery discovery = new PathDiscoveryNavigator(portal, wait, 2025).discover(COMPANY);

    assertEquals(List.of("SME-PRO-2025/00002"), processos(discovery.links()));
    assertEquals(List.of(NavigationPath.company("11").withOrgan("SMS")), discovery.skippedBranches());
  }

  private static List<String> processos(List<ProcessoLink> links) {
    return links.stream().map(ProcessoLink::processo).collect(Collectors.toList());
  }
}
