package br.rio.confere.application.navigation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.company.CompanyRowParser;
import br.rio.confere.domain.navigation.NavigationState;
import br.rio.confere.testing.FakePortal;
import br.rio.confere.testing.ManualClock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class RowCollectorTest {
  private final ManualClock clock = new ManualClock();
  private final RenderWait wait =
      new RenderWait(clock, Duration.ofMillis(200), Duration.ofMillis(100), Duration.ofSeconds(5));

  @Test
  void collectsEveryRowOfAVirtualizedGridInListingOrder() throws Exception {
    FakePortal portal = new FakePortal()
        .rows(row(1), "TOTAL 9.999,00", row(2), row(3), row(4), row(1))
        .window(3);

    List<CompanyRecord> companies = new RowCollector(portal, wait, new CompanyRowParser(), 20).collect(2025);

    assertEquals(List.of("01.345.678/0001-99", "02.345.678/0001-99", "03.345.678/0001-99", "04.345.678/0001-99"),
        ids(companies));
    assertEquals(2025, portal.filteredYear());
  }

  @Test
  void secondSweepPicksUpRowsThatRenderedLate() throws Exception {
    FakePortal portal = new FakePortal()
        .rows(row(1), row(2), row(3), row(4))
        .lateRows(row(5))
        .window(3);

    List<CompanyRecord> companies = new RowCollector(portal, wait, new CompanyRowParser(), 20).collect(2025);

    assertEquals(5, companies.size());
    assertEquals("05.345.678/0001-99", companies.get(4).companyId());
  }

  @Test
  void sweepThatKeepsFindingRowsFailsAtThePassBound() {
    String[] rows = IntStream.rangeClosed(1, 10).mapToObj(RowCollectorTest::row).toArray(String[]::new);
    FakePortal portal = new FakePortal().rows(rows).window(1);
    RowCollector collector = new RowCollector(portal, wait, new CompanyRowParser(), 3);

    NavigationTimeoutException ex = assertThrows(NavigationTimeoutException.class, () -> collector.collect(2025));

    assertEquals(NavigationState.FILTERED, ex.state());
  }

  @Test
  void sequenceCollectsLazilyAndOnlyOnce() throws Exception {
    FakePortal portal = new FakePortal().rows(row(1), row(2)).window(3);
    CompanySequence sequence = new RowCollector(portal, wait, new CompanyRowParser(), 20).companies(2024);

    assertFalse(sequence.loaded());
    assertTrue(portal.events().isEmpty());

    assertEquals(2, sequence.records().size());
    sequence.records();
    assertEquals(1, portal.events().stream().filter("open"::equals).count());

    sequence.restart();
    assertFalse(sequence.loaded());
    sequence.records();
    assertEquals(2, portal.events().stream().filter("open"::equals).count());
  }

  @Test
  void passBoundBelowConvergenceWindowIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new RowCollector(new FakePortal(), wait, new CompanyRowParser(), 1));
  }

  private static String row(int i) {
    return String.format("%02d.345.678/0001-99 - EMPRESA %d LTDA 1.000,00", i, i);
  }

  private static List<String> ids(List<CompanyRecord> companies) {
    return companies.stream().map(CompanyRecord::companyId).collect(Collectors.toList());
  }
}
