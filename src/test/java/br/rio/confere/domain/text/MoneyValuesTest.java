package br.rio.confere.domain.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class MoneyValuesTest {

  @Test
  void parsesBrazilianAndIsoAmounts() {
    assertEquals(0, new BigDecimal("1234567.89").compareTo(MoneyValues.parse("R$ 1.234.567,89").orElseThrow()));
    assertEquals(0, new BigDecimal("1500.00").compareTo(MoneyValues.parse("1500.00").orElseThrow()));
    assertEquals(0, new BigDecimal("1500").compareTo(MoneyValues.parse("1.500").orElseThrow()));
    assertTrue(MoneyValues.parse("valor a definir").isEmpty());
  }

  @Test
  void similarityDegradesWithRelativeDifference() {
    assertEquals(1.0, MoneyValues.similarity(new BigDecimal("100.00"), new BigDecimal("100")));
    assertEquals(0.99, MoneyValues.similarity(new BigDecimal("1000"), new BigDecimal("1005")));
    assertEquals(0.95, MoneyValues.similarity(new BigDecimal("1000"), new BigDecimal("1030")));
    assertEquals(0.5, MoneyValues.similarity(new BigDecimal("1000"), new BigDecimal("2000")), 1e-9);
  }

  @Test
  void datesAreFoundInsideText() {
    assertEquals(LocalDate.of(2025, 1, 15), DateValues.parse("Rio de Janeiro, 15/01/2025.").orElseThrow());
    assertEquals(LocalDate.of(2025, 1, 15), DateValues.parse("2025-01-15").orElseThrow());
    assertTrue(DateValues.parse("31/02/2025").isEmpty());
  }
}
