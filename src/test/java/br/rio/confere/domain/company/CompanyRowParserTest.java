package br.rio.confere.domain.company;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CompanyRowParserTest {
  private final CompanyRowParser parser = new CompanyRowParser();

  @Test
  void parsesCnpjRowAndDropsAmounts() {
    CompanyRecord company = parser.parse("12.345.678/0001-99 - EMPRESA X LTDA 1.000,00 500,00").orElseThrow();

    assertEquals("12.345.678/0001-99", company.companyId());
    assertEquals("EMPRESA X LTDA", company.name());
  }

  @Test
  void parsesCpfRowWithCollapsedWhitespace() {
    CompanyRecord company = parser.parse("  123.456.789-00   -  JOAO  DA SILVA\n10.000,00").orElseThrow();

    assertEquals("123.456.789-00", company.companyId());
    assertEquals("JOAO DA SILVA", company.name());
  }

  @Test
  void skipsTotalsNumbersAndUnrecognizedRows() {
    assertTrue(parser.parse("TOTAL 1.000.000,00").isEmpty());
    assertTrue(parser.parse("1.000,00 500,00").isEmpty());
    assertTrue(parser.parse("Favorecido - Valor").isEmpty());
    assertTrue(parser.parse("   ").isEmpty());
    assertTrue(parser.parse(null).isEmpty());
  }
}
