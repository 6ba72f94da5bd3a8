package br.rio.confere.infrastructure.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.domain.publication.SearchResultItem;
import java.util.List;
import org.junit.jupiter.api.Test;

class DoWebResultParserTest {
  private final DoWebResultParser parser =
      new DoWebResultParser("https://doweb.test/portal/edicoes/download/{edition}/{page}");

  @Test
  void splitsCardsOnPublicationHeaders() {
    String body = "2 resultados encontrados\n"
        + "Diário publicado em: 05/03/2025 - Edição 245 - Pág. 31\n"
        + "EXTRATO DO CONTRATO Processo SMS-PRO-2025/00001\n"
        + "Diario publicado em: 12/03/2025 - Edicao 250 - Pag 7\n"
        + "AVISO DE LICITAÇÃO";

    List<SearchResultItem> items = parser.parse(body);

    assertEquals(2, items.size());
    SearchResultItem first = items.get(0);
    assertEquals(0, first.index());
    assertEquals("05/03/2025", first.publicationDate());
    assertEquals("245", first.editionNumber());
    assertEquals("31", first.pageNumber());
    assertTrue(first.previewText().contains("SMS-PRO-2025/00001"));
    assertTrue(!first.previewText().contains("AVISO"));
    assertEquals("https://doweb.test/portal/edicoes/download/245/31", first.downloadLink());
    assertEquals("250", items.get(1).editionNumber());
    assertEquals("7", items.get(1).pageNumber());
  }

  @Test
  void clipsLongPreviews() {
    String body = "Diário publicado em: 05/03/2025 - Edição 1 - Pág. 2 " + "x".repeat(2_000);

    List<SearchResultItem> items = parser.parse(body);

    assertEquals(500, items.get(0).previewText().length());
  }

  @Test
  void pageWithoutHeadersHasNoItems() {
    assertTrue(parser.parse("Nenhum resultado encontrado").isEmpty());
    assertTrue(parser.parse("  ").isEmpty());
    assertTrue(parser.parse(null).isEmpty());
  }

  @Test
  void readsAnnouncedCount() {
    assertEquals(12, DoWebResultParser.announcedCount("Foram 12 resultados encontrados"));
    assertEquals(1, DoWebResultParser.announcedCount("1 resultado encontrado"));
    assertEquals(0, DoWebResultParser.announcedCount("Nenhum resultado para a pesquisa"));
    assertEquals(-1, DoWebResultParser.announcedCount("carregando..."));
    assertEquals(-1, DoWebResultParser.announcedCount(null));
  }
}
