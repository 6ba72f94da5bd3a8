package br.rio.confere.infrastructure.web;

import br.rio.confere.domain.publication.SearchResultItem;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the rendered DoWeb results page into result items.
 *
 * <p>Each card starts with {@code "Diário publicado em: DD/MM/AAAA - Edição N - Pág. P"}; the card preview runs
 * until the next header (or 1500 characters for the last card) and is clipped to 500 characters.</p>
 */
final class DoWebResultParser {
  private static final Pattern HEADER = Pattern.compile(
      "Di[aá]rio publicado em:\\s*(\\d{2}/\\d{2}/\\d{4})\\s*-\\s*Edi[cç][aã]o\\s*(\\d+)\\s*-\\s*P[aá]g\\.?\\s*(\\d+)",
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  private static final int LAST_CARD_SPAN = 1_500;
  private static final int PREVIEW_CHARS = 500;

  private final String downloadTemplate;

  /**
   * @param downloadTemplate page download URL with {@code {edition}} and {@code {page}} placeholders
   */
  DoWebResultParser(String downloadTemplate) {
    this.downloadTemplate = downloadTemplate;
  }

  List<SearchResultItem> parse(String bodyText) {
    if (bodyText == null || bodyText.isBlank()) {
      return List.of();
    }
    List<int[]> spans = new ArrayList<>();
    List<String[]> headers = new ArrayList<>();
    Matcher matcher = HEADER.matcher(bodyText);
    while (matcher.find()) {
      spans.add(new int[] {matcher.start(), matcher.end()});
      headers.add(new String[] {matcher.group(1), matcher.group(2), matcher.group(3)});
    }
    List<SearchResultItem> items = new ArrayList<>(headers.size());
    for (int i = 0; i < headers.size(); i++) {
      int start = spans.get(i)[0];
      int end = i + 1 < spans.size() ? spans.get(i + 1)[0] : Math.min(start + LAST_CARD_SPAN, bodyText.length());
      String preview = bodyText.substring(start, end).strip();
      if (preview.length() > PREVIEW_CHARS) {
        preview = preview.substring(0, PREVIEW_CHARS);
      }
      String[] header = headers.get(i);
      items.add(new SearchResultItem(i, header[0], header[1], header[2], preview,
          downloadUrl(header[1], header[2]), false, false));
    }
    return items;
  }

  /** Result count announced by the page, or {@code -1} when the page shows neither a count nor "nenhum resultado". */
  static int announcedCount(String bodyText) {
    if (bodyText == null) {
      return -1;
    }
    Matcher count = Pattern.compile("(\\d+)\\s+resultados?\\s+encontrados?", Pattern.CASE_INSENSITIVE)
        .matcher(bodyText);
    if (count.find()) {
      return Integer.parseInt(count.group(1));
    }
    return bodyText.toLowerCase(java.util.Locale.ROOT).contains("nenhum resultado") ? 0 : -1;
  }

  String downloadUrl(String edition, String page) {
    return downloadTemplate.replace("{edition}", edition).replace("{page}", page);
  }
}
