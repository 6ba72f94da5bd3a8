package br.rio.confere.application.publication;

import br.rio.confere.domain.processo.ProcessoId;
import br.rio.confere.domain.publication.SearchResultItem;
import br.rio.confere.domain.text.DateValues;
import br.rio.confere.domain.text.TextNormalizer;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Classifies and orders gazette search results for one processo.
 * <p><strong>Rules:</strong> only results whose text contains the processo qualify; contract extracts come
 * before notices and corrections; among equals the most recent edition wins, then page order.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 */
public final class CandidateRanker {
  /** Extract headings recognized in previews, most specific first. */
  public static final List<String> EXTRATO_TYPES = List.of(
      "EXTRATO DO CONTRATO",
      "EXTRATO DE CONTRATO",
      "EXTRATO DE TERMO ADITIVO",
      "EXTRATO DO TERMO ADITIVO",
      "EXTRATO DE INSTRUMENTO CONTRATUAL",
      "EXTRATO DE CONVÊNIO");
  private static final String GENERIC_EXTRATO = "EXTRATO";

  private static final Comparator<SearchResultItem> ORDER = Comparator
      .comparing((SearchResultItem item) -> !item.extrato())
      .thenComparing(
          item -> DateValues.parse(item.publicationDate()).orElse(null),
          Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
      .thenComparingInt(SearchResultItem::index);

  /**
   * Outcome of ranking.
   *
   * @param classified every result, flagged, in page order
   * @param qualifying results that mention the processo, best first
   */
  public record Ranking(List<SearchResultItem> classified, List<SearchResultItem> qualifying) {
    public Ranking {
      classified = List.copyOf(classified);
      qualifying = List.copyOf(qualifying);
    }
  }

  /**
   * Ranks results for a processo.
   *
   * @param processo canonical processo
   * @param items results in page order
   * @return classified and qualifying results
   */
  public Ranking rank(String processo, List<SearchResultItem> items) {
    List<SearchResultItem> classified = new ArrayList<>(items.size());
    List<SearchResultItem> qualifying = new ArrayList<>();
    for (SearchResultItem item : items) {
      boolean extrato = extratoType(item.previewText()).isPresent();
      boolean mentions = mentions(processo, item.previewText());
      SearchResultItem flagged = item.classified(extrato, mentions);
      classified.add(flagged);
      if (mentions) {
        qualifying.add(flagged);
      }
    }
    qualifying.sort(ORDER);
    return new Ranking(classified, qualifying);
  }

  /**
   * Finds the extract heading in a text.
   *
   * @param text preview or document text
   * @return recognized heading, {@code EXTRATO} for unlisted extract kinds, or empty
   */
  public static Optional<String> extratoType(String text) {
    String normalized = TextNormalizer.normalize(text);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    for (String type : EXTRATO_TYPES) {
      if (normalized.contains(TextNormalizer.normalize(type))) {
        return Optional.of(type);
      }
    }
    if (normalized.contains(GENERIC_EXTRATO.toLowerCase(Locale.ROOT))) {
      return Optional.of(GENERIC_EXTRATO);
    }
    return Optional.empty();
  }

  /**
   * Tests whether {@code text} contains the processo, ignoring case and separators.
   *
   * @param processo canonical processo
   * @param text candidate text
   * @return {@code true} when mentioned
   */
  public static boolean mentions(String processo, String text) {
    Optional<ProcessoId> id = ProcessoId.tryParse(processo);
    if (id.isPresent()) {
      return id.get().mentionedIn(text);
    }
    return ProcessoId.appearsIn(processo, text);
  }
}
