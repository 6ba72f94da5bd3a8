package br.rio.confere.domain.processo;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Canonical processo identifier accepted by the gazette search.
 * <p><strong>Why:</strong> Processos circulate in two layouts (legacy {@code NNNNN/NNNN-N} and current
 * {@code SIGLA-PRO-YYYY/NNNNN}) and with inconsistent case, spacing, and separators. Every component
 * keys on the canonical text so that discovery, search, and checkpointing agree.</p>
 * <p><strong>Thread-safety:</strong> Immutable value; static helpers are stateless.</p>
 *
 * <p>Normalization is idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.</p>
 *
 * @param value canonical identifier text
 * @param format layout the identifier was recognized as
 */
public record ProcessoId(String value, Format format) {

  /** Recognized identifier layouts. */
  public enum Format {
    /** {@code SIGLA-PRO-YYYY/NNNNN}, also written compact as {@code SIGLAPROYYYYNNNNN}. */
    CURRENT,
    /** {@code NNNNN/NNNN-N}: sequence, year, check digit. */
    LEGACY
  }

  private static final Pattern CURRENT =
      Pattern.compile("^([A-Z]{2,6})-?([A-Z]{3})-?(\\d{4})/?(\\d{3,6})$");
  private static final Pattern LEGACY = Pattern.compile("^(\\d{1,6})/(\\d{4})-?(\\d)$");

  private static final Pattern CURRENT_IN_TEXT = Pattern.compile(
      "\\b([A-Za-z]{2,6})(?:\\s*-\\s*)?([A-Za-z]{3})(?:\\s*-\\s*)?(\\d{4})\\s*/?\\s*([\\d.]{3,7})\\b");
  private static final Pattern LEGACY_IN_TEXT =
      Pattern.compile("\\b(\\d{1,6})\\s*/\\s*(\\d{4})\\s*-\\s*(\\d)\\b");

  private static final String SEPARATORS = "[\\s./\\-]*";
  private static final int LEGACY_SEQUENCE_WIDTH = 5;

  public ProcessoId {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(format, "format");
  }

  /**
   * Parses a processo identifier in either supported layout.
   *
   * @param raw identifier as typed or scraped
   * @return canonical identifier
   * @throws IllegalArgumentException when the text is not a recognized processo
   */
  public static ProcessoId parse(String raw) {
    return tryParse(raw).orElseThrow(
        () -> new IllegalArgumentException("unrecognized processo identifier: " + raw));
  }

  /**
   * Parses a processo identifier, returning empty when the layout is unknown.
   *
   * @param raw identifier text; {@code null} yields empty
   * @return canonical identifier when recognized
   */
  public static Optional<ProcessoId> tryParse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String compact = raw.toUpperCase(Locale.ROOT).replaceAll("[\\s.]", "");
    if (compact.isEmpty()) {
      return Optional.empty();
    }
    Matcher current = CURRENT.matcher(compact);
    if (current.matches()) {
      return Optional.of(current(current.group(1), current.group(2), current.group(3), current.group(4)));
    }
    Matcher legacy = LEGACY.matcher(compact);
    if (legacy.matches()) {
      return Optional.of(legacy(legacy.group(1), legacy.group(2), legacy.group(3)));
    }
    return Optional.empty();
  }

  /**
   * Returns the canonical text for {@code raw}, or the trimmed upper-case input when unrecognized.
   *
   * @param raw identifier text
   * @return canonical form
   */
  public static String normalize(String raw) {
    Objects.requireNonNull(raw, "raw");
    return tryParse(raw).map(ProcessoId::value).orElse(raw.trim().toUpperCase(Locale.ROOT));
  }

  /**
   * Finds every processo identifier mentioned in free text, in order of appearance.
   *
   * @param text free text such as a search-result preview or gazette page
   * @return canonical identifiers without duplicates
   */
  public static List<ProcessoId> findAll(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    Set<ProcessoId> found = new LinkedHashSet<>();
    Matcher current = CURRENT_IN_TEXT.matcher(text);
    while (current.find()) {
      String number = current.group(4).replace(".", "");
      if (number.length() >= 3 && number.length() <= 6) {
        found.add(current(
            current.group(1).toUpperCase(Locale.ROOT),
            current.group(2).toUpperCase(Locale.ROOT),
            current.group(3),
            number));
      }
    }
    Matcher legacy = LEGACY_IN_TEXT.matcher(text);
    while (legacy.find()) {
      found.add(legacy(legacy.group(1), legacy.group(2), legacy.group(3)));
    }
    return new ArrayList<>(found);
  }

  /**
   * Tests whether {@code text} mentions this processo, ignoring case and separators.
   *
   * @param text candidate text
   * @return {@code true} when the identifier appears in the text
   */
  public boolean mentionedIn(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    return findAll(text).contains(this) || appearsIn(value, text);
  }

  /**
   * Tests whether {@code identifier} occurs in {@code text} as a whole token, ignoring case and any spaces,
   * dots, slashes or hyphens between its characters. A letter or digit right before or after the match
   * rejects it, so {@code SME-PRO-2025/1922} does not occur in {@code SME-PRO-2025/19222}.
   *
   * @param identifier identifier text in any layout
   * @param text candidate text
   * @return {@code true} when the identifier occurs
   */
  public static boolean appearsIn(String identifier, String text) {
    if (identifier == null || text == null) {
      return false;
    }
    StringBuilder regex = new StringBuilder("(?<![\\p{L}\\p{N}])");
    boolean first = true;
    for (int i = 0; i < identifier.length(); i++) {
      char c = identifier.charAt(i);
      if (!Character.isLetterOrDigit(c)) {
        continue;
      }
      if (!first) {
        regex.append(SEPARATORS);
      }
      regex.append(Pattern.quote(String.valueOf(c)));
      first = false;
    }
    if (first) {
      return false;
    }
    regex.append("(?![\\p{L}\\p{N}])");
    return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE).matcher(text).find();
  }

  @Override
  public String toString() {
    return value;
  }

  private static ProcessoId current(String sigla, String type, String year, String number) {
    return new ProcessoId(sigla + '-' + type + '-' + year + '/' + number, Format.CURRENT);
  }

  private static ProcessoId legacy(String sequence, String year, String checkDigit) {
    String digits = sequence.replaceFirst("^0+(?=\\d)", "");
    StringBuilder padded = new StringBuilder();
    for (int i = digits.length(); i < LEGACY_SEQUENCE_WIDTH; i++) {
      padded.append('0');
    }
    padded.append(digits);
    return new ProcessoId(padded + "/" + year + '-' + checkDigit, Format.LEGACY);
  }
}
