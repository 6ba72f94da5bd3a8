package br.rio.confere.domain.text;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folds free text into a comparison form: lower case, no accents, punctuation as spaces,
 * single spaces between tokens.
 */
public final class TextNormalizer {
  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

  private TextNormalizer() {
    // Utility
  }

  /**
   * Normalizes text for comparison.
   *
   * @param value raw text; {@code null} yields the empty string
   * @return normalized text
   */
  public static String normalize(String value) {
    if (value == null) {
      return "";
    }
    String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
    String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
    String spaced = NON_ALPHANUMERIC.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ");
    return spaced.strip();
  }

  /**
   * Splits normalized text into tokens.
   *
   * @param value raw text
   * @return tokens in order; empty when the text has none
   */
  public static List<String> tokens(String value) {
    String normalized = normalize(value);
    if (normalized.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(normalized.split(" "));
  }
}
