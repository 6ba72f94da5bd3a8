package br.rio.confere.domain.company;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parses one rendered row of the companies grid into a {@link CompanyRecord}.
 * <p><strong>Why:</strong> Keeps text parsing testable without a browser; the grid adapter only hands over row text.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * <p>Rows look like {@code 12.345.678/0001-99 - EMPRESA X LTDA 1.000,00 500,00 ...}. Summary rows
 * ({@code TOTAL}) and rows made only of numbers (partially rendered) are skipped.</p>
 */
public final class CompanyRowParser {
  private static final Pattern ID_AND_REST = Pattern.compile("^([\\w./-]+)\\s*-\\s*(.+)$");
  private static final Pattern NUMBERS_ONLY = Pattern.compile("^[\\d.,\\s-]+$");
  private static final Pattern CURRENCY = Pattern.compile("-?[\\d.]+,\\d{2}");

  /**
   * Parses a row of grid text.
   *
   * @param rowText raw row text; {@code null} or blank yields empty
   * @return parsed company, or empty when the row is a summary, incomplete, or unrecognized
   */
  public Optional<CompanyRecord> parse(String rowText) {
    if (rowText == null || rowText.isBlank()) {
      return Optional.empty();
    }
    String text = rowText.strip().replaceAll("\\s+", " ");
    if (text.toLowerCase(Locale.ROOT).contains("total")) {
      return Optional.empty();
    }
    if (NUMBERS_ONLY.matcher(text).matches()) {
      return Optional.empty();
    }
    Matcher matcher = ID_AND_REST.matcher(text);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String companyId = matcher.group(1).trim();
    String rest = matcher.group(2).trim();
    if (!containsDigit(companyId)) {
      return Optional.empty();
    }

    Matcher currency = CURRENCY.matcher(rest);
    String name = rest;
    if (currency.find()) {
      name = rest.substring(0, currency.start()).trim();
    }
    if (name.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new CompanyRecord(companyId, name));
  }

  private static boolean containsDigit(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isDigit(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
