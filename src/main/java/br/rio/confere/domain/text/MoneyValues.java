package br.rio.confere.domain.text;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and compares monetary amounts written in Brazilian format ({@code R$ 1.234.567,89}).
 */
public final class MoneyValues {
  private static final Pattern AMOUNT = Pattern.compile("-?\\d[\\d.\\s]*(?:,\\d{1,2})?");
  private static final BigDecimal EXACT_TOLERANCE = new BigDecimal("0.0001");
  private static final BigDecimal ONE_PERCENT = new BigDecimal("0.01");
  private static final BigDecimal FIVE_PERCENT = new BigDecimal("0.05");
  private static final BigDecimal TEN_PERCENT = new BigDecimal("0.10");

  private MoneyValues() {
    // Utility
  }

  /**
   * Parses the first amount found in {@code text}.
   *
   * @param text money text such as {@code R$ 1.500,00}; ISO decimals ({@code 1500.00}) are accepted
   * @return parsed amount, or empty when no amount is present
   */
  public static Optional<BigDecimal> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    Matcher matcher = AMOUNT.matcher(text);
    if (!matcher.find()) {
      return Optional.empty();
    }
    String raw = matcher.group().replaceAll("\\s", "");
    String canonical;
    if (raw.contains(",")) {
      canonical = raw.replace(".", "").replace(',', '.');
    } else if (raw.matches("-?\\d{1,3}(\\.\\d{3})+")) {
      canonical = raw.replace(".", "");
    } else {
      canonical = raw;
    }
    try {
      return Optional.of(new BigDecimal(canonical));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  /**
   * Scores two amounts by relative difference. Equal amounts score 1.0.
   *
   * @param left first amount
   * @param right second amount
   * @return similarity in {@code [0, 1]}
   */
  public static double similarity(BigDecimal left, BigDecimal right) {
    if (left.compareTo(right) == 0) {
      return 1.0;
    }
    BigDecimal base = left.abs().max(right.abs());
    BigDecimal relative = left.subtract(right).abs().divide(base, MathContext.DECIMAL64);
    if (relative.compareTo(EXACT_TOLERANCE) < 0) {
      return 1.0;
    }
    if (relative.compareTo(ONE_PERCENT) < 0) {
      return 0.99;
    }
    if (relative.compareTo(FIVE_PERCENT) < 0) {
      return 0.95;
    }
    if (relative.compareTo(TEN_PERCENT) < 0) {
      return 0.90;
    }
    return Math.max(0.0, 1.0 - relative.doubleValue());
  }
}
