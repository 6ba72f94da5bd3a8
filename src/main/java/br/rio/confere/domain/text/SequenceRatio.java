package br.rio.confere.domain.text;

import java.util.List;

/**
 * <strong>What:</strong> Ratcliff/Obershelp similarity over characters and a token-alignment variant.
 * <p><strong>Why:</strong> Extracted names and descriptions differ in casing, accents, abbreviations,
 * and word order; a single edit distance misjudges abbreviations such as {@code corp} for
 * {@code corporation}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Performance:</strong> Character ratio is {@code O(n·m)} per matching block; inputs are
 * short field values.</p>
 */
public final class SequenceRatio {
  /** Highest score a non-identical pair can receive. */
  public static final double NEAR_EXACT = 0.99;

  private static final double ABBREVIATION_SCORE = 0.9;
  private static final int MIN_ABBREVIATION_LENGTH = 3;
  private static final double TOKEN_CHAR_FLOOR = 0.75;

  private SequenceRatio() {
    // Utility
  }

  /**
   * Text similarity in {@code [0, 1]}. Identical normalized text scores exactly 1.0; anything else
   * scores at most {@link #NEAR_EXACT}.
   *
   * @param left first text
   * @param right second text
   * @return similarity ratio
   */
  public static double similarity(String left, String right) {
    String a = TextNormalizer.normalize(left);
    String b = TextNormalizer.normalize(right);
    if (a.equals(b)) {
      return 1.0;
    }
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    double best = Math.max(characterRatio(a, b), tokenRatio(TextNormalizer.tokens(a), TextNormalizer.tokens(b)));
    return Math.min(best, NEAR_EXACT);
  }

  /**
   * Ratcliff/Obershelp ratio {@code 2·M / (|a| + |b|)}, where {@code M} counts characters in
   * recursively found longest common blocks.
   *
   * @param a first string
   * @param b second string
   * @return ratio in {@code [0, 1]}
   */
  public static double characterRatio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
  }

  /**
   * Greedy token alignment: each left token takes its best unused right token. Exact tokens score
   * 1.0, a token that abbreviates the other scores 0.9, close spellings score their character ratio.
   *
   * @param left left tokens
   * @param right right tokens
   * @return ratio {@code 2·Σscore / (|left| + |right|)}
   */
  public static double tokenRatio(List<String> left, List<String> right) {
    int total = left.size() + right.size();
    if (total == 0) {
      return 1.0;
    }
    boolean[] used = new boolean[right.size()];
    double sum = 0.0;
    for (String token : left) {
      int bestIndex = -1;
      double bestScore = 0.0;
      for (int j = 0; j < right.size(); j++) {
        if (used[j]) {
          continue;
        }
        double score = tokenScore(token, right.get(j));
        if (score > bestScore) {
          bestScore = score;
          bestIndex = j;
          if (score == 1.0) {
            break;
          }
        }
      }
      if (bestIndex >= 0) {
        used[bestIndex] = true;
        sum += bestScore;
      }
    }
    return 2.0 * sum / total;
  }

  static double tokenScore(String a, String b) {
    if (a.equals(b)) {
      return 1.0;
    }
    String shorter = a.length() <= b.length() ? a : b;
    String longer = shorter == a ? b : a;
    if (shorter.length() >= MIN_ABBREVIATION_LENGTH && longer.startsWith(shorter)) {
      return ABBREVIATION_SCORE;
    }
    double ratio = characterRatio(a, b);
    return ratio >= TOKEN_CHAR_FLOOR ? ratio : 0.0;
  }

  private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
    if (aLo >= aHi || bLo >= bHi) {
      return 0;
    }
    int bestLength = 0;
    int bestA = aLo;
    int bestB = bLo;
    int[] previous = new int[bHi - bLo + 1];
    int[] current = new int[bHi - bLo + 1];
    for (int i = aLo; i < aHi; i++) {
      for (int j = bLo; j < bHi; j++) {
        int k = j - bLo + 1;
        if (a.charAt(i) == b.charAt(j)) {
          current[k] = previous[k - 1] + 1;
          if (current[k] > bestLength) {
            bestLength = current[k];
            bestA = i - bestLength + 1;
            bestB = j - bestLength + 1;
          }
        } else {
          current[k] = 0;
        }
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    if (bestLength == 0) {
      return 0;
    }
    return bestLength
        + matchingCharacters(a, aLo, bestA, b, bLo, bestB)
        + matchingCharacters(a, bestA + bestLength, aHi, b, bestB + bestLength, bHi);
  }
}
