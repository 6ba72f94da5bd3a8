package br.rio.confere.domain.conformity;

import br.rio.confere.domain.text.DateValues;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Statutory publication deadline: the extract must appear in the gazette within 20 days of signing.
 *
 * @param daysDifference publication date minus signing date in whole days, {@code null} when unknown
 * @param timely whether {@code 0 <= daysDifference <= 20}, {@code null} when unknown
 */
public record Timeliness(Integer daysDifference, Boolean timely) {
  /** Maximum number of days between signing and publication. */
  public static final int DEADLINE_DAYS = 20;

  private static final Timeliness UNKNOWN = new Timeliness(null, null);

  public Timeliness {
    if ((daysDifference == null) != (timely == null)) {
      throw new IllegalArgumentException("daysDifference and timely must both be known or both unknown");
    }
  }

  /** Timeliness that cannot be determined. */
  public static Timeliness unknown() {
    return UNKNOWN;
  }

  /**
   * Evaluates the deadline for parsed dates.
   *
   * @param signed signing date
   * @param published publication date
   * @return evaluated timeliness
   */
  public static Timeliness of(LocalDate signed, LocalDate published) {
    long days = ChronoUnit.DAYS.between(signed, published);
    int difference = Math.toIntExact(days);
    return new Timeliness(difference, difference >= 0 && difference <= DEADLINE_DAYS);
  }

  /**
   * Evaluates the deadline from date text, returning {@link #unknown()} when either date does not parse.
   *
   * @param signedText signing date text
   * @param publishedText publication date text
   * @return evaluated timeliness
   */
  public static Timeliness evaluate(String signedText, String publishedText) {
    Optional<LocalDate> signed = DateValues.parse(signedText);
    Optional<LocalDate> published = DateValues.parse(publishedText);
    if (signed.isEmpty() || published.isEmpty()) {
      return UNKNOWN;
    }
    return of(signed.get(), published.get());
  }
}
