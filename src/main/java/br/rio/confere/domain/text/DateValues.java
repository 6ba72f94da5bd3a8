package br.rio.confere.domain.text;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses dates found in contracts and gazette entries.
 */
public final class DateValues {
  private static final List<DateTimeFormatter> FORMATS = List.of(
      DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("dd-MM-uuuu").withResolverStyle(ResolverStyle.STRICT),
      DateTimeFormatter.ofPattern("dd.MM.uuuu").withResolverStyle(ResolverStyle.STRICT));
  private static final Pattern DATE_TOKEN =
      Pattern.compile("\\d{4}-\\d{2}-\\d{2}|\\d{2}[/.-]\\d{2}[/.-]\\d{4}");

  private DateValues() {
    // Utility
  }

  /**
   * Parses the first date found in {@code text}.
   *
   * @param text date text; surrounding words are ignored
   * @return parsed date, or empty when none is recognized
   */
  public static Optional<LocalDate> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    Matcher matcher = DATE_TOKEN.matcher(text);
    while (matcher.find()) {
      String token = matcher.group();
      for (DateTimeFormatter format : FORMATS) {
        try {
          return Optional.of(LocalDate.parse(token, format));
        } catch (DateTimeParseException ignored) {
          // try the next layout
        }
      }
    }
    return Optional.empty();
  }
}
