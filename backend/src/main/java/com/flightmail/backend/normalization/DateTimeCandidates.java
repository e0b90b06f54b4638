package com.flightmail.backend.normalization;

import com.flightmail.backend.domain.ProviderFormat;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Provider-specific candidate formats for the date/time strings found in emails.
 * Candidates are tried in order and the first that consumes the whole (cleaned)
 * string wins. A string without a year takes the supplied hint year, and a date
 * without a time of day is read as midnight. Impossible calendar dates such as
 * 31 June are rejected, never clamped.
 */
public final class DateTimeCandidates {

  private static final Pattern LEADING_WEEKDAY =
      Pattern.compile("^(?i:mon|tue|wed|thu|fri|sat|sun)[a-z]*\\.?,?\\s+");
  private static final Pattern PARENTHESIZED = Pattern.compile("\\([^)]*\\)");
  private static final Pattern SEPARATOR_GLYPHS = Pattern.compile("[·|•]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern FOUR_DIGIT_YEAR = Pattern.compile("(?<!\\d)\\d{4}(?!\\d)");

  // "15 Jun, 08:30", "15 June 2024 8:30", "15 Jun 2024, 08:30"
  private static final String DAY_MONTH = "d [MMMM][MMM][ uuuu][,] H:mm";
  // "Jun 15, 2024 09:00", "June 15 09:00"
  private static final String MONTH_DAY = "[MMMM][MMM] d[,][ uuuu][,] H:mm";
  // "2024-06-15 09:00", "2024-06-15T09:00:00"
  private static final String ISO_LIKE = "uuuu-MM-dd['T'][ ]H:mm[:ss]";
  // "15/06/2024 08:30"
  private static final String DAY_FIRST_NUMERIC = "d/M/uuuu H:mm";
  // "12 March 2026", "15 Jun"
  private static final String DAY_MONTH_DATE = "d [MMMM][MMM][ uuuu]";
  // "12/03/2026"
  private static final String DAY_FIRST_NUMERIC_DATE = "d/M/uuuu";

  private static final Map<ProviderFormat, List<String>> PATTERNS = new EnumMap<>(ProviderFormat.class);

  static {
    PATTERNS.put(ProviderFormat.VIETJET_AIR, List.of(DAY_MONTH, DAY_FIRST_NUMERIC, ISO_LIKE, DAY_MONTH_DATE, DAY_FIRST_NUMERIC_DATE));
    PATTERNS.put(ProviderFormat.TRIP_COM, List.of(ISO_LIKE, MONTH_DAY, DAY_MONTH));
    PATTERNS.put(ProviderFormat.BOOKING_COM, List.of(DAY_MONTH, ISO_LIKE, MONTH_DAY));
    PATTERNS.put(ProviderFormat.UNRECOGNIZED, List.of(ISO_LIKE));
  }

  private DateTimeCandidates() {
  }

  public static List<String> patternsFor(ProviderFormat format) {
    return PATTERNS.get(format);
  }

  public static Optional<ParsedDateTime> parse(String raw, ProviderFormat format, int hintYear) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String cleaned = clean(raw);
    boolean yearExplicit = FOUR_DIGIT_YEAR.matcher(cleaned).find();

    for (String pattern : patternsFor(format)) {
      Optional<LocalDateTime> parsed = tryParse(cleaned, pattern, hintYear);
      if (parsed.isPresent()) {
        return Optional.of(new ParsedDateTime(parsed.get(), yearExplicit));
      }
    }
    return Optional.empty();
  }

  static String clean(String raw) {
    String text = PARENTHESIZED.matcher(raw).replaceAll(" ");
    text = SEPARATOR_GLYPHS.matcher(text).replaceAll(" ");
    text = WHITESPACE.matcher(text).replaceAll(" ").trim();
    text = LEADING_WEEKDAY.matcher(text).replaceFirst("");
    return text;
  }

  private static Optional<LocalDateTime> tryParse(String text, String pattern, int hintYear) {
    DateTimeFormatter formatter = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .parseDefaulting(ChronoField.YEAR, hintYear)
        .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
        .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
    try {
      return Optional.of(formatter.parse(text, LocalDateTime::from));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }
}
