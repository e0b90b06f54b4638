package com.flightmail.backend.normalization;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads flight durations written as "2h 10m", "2h10m", "2 hrs 10 mins", "45m", "1h"
 * or ISO-8601 "PT2H10M" into whole minutes.
 */
public final class DurationParser {

  private static final Pattern HOURS_MINUTES = Pattern.compile(
      "^(?:(\\d{1,2})\\s*h(?:ours?|rs?)?\\.?)?\\s*(?:(\\d{1,3})\\s*m(?:in(?:ute)?s?)?\\.?)?$");

  private DurationParser() {
  }

  public static Optional<Integer> parseMinutes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String text = raw.trim().toLowerCase(Locale.ROOT);

    if (text.startsWith("pt")) {
      return parseIso(text);
    }

    Matcher matcher = HOURS_MINUTES.matcher(text);
    if (!matcher.matches() || (matcher.group(1) == null && matcher.group(2) == null)) {
      return Optional.empty();
    }

    int hours = matcher.group(1) != null ? Integer.parseInt(matcher.group(1)) : 0;
    int minutes = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0;
    int total = hours * 60 + minutes;
    return total > 0 ? Optional.of(total) : Optional.empty();
  }

  private static Optional<Integer> parseIso(String text) {
    try {
      long minutes = Duration.parse(text.toUpperCase(Locale.ROOT)).toMinutes();
      return minutes > 0 && minutes <= Integer.MAX_VALUE ? Optional.of((int) minutes) : Optional.empty();
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
