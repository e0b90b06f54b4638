package com.flightmail.backend.extraction;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Isolates substrings inside a segment window. Total over any input: no match,
 * a null window or an empty capture all come back as an empty result.
 * Positions are absolute, i.e. relative to the start of the full body.
 */
public final class FieldExtractor {

  private FieldExtractor() {
  }

  public static Optional<TextMatch> findFirst(SegmentWindow window, Pattern pattern, int group) {
    if (window == null || pattern == null) {
      return Optional.empty();
    }
    Matcher matcher = pattern.matcher(window.text());
    while (matcher.find()) {
      Optional<TextMatch> match = capture(matcher, group, window.offset());
      if (match.isPresent()) {
        return match;
      }
    }
    return Optional.empty();
  }

  private static Optional<TextMatch> capture(Matcher matcher, int group, int offset) {
    if (group > matcher.groupCount()) {
      return Optional.empty();
    }
    String value = matcher.group(group);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new TextMatch(value.trim(), offset + matcher.start(group), offset + matcher.end(group)));
  }
}
