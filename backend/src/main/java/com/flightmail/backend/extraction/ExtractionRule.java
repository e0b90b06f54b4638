package com.flightmail.backend.extraction;

import com.flightmail.backend.domain.SegmentField;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row of a provider's extraction table: which field, found by which anchor
 * pattern, taken from which capture group.
 */
public record ExtractionRule(SegmentField field, Pattern pattern, int group) {

  public ExtractionRule {
    Objects.requireNonNull(field, "field must not be null");
    Objects.requireNonNull(pattern, "pattern must not be null");
    if (group < 0 || group > pattern.matcher("").groupCount()) {
      throw new IllegalArgumentException(
          "Capture group " + group + " does not exist in pattern for " + field + ": " + pattern);
    }
  }
}
