package com.flightmail.backend.extraction;

import java.util.Objects;

/**
 * Slice of an email body believed to describe a single flight leg.
 * {@code offset} is the position of the slice's first character in the full body.
 */
public record SegmentWindow(String text, int offset) {

  public SegmentWindow {
    Objects.requireNonNull(text, "text must not be null");
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative: " + offset);
    }
  }

  public static SegmentWindow of(String body) {
    return new SegmentWindow(body != null ? body : "", 0);
  }

  public int end() {
    return offset + text.length();
  }
}
