package com.flightmail.backend.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts an email body into one window per flight leg.
 *
 * Each window starts at a leg marker (e.g. a "Flight 2" header) and runs up to the
 * next marker or the end of the body. Text before the first marker is not a window of
 * its own; {@link #preamble} exposes it for layouts that print leg details above the
 * marker. A body without any marker is treated as a single window.
 */
public final class SegmentWindowSplitter {

  private SegmentWindowSplitter() {
  }

  public static List<SegmentWindow> split(String body, Pattern legMarker) {
    if (body == null || body.isEmpty()) {
      return List.of();
    }

    List<Integer> starts = new ArrayList<>();
    Matcher matcher = legMarker.matcher(body);
    while (matcher.find()) {
      starts.add(matcher.start());
    }

    if (starts.isEmpty()) {
      return List.of(SegmentWindow.of(body));
    }

    List<SegmentWindow> windows = new ArrayList<>(starts.size());
    for (int i = 0; i < starts.size(); i++) {
      int start = starts.get(i);
      int end = i + 1 < starts.size() ? starts.get(i + 1) : body.length();
      windows.add(new SegmentWindow(body.substring(start, end), start));
    }
    return List.copyOf(windows);
  }

  /**
   * Text before the first leg marker, or an empty window when the body has no marker
   * or starts with one.
   */
  public static SegmentWindow preamble(String body, Pattern legMarker) {
    if (body == null || body.isEmpty()) {
      return SegmentWindow.of("");
    }
    Matcher matcher = legMarker.matcher(body);
    if (!matcher.find()) {
      return SegmentWindow.of("");
    }
    return SegmentWindow.of(body.substring(0, matcher.start()));
  }
}
