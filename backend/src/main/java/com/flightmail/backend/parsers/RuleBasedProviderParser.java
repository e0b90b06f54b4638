package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.RawEmail;
import com.flightmail.backend.domain.RawSegment;
import com.flightmail.backend.domain.SegmentField;
import com.flightmail.backend.extraction.ExtractionRuleSet;
import com.flightmail.backend.extraction.SegmentWindow;
import com.flightmail.backend.extraction.SegmentWindowSplitter;
import com.flightmail.backend.extraction.TextMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Parser driven entirely by a leg marker and an {@link ExtractionRuleSet}.
 * Subclasses only declare their layout; partitioning and assembly live here.
 *
 * When the body holds a single leg, leg fields printed above its marker (a route line
 * before "Flight No.") fill whatever the leg window itself lacks.
 */
public abstract class RuleBasedProviderParser implements ProviderParser {

  private static final Logger log = LoggerFactory.getLogger(RuleBasedProviderParser.class);

  private final Pattern legMarker;
  private final ExtractionRuleSet rules;

  protected RuleBasedProviderParser(Pattern legMarker, ExtractionRuleSet rules) {
    this.legMarker = Objects.requireNonNull(legMarker, "legMarker must not be null");
    this.rules = Objects.requireNonNull(rules, "rules must not be null");
  }

  @Override
  public Stream<RawSegment> parse(RawEmail email) {
    Objects.requireNonNull(email, "email must not be null");

    String body = email.getBody();
    Map<SegmentField, String> shared = values(rules.extractEmail(body, email.getSubject()));

    List<SegmentWindow> windows = SegmentWindowSplitter.split(body, legMarker);
    Map<SegmentField, String> preamble = windows.size() == 1
        ? values(rules.extractLeg(SegmentWindowSplitter.preamble(body, legMarker)))
        : Map.of();

    return windows.stream()
        .map(window -> toSegment(email, window, shared, preamble))
        .filter(segment -> !segment.isEmpty());
  }

  private RawSegment toSegment(RawEmail email,
      SegmentWindow window,
      Map<SegmentField, String> shared,
      Map<SegmentField, String> preamble) {
    Map<SegmentField, String> legFields = values(rules.extractLeg(window));
    if (legFields.isEmpty()) {
      log.debug("No flight fields in window [{}, {}) of email {}", window.offset(), window.end(), email.getId());
      return RawSegment.builder(email, format()).build();
    }
    preamble.forEach(legFields::putIfAbsent);

    RawSegment segment = RawSegment.builder(email, format())
        .setAll(shared)
        .setAll(legFields)
        .build();
    log.debug("Extracted {} from window [{}, {}) of email {}",
        segment.asMap().keySet(), window.offset(), window.end(), email.getId());
    return segment;
  }

  private static Map<SegmentField, String> values(Map<SegmentField, TextMatch> matches) {
    Map<SegmentField, String> result = new EnumMap<>(SegmentField.class);
    matches.forEach((field, match) -> result.put(field, match.value()));
    return result;
  }
}
