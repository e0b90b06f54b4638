package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.extraction.ExtractionRuleSet;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

import static com.flightmail.backend.domain.SegmentField.*;

/**
 * Trip.com flight booking confirmations. Every leg opens with a numbered
 * "Flight N" header:
 *
 * <pre>
 * Booking No.: 1128374651
 *
 * Flight 1 · Depart
 * AA100  American Airlines
 * San Francisco (SFO) → New York (JFK)
 * Departure: 2024-06-15 09:00
 * Arrival: 2024-06-15 17:35
 * Duration: 5h 35m
 * </pre>
 */
@Component
public class TripComParser extends RuleBasedProviderParser {

  static final Pattern LEG_MARKER = Pattern.compile("(?im)^[ \\t]*flight[ \\t]+\\d+\\b");

  static final ExtractionRuleSet RULES = ExtractionRuleSet.builder()
      .email(CONFIRMATION_CODE, "\\b(?i:booking\\s+(?:no\\.?|number)|order\\s+(?:no\\.?|number))\\s*:?\\s*([A-Z0-9]{5,16})\\b")
      .leg(FLIGHT_NUMBER, "^[ \\t]*([A-Z0-9]{2}[ \\t]?\\d{1,4}[A-Z]?)[ \\t]+[A-Za-z]")
      .leg(FLIGHT_NUMBER, "\\b(?i:flight\\s+(?:no\\.?|number))\\s*:?\\s*([A-Z0-9]{2}[ \\t]?\\d{1,4}[A-Z]?)\\b")
      .leg(AIRLINE, "^[ \\t]*[A-Z0-9]{2}[ \\t]?\\d{1,4}[A-Z]?[ \\t]+([A-Za-z][^\\n]*)$")
      .leg(AIRLINE, "\\b(?i:airline)[ \\t]*:[ \\t]*([^\\n]+)")
      .leg(ORIGIN, DESTINATION, "\\(([A-Z]{3})\\)[^\\n]*?(?:\u2192|->|\u2013|-|(?i:\\bto\\b))[^\\n]*?\\(([A-Z]{3})\\)")
      .leg(ORIGIN, DESTINATION, "\\b([A-Z]{3})[ \\t]*(?:\u2192|->|\u2013|-)[ \\t]*([A-Z]{3})\\b")
      .leg(DEPARTURE, "\\b(?i:depart(?:ure|s)?(?:\\s+time)?)[ \\t]*:[ \\t]*([^\\n]+)")
      .leg(ARRIVAL, "\\b(?i:arriv(?:al|es|e)(?:\\s+time)?)[ \\t]*:[ \\t]*([^\\n]+)")
      .leg(DURATION, "\\b(?i:duration|flight\\s+time)[ \\t]*:[ \\t]*([^\\n]+)")
      .build();

  public TripComParser() {
    super(LEG_MARKER, RULES);
  }

  @Override
  public ProviderFormat format() {
    return ProviderFormat.TRIP_COM;
  }
}
