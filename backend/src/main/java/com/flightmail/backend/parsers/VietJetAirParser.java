package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.extraction.ExtractionRuleSet;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

import static com.flightmail.backend.domain.SegmentField.*;

/**
 * VietJet Air itinerary emails. One fixed template, normally a single leg:
 *
 * <pre>
 * Reservation # ABC123
 * Flight No. VJ 123
 * From: SGN To: HAN
 * Date: 15 Jun, 08:30
 * Arrival: 15 Jun, 10:40
 * Duration: 2h 10m
 * </pre>
 *
 * Dates often omit the year and sometimes the time. The route may also be printed as
 * "Departure: SGN Arrival: HAN", or above the "Flight No." line. A repeated
 * "Flight No." line starts another leg.
 */
@Component
public class VietJetAirParser extends RuleBasedProviderParser {

  static final Pattern LEG_MARKER = Pattern.compile("(?im)^[ \\t]*flight\\s*(?:no\\.?|number)\\b");

  // "Departure: SGN" names an airport, "Departure: JUN 15" a date
  private static final String NOT_AN_AIRPORT = "(?![A-Z]{3}\\b(?![ \\t]*\\d))";

  static final ExtractionRuleSet RULES = ExtractionRuleSet.builder()
      .email(CONFIRMATION_CODE, "\\b(?i:reservation|booking)\\s*(?:(?i:number|code|no\\.?)\\s*)?[:#]?\\s*([A-Z0-9]{6,8})\\b")
      .leg(FLIGHT_NUMBER, "\\b(?i:flight\\s*(?:no\\.?|number))\\s*:?\\s*([A-Z0-9]{2}[ \\t]?\\d{1,4}[A-Z]?)\\b")
      .leg(ORIGIN, DESTINATION, "\\b(?i:from)\\s*:[^\\n]*?\\(([A-Z]{3})\\)[^\\n]*?(?i:to)\\s*:[^\\n]*?\\(([A-Z]{3})\\)")
      .leg(ORIGIN, DESTINATION, "\\b(?i:from)\\s*:\\s*([A-Z]{3})\\b[^\\n]*?(?i:to)\\s*:\\s*([A-Z]{3})\\b")
      .leg(ORIGIN, DESTINATION, "\\b(?i:departure)[ \\t]*:[ \\t]*([A-Z]{3})\\b[ \\t]+(?i:arrival)[ \\t]*:[ \\t]*([A-Z]{3})\\b")
      .leg(ORIGIN, DESTINATION, "\\b([A-Z]{3})[ \\t]*(?:->|\u2192|\u2013|-)[ \\t]*([A-Z]{3})\\b")
      .leg(DEPARTURE, "\\b(?i:date|departure(?:\\s+time)?)[ \\t]*:[ \\t]*" + NOT_AN_AIRPORT + "(\\S[^\\n]*)")
      .leg(ARRIVAL, "\\b(?i:arrival(?:\\s+time)?)[ \\t]*:[ \\t]*" + NOT_AN_AIRPORT + "(\\S[^\\n]*)")
      .leg(DURATION, "\\b(?i:duration|flight\\s+time)[ \\t]*:[ \\t]*([^\\n]+)")
      .build();

  public VietJetAirParser() {
    super(LEG_MARKER, RULES);
  }

  @Override
  public ProviderFormat format() {
    return ProviderFormat.VIETJET_AIR;
  }
}
