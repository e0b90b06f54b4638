package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.extraction.ExtractionRuleSet;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

import static com.flightmail.backend.domain.SegmentField.*;

/**
 * Booking.com flight confirmations and reminders. Legs are introduced by
 * "Outbound flight" / "Return flight" headers, or "Flight 2 of 3" on multi-city trips:
 *
 * <pre>
 * Booking reference: 4839-201-559
 *
 * Outbound flight
 * SFO – JFK
 * Flight number: AA100
 * Airline: American Airlines
 * Departure: Sat 15 Jun 2024 · 09:00
 * Arrival: Sat 15 Jun 2024 · 17:35
 * Flight time: 5h 35m
 * </pre>
 */
@Component
public class BookingComParser extends RuleBasedProviderParser {

  static final Pattern LEG_MARKER = Pattern.compile(
      "(?im)^[ \\t]*(?:(?:outbound|return|inbound|connecting)[ \\t]+flight\\b|flight[ \\t]+\\d+[ \\t]+of[ \\t]+\\d+\\b)");

  static final ExtractionRuleSet RULES = ExtractionRuleSet.builder()
      .email(CONFIRMATION_CODE,
          "\\b(?i:booking\\s+reference|reference\\s+number|confirmation\\s+number)[ \\t]*:?[ \\t]*([A-Z0-9][A-Z0-9-]{4,20})\\b")
      .leg(FLIGHT_NUMBER, "\\b(?i:flight\\s+number)[ \\t]*:?[ \\t]*([A-Z0-9]{2}[ \\t]?\\d{1,4}[A-Z]?)\\b")
      .leg(AIRLINE, "\\b(?i:airline|operated\\s+by)[ \\t]*:[ \\t]*([^\\n]+)")
      .leg(ORIGIN, DESTINATION, "^[ \\t]*([A-Z]{3})[ \\t]*(?:\u2013|\u2014|-|\u2192|->|(?i:to))[ \\t]*([A-Z]{3})[ \\t]*$")
      .leg(ORIGIN, DESTINATION, "\\(([A-Z]{3})\\)[^\\n]*?(?:\u2013|\u2014|-|\u2192|->|(?i:\\bto\\b))[^\\n]*?\\(([A-Z]{3})\\)")
      .leg(DEPARTURE, "\\b(?i:departure|departs)[ \\t]*:[ \\t]*([^\\n]+)")
      .leg(ARRIVAL, "\\b(?i:arrival|arrives)[ \\t]*:[ \\t]*([^\\n]+)")
      .leg(DURATION, "\\b(?i:flight\\s+time|duration)[ \\t]*:[ \\t]*([^\\n]+)")
      .build();

  public BookingComParser() {
    super(LEG_MARKER, RULES);
  }

  @Override
  public ProviderFormat format() {
    return ProviderFormat.BOOKING_COM;
  }
}
