package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.RawEmail;
import com.flightmail.backend.domain.RawSegment;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BookingComParserTest {

  private final BookingComParser parser = new BookingComParser();

  @Test
  void parse_shouldExtractOutboundFlight() {
    // given
    RawEmail email = email("""
        Get ready for your trip!
        Booking reference: 4839-201-559

        Outbound flight
        SFO – JFK
        Flight number: AA100
        Airline: American Airlines
        Departure: Sat 15 Jun 2024 · 09:00
        Arrival: Sat 15 Jun 2024 · 17:35
        Flight time: 5h 35m
        """);

    // when
    List<RawSegment> segments = parser.parse(email).toList();

    // then
    assertEquals(1, segments.size());
    RawSegment segment = segments.get(0);
    assertEquals(Optional.of("AA100"), segment.getFlightNumber());
    assertEquals(Optional.of("SFO"), segment.getOrigin());
    assertEquals(Optional.of("JFK"), segment.getDestination());
    assertEquals(Optional.of("American Airlines"), segment.getAirlineRaw());
    assertEquals(Optional.of("Sat 15 Jun 2024 · 09:00"), segment.getDepartureRaw());
    assertEquals(Optional.of("Sat 15 Jun 2024 · 17:35"), segment.getArrivalRaw());
    assertEquals(Optional.of("5h 35m"), segment.getDurationRaw());
    assertEquals(Optional.of("4839-201-559"), segment.getConfirmationCode());
  }

  /**
   * Multi-city itineraries number their legs "Flight N of M"; the route may only be
   * given through airport names with codes in parentheses.
   */
  @Test
  void parse_shouldSplitMultiCityLegs() {
    // given
    RawEmail email = email("""
        Flight 1 of 2
        London Heathrow (LHR) to New York JFK (JFK)
        Flight number: BA117
        Departure: 15 Jun 2024, 11:20

        Flight 2 of 2
        New York JFK (JFK) to San Francisco (SFO)
        Flight number: AA15
        Departure: 18 Jun 2024, 07:00
        """);

    // when
    List<RawSegment> segments = parser.parse(email).toList();

    // then
    assertEquals(2, segments.size());
    assertEquals(Optional.of("LHR"), segments.get(0).getOrigin());
    assertEquals(Optional.of("JFK"), segments.get(0).getDestination());
    assertEquals(Optional.of("AA15"), segments.get(1).getFlightNumber());
    assertEquals(Optional.of("SFO"), segments.get(1).getDestination());
    assertTrue(segments.get(0).getConfirmationCode().isEmpty());
  }

  private static RawEmail email(String body) {
    return new RawEmail("booking-1", "noreply@booking.com", "Your flight to New York", body,
        Instant.parse("2024-06-10T12:00:00Z"));
  }
}
