package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.domain.RawEmail;
import com.flightmail.backend.domain.RawSegment;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TripComParser}. Trip.com confirmations list every leg under a
 * numbered "Flight N" header; the booking number is shared by all legs.
 */
class TripComParserTest {

  private static final String ROUND_TRIP = """
      Your flight booking is confirmed.
      Booking No.: 1128374651

      Flight 1 · Depart
      AA100  American Airlines
      San Francisco (SFO) → New York (JFK)
      Departure: 2024-06-15 09:00
      Arrival: 2024-06-15 17:35

      Flight 2 · Return
      AA101  American Airlines
      New York (JFK) → San Francisco (SFO)
      Departure: 2024-06-22 08:00
      Arrival: 2024-06-22 11:30
      Duration: 6h 30m
      """;

  private final TripComParser parser = new TripComParser();

  /**
   * Happy-path test:
   * A round trip yields two segments in body order, each with its own fields.
   */
  @Test
  void parse_shouldExtractEveryLeg() {
    // given
    RawEmail email = email(ROUND_TRIP);

    // when
    List<RawSegment> segments = parser.parse(email).toList();

    // then
    assertEquals(2, segments.size());

    RawSegment outbound = segments.get(0);
    assertEquals(Optional.of("AA100"), outbound.getFlightNumber());
    assertEquals(Optional.of("American Airlines"), outbound.getAirlineRaw());
    assertEquals(Optional.of("SFO"), outbound.getOrigin());
    assertEquals(Optional.of("JFK"), outbound.getDestination());
    assertEquals(Optional.of("2024-06-15 09:00"), outbound.getDepartureRaw());
    assertEquals(Optional.of("2024-06-15 17:35"), outbound.getArrivalRaw());
    assertTrue(outbound.getDurationRaw().isEmpty(), "Duration belongs to the return leg only");

    RawSegment inbound = segments.get(1);
    assertEquals(Optional.of("AA101"), inbound.getFlightNumber());
    assertEquals(Optional.of("JFK"), inbound.getOrigin());
    assertEquals(Optional.of("SFO"), inbound.getDestination());
    assertEquals(Optional.of("6h 30m"), inbound.getDurationRaw());

    assertEquals(Optional.of("1128374651"), outbound.getConfirmationCode());
    assertEquals(Optional.of("1128374651"), inbound.getConfirmationCode());
    assertTrue(segments.stream().allMatch(s -> s.getSourceFormat() == ProviderFormat.TRIP_COM));
  }

  @Test
  void parse_shouldUseLabelledFallbacks() {
    // given
    RawEmail email = email("""
        Flight 1
        Flight No.: BA 117
        Airline: British Airways
        LHR → JFK
        Departs: Jun 15, 2024 11:20
        """);

    // when
    RawSegment segment = parser.parse(email).findFirst().orElseThrow();

    // then
    assertEquals(Optional.of("BA 117"), segment.getFlightNumber());
    assertEquals(Optional.of("British Airways"), segment.getAirlineRaw());
    assertEquals(Optional.of("LHR"), segment.getOrigin());
    assertEquals(Optional.of("JFK"), segment.getDestination());
    assertEquals(Optional.of("Jun 15, 2024 11:20"), segment.getDepartureRaw());
  }

  /**
   * Edge case:
   * A leg whose block is garbled still produces the fields that can be read.
   */
  @Test
  void parse_shouldKeepPartialLeg() {
    RawEmail email = email("""
        Flight 1 · Depart
        San Francisco (SFO) → New York (JFK)
        """);

    List<RawSegment> segments = parser.parse(email).toList();

    assertEquals(1, segments.size());
    assertTrue(segments.get(0).getFlightNumber().isEmpty());
    assertEquals(Optional.of("SFO"), segments.get(0).getOrigin());
  }

  private static RawEmail email(String body) {
    return new RawEmail("trip-1", "Trip.com <flight@trip.com>", "Flight booking confirmed", body,
        Instant.parse("2024-05-02T08:00:00Z"));
  }
}
