package com.flightmail.backend.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FlightRecord} invariants and its completeness score.
 */
class FlightRecordTest {

  private static final OffsetDateTime DEPARTURE = OffsetDateTime.of(2024, 6, 15, 8, 30, 0, 0, ZoneOffset.ofHours(7));

  @Test
  void constructor_shouldAcceptMinimalRecord() {
    // when
    FlightRecord record = new FlightRecord("VJ123", "SGN", "HAN", DEPARTURE, null,
        FlightRecord.UNKNOWN_AIRLINE, null, null, Set.of("vj-1"), null);

    // then
    assertEquals(2, record.getCompleteness(), "Flight number and departure are the only known facts");
    assertFalse(record.isAirlineKnown());
    assertEquals(DEPARTURE.toInstant(), record.getDepartureInstant());
  }

  @Test
  void constructor_shouldAcceptExplicitlyUnknownFlightNumber() {
    FlightRecord record = new FlightRecord(FlightRecord.UNKNOWN_FLIGHT_NUMBER, "SGN", "HAN", null, null,
        "VietJet Air", null, null, Set.of("vj-1"), null);

    assertFalse(record.isFlightNumberKnown());
    assertNull(record.getDepartureInstant());
  }

  @Test
  void constructor_shouldEnforceInvariants() {
    assertThrows(IllegalArgumentException.class, () -> create("VJ-123", "SGN", "HAN", DEPARTURE.plusHours(2), 120));
    assertThrows(IllegalArgumentException.class, () -> create("VJ123", "SGNX", "HAN", DEPARTURE.plusHours(2), 120));
    assertThrows(IllegalArgumentException.class, () -> create("VJ123", "SGN", "SGN", DEPARTURE.plusHours(2), 120));
    assertThrows(IllegalArgumentException.class, () -> create("VJ123", "SGN", "HAN", DEPARTURE, 120));
    assertThrows(IllegalArgumentException.class, () -> create("VJ123", "SGN", "HAN", DEPARTURE.plusHours(2), 0));
    assertThrows(IllegalArgumentException.class, () -> new FlightRecord("VJ123", "SGN", "HAN", DEPARTURE, null,
        "VietJet Air", null, null, Set.of(), null));
    assertThrows(NullPointerException.class, () -> new FlightRecord(null, "SGN", "HAN", DEPARTURE, null,
        "VietJet Air", null, null, Set.of("vj-1"), null));
  }

  @Test
  void getSourceEmailIds_shouldBeSortedAndUnmodifiable() {
    FlightRecord record = new FlightRecord("VJ123", "SGN", "HAN", DEPARTURE, null,
        "VietJet Air", null, null, Set.of("b", "a", "c"), Instant.EPOCH);

    assertEquals("a", record.getSourceEmailIds().first());
    assertThrows(UnsupportedOperationException.class, () -> record.getSourceEmailIds().add("d"));
  }

  private static FlightRecord create(String flightNumber, String origin, String destination,
      OffsetDateTime arrival, Integer duration) {
    return new FlightRecord(flightNumber, origin, destination, DEPARTURE, arrival, "VietJet Air",
        duration, null, Set.of("vj-1"), null);
  }
}
