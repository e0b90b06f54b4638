package com.flightmail.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightmail.backend.domain.Airport;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AirportJsonMapper}:
 *  - complete entries become Airports with a resolved ZoneId,
 *  - codes are normalized to upper case,
 *  - incomplete entries, malformed codes and unknown zones are skipped.
 */
class AirportJsonMapperTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final AirportJsonMapper mapper = new AirportJsonMapper();

  @Test
  void toAirport_shouldMapCompleteEntry() throws Exception {
    // given
    JsonNode node = objectMapper.readTree("""
        { "code": "sgn", "name": "Tan Son Nhat", "city": "Ho Chi Minh City", "timezone": "Asia/Ho_Chi_Minh" }
        """);

    // when
    Optional<Airport> result = mapper.toAirport(node);

    // then
    assertTrue(result.isPresent());
    Airport airport = result.get();
    assertEquals("SGN", airport.getCode());
    assertEquals("Tan Son Nhat", airport.getName());
    assertEquals("Ho Chi Minh City", airport.getCity());
    assertEquals(ZoneId.of("Asia/Ho_Chi_Minh"), airport.getTimezone());
  }

  @Test
  void toAirport_shouldSkipEntryWithMissingField() throws Exception {
    JsonNode node = objectMapper.readTree("""
        { "code": "HAN", "name": "Noi Bai", "timezone": "Asia/Ho_Chi_Minh" }
        """);

    assertTrue(mapper.toAirport(node).isEmpty(), "An airport without a city must be skipped");
  }

  @Test
  void toAirport_shouldSkipMalformedCode() throws Exception {
    JsonNode node = objectMapper.readTree("""
        { "code": "HA1", "name": "Bad", "city": "Nowhere", "timezone": "UTC" }
        """);

    assertTrue(mapper.toAirport(node).isEmpty(), "A code that is not three letters must be skipped");
  }

  @Test
  void toAirport_shouldSkipUnknownTimezone() throws Exception {
    JsonNode node = objectMapper.readTree("""
        { "code": "XXX", "name": "Bad", "city": "Nowhere", "timezone": "Mars/Olympus_Mons" }
        """);

    assertTrue(mapper.toAirport(node).isEmpty(), "An airport with an unknown zone id must be skipped");
  }
}
