package com.flightmail.backend.infrastructure.dataset;

import com.flightmail.backend.domain.Airport;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.Collection;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AirportRepositoryInMemory}.
 * No mocking framework: the dataset comes from a {@link StringReferenceDatasetLoader}.
 * The goal is to verify that:
 *  - valid airports are loaded and looked up by code,
 *  - invalid airports are skipped and a duplicated code keeps its first entry,
 *  - missing or unusable datasets cause a fail-fast IllegalStateException,
 *  - the exposed collection is unmodifiable.
 */
class AirportRepositoryInMemoryTest {

  /**
   * Happy-path test:
   * The shared sample dataset loads and lookups behave as expected.
   */
  @Test
  void constructor_shouldLoadValidAirports() {
    // when
    AirportRepositoryInMemory repository =
        StringReferenceDatasetLoader.airports(StringReferenceDatasetLoader.SAMPLE_JSON);

    // then
    Optional<Airport> maybeSgn = repository.findByCode("SGN");
    assertTrue(maybeSgn.isPresent(), "Expected SGN airport to be present");
    assertEquals(ZoneId.of("Asia/Ho_Chi_Minh"), maybeSgn.get().getTimezone());

    Collection<Airport> all = repository.findAll();
    assertEquals(5, all.size(), "Expected every sample airport in repository");

    assertTrue(repository.findByCode("XYZ").isEmpty(), "Unknown airport codes should return Optional.empty");
    assertTrue(repository.findByCode(null).isEmpty(), "A null code should return Optional.empty");
  }

  /**
   * Edge case:
   * Invalid entries are skipped while valid ones load.
   */
  @Test
  void constructor_shouldSkipInvalidAirports() {
    // given
    String json = """
        {
          "airports": [
            { "code": "JFK", "name": "JFK", "city": "New York", "timezone": "America/New_York" },
            { "code": "BAD", "name": "Bad zone", "city": "Nowhere", "timezone": "Not/AZone" },
            { "name": "No code", "city": "Nowhere", "timezone": "UTC" }
          ]
        }
        """;

    // when
    AirportRepositoryInMemory repository = StringReferenceDatasetLoader.airports(json);

    // then
    assertEquals(1, repository.findAll().size());
    assertTrue(repository.findByCode("JFK").isPresent());
    assertTrue(repository.findByCode("BAD").isEmpty());
  }

  /**
   * Failure case:
   * A dataset without an airports array fails fast.
   */
  @Test
  void constructor_shouldFailWhenAirportsArrayMissing() {
    String json = """
        { "airlines": [] }
        """;

    assertThrows(IllegalStateException.class,
        () -> StringReferenceDatasetLoader.airports(json),
        "Expected IllegalStateException when 'airports' array is missing");
  }

  /**
   * Failure case:
   * A dataset whose airports are all invalid fails fast.
   */
  @Test
  void constructor_shouldFailWhenNoValidAirports() {
    String json = """
        { "airports": [ { "code": "12", "name": "x", "city": "y", "timezone": "UTC" } ] }
        """;

    assertThrows(IllegalStateException.class,
        () -> StringReferenceDatasetLoader.airports(json),
        "Expected IllegalStateException when no valid airport can be loaded");
  }

  /**
   * Edge case:
   * A code listed twice keeps its first entry.
   */
  @Test
  void constructor_shouldKeepFirstEntryForDuplicateCode() {
    // given
    String json = """
        {
          "airports": [
            { "code": "SGN", "name": "Tan Son Nhat", "city": "Ho Chi Minh City", "timezone": "Asia/Ho_Chi_Minh" },
            { "code": "SGN", "name": "Duplicate", "city": "Elsewhere", "timezone": "UTC" }
          ]
        }
        """;

    // when
    AirportRepositoryInMemory repository = StringReferenceDatasetLoader.airports(json);

    // then
    assertEquals(1, repository.findAll().size());
    assertEquals(ZoneId.of("Asia/Ho_Chi_Minh"), repository.findByCode("SGN").orElseThrow().getTimezone());
  }

  @Test
  void findAll_shouldBeUnmodifiable() {
    AirportRepositoryInMemory repository =
        StringReferenceDatasetLoader.airports(StringReferenceDatasetLoader.SAMPLE_JSON);

    assertThrows(UnsupportedOperationException.class, () -> repository.findAll().clear());
  }
}
