package com.flightmail.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.flightmail.backend.domain.Airline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Carrier designator to airline name lookup.
 * An absent or empty "airlines" array is tolerated: airline names then come only
 * from the emails themselves.
 */
@Component
public class AirlineRepositoryInMemory {

  private static final Logger log = LoggerFactory.getLogger(AirlineRepositoryInMemory.class);

  static final String SECTION = "airlines";

  private final Map<String, Airline> airlinesByCode;

  public AirlineRepositoryInMemory(ReferenceDatasetLoader datasetLoader, AirlineJsonMapper airlineJsonMapper) {
    this.airlinesByCode = datasetLoader.arraySection(SECTION)
        .map(section -> indexByCode(section, airlineJsonMapper))
        .orElseGet(() -> {
          log.warn("Reference dataset has no '{}' array; carrier lookup disabled", SECTION);
          return Map.of();
        });
    log.info("Loaded {} airlines from reference dataset", airlinesByCode.size());
  }

  private static Map<String, Airline> indexByCode(JsonNode airlinesNode, AirlineJsonMapper airlineJsonMapper) {
    Map<String, Airline> result = new HashMap<>();
    for (JsonNode node : airlinesNode) {
      airlineJsonMapper.toAirline(node).ifPresent(airline -> result.putIfAbsent(airline.getCode(), airline));
    }
    return Collections.unmodifiableMap(result);
  }

  public Optional<Airline> findByCode(String code) {
    return code == null ? Optional.empty() : Optional.ofNullable(airlinesByCode.get(code));
  }

  /**
   * Resolve the operating airline from the designator at the start of a flight
   * number ("VJ123" -> VJ).
   */
  public Optional<Airline> findByFlightNumber(String flightNumber) {
    if (flightNumber == null || flightNumber.length() < 3) {
      return Optional.empty();
    }
    return findByCode(flightNumber.substring(0, 2));
  }

  public Collection<Airline> findAll() {
    return airlinesByCode.values();
  }
}
