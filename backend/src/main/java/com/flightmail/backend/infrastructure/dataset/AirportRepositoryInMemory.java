package com.flightmail.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.flightmail.backend.domain.Airport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * IATA code to Airport lookup, used to attach a UTC offset to local times read from emails.
 * Airports are the one mandatory section of the reference dataset: without a usable
 * airport no departure can be placed in time, so startup fails instead.
 */
@Component
public class AirportRepositoryInMemory {

  private static final Logger log = LoggerFactory.getLogger(AirportRepositoryInMemory.class);

  static final String SECTION = "airports";

  private final Map<String, Airport> airportsByCode;

  public AirportRepositoryInMemory(ReferenceDatasetLoader datasetLoader, AirportJsonMapper airportJsonMapper) {
    JsonNode airportsNode = datasetLoader.arraySection(SECTION).orElseThrow(() -> {
      log.error("Reference dataset is missing the '{}' array", SECTION);
      return new IllegalStateException("Reference dataset missing '" + SECTION + "' array");
    });
    this.airportsByCode = indexByCode(airportsNode, airportJsonMapper);
    log.info("Loaded {} of {} airports from reference dataset", airportsByCode.size(), airportsNode.size());
  }

  private static Map<String, Airport> indexByCode(JsonNode airportsNode, AirportJsonMapper airportJsonMapper) {
    Map<String, Airport> result = new HashMap<>();
    for (JsonNode node : airportsNode) {
      airportJsonMapper.toAirport(node).ifPresent(airport -> {
        Airport previous = result.putIfAbsent(airport.getCode(), airport);
        if (previous != null) {
          log.warn("Duplicate airport code {} in reference dataset; keeping the first entry", airport.getCode());
        }
      });
    }

    if (result.isEmpty()) {
      log.error("No valid airports could be loaded from the reference dataset");
      throw new IllegalStateException("No valid airports found in reference dataset");
    }
    return Collections.unmodifiableMap(result);
  }

  public Optional<Airport> findByCode(String code) {
    return code == null ? Optional.empty() : Optional.ofNullable(airportsByCode.get(code));
  }

  public Collection<Airport> findAll() {
    return airportsByCode.values();
  }
}
