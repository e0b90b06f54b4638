package com.flightmail.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.flightmail.backend.domain.Airport;
import com.flightmail.backend.domain.FlightRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class AirportJsonMapper {

  private static final Logger log = LoggerFactory.getLogger(AirportJsonMapper.class);

  private enum AirportJsonField {
    CODE("code"),
    NAME("name"),
    CITY("city"),
    TIMEZONE("timezone");

    private final String jsonKey;

    AirportJsonField(String jsonKey) {
      this.jsonKey = jsonKey;
    }

    public String jsonKey() {
      return jsonKey;
    }
  }

  /**
   * Convert one entry of the "airports" array into an Airport, or empty if the entry
   * is incomplete, has a malformed IATA code or an unknown timezone.
   */
  public Optional<Airport> toAirport(JsonNode node) {
    Map<AirportJsonField, String> raw = new EnumMap<>(AirportJsonField.class);
    for (AirportJsonField field : AirportJsonField.values()) {
      raw.put(field, textOrNull(node, field.jsonKey()));
    }

    List<AirportJsonField> missingFields = raw.entrySet().stream()
        .filter(e -> e.getValue() == null || e.getValue().isBlank())
        .map(Map.Entry::getKey)
        .toList();

    if (!missingFields.isEmpty()) {
      log.warn("Skipping airport due to missing fields {}. Raw values: {}", missingFields, raw);
      return Optional.empty();
    }

    String code = raw.get(AirportJsonField.CODE).trim().toUpperCase(Locale.ROOT);
    if (!FlightRecord.IATA_SHAPE.matcher(code).matches()) {
      log.warn("Skipping airport with malformed IATA code '{}'", code);
      return Optional.empty();
    }

    Optional<ZoneId> zoneId = parseZoneId(code, raw.get(AirportJsonField.TIMEZONE));
    if (zoneId.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(new Airport(
        code,
        raw.get(AirportJsonField.NAME),
        raw.get(AirportJsonField.CITY),
        zoneId.get()
    ));
  }

  private Optional<ZoneId> parseZoneId(String code, String timezoneId) {
    try {
      return Optional.of(ZoneId.of(timezoneId));
    } catch (DateTimeException e) {
      log.warn("Skipping airport with invalid timezone. code={}, timezone={}", code, timezoneId);
      return Optional.empty();
    }
  }

  private String textOrNull(JsonNode node, String fieldName) {
    JsonNode value = node.get(fieldName);
    return value != null && !value.isNull() ? value.asText() : null;
  }
}
