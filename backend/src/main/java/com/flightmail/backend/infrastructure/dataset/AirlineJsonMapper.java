package com.flightmail.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.flightmail.backend.domain.Airline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
public class AirlineJsonMapper {

  private static final Logger log = LoggerFactory.getLogger(AirlineJsonMapper.class);

  // IATA designators are two characters, one of which may be a digit (G3, 5J)
  private static final Pattern DESIGNATOR = Pattern.compile("^[A-Z0-9]{2}$");

  public Optional<Airline> toAirline(JsonNode node) {
    String code = textOrNull(node, "code");
    String name = textOrNull(node, "name");

    if (code == null || code.isBlank() || name == null || name.isBlank()) {
      log.warn("Skipping airline due to missing code or name. code={}, name={}", code, name);
      return Optional.empty();
    }

    String designator = code.trim().toUpperCase(Locale.ROOT);
    if (!DESIGNATOR.matcher(designator).matches()) {
      log.warn("Skipping airline {} with malformed designator '{}'", name, code);
      return Optional.empty();
    }

    return Optional.of(new Airline(designator, name.trim()));
  }

  private String textOrNull(JsonNode node, String fieldName) {
    JsonNode value = node.get(fieldName);
    return value != null && !value.isNull() ? value.asText() : null;
  }
}
