package com.flightmail.backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the default {@link ExtractionSettings} from application.properties.
 *
 * The target year deliberately has no default; callers must supply it per run unless it
 * is set in the properties.
 */
@Configuration
public class ExtractionConfig {

  private static final Logger log = LoggerFactory.getLogger(ExtractionConfig.class);

  @Bean
  public ExtractionSettings defaultExtractionSettings(
      @Value("${flightmail.extraction.target-year:}") String targetYear,
      @Value("${flightmail.extraction.known-providers:VIETJET_AIR,TRIP_COM,BOOKING_COM}") String knownProviders,
      @Value("${flightmail.extraction.default-zone:UTC}") String defaultZone,
      @Value("${flightmail.extraction.parallel:false}") boolean parallel
  ) {
    ExtractionSettings settings = ExtractionSettings.builder()
        .targetYear(parseYear(targetYear))
        .knownProviders(ExtractionSettings.parseProviders(knownProviders))
        .defaultZone(ExtractionSettings.parseZone(defaultZone))
        .parallel(parallel)
        .build();
    log.info("Default extraction settings: {}", settings);
    return settings;
  }

  static Integer parseYear(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException ex) {
      throw new ConfigurationException("flightmail.extraction.target-year is not a year: " + value, ex);
    }
  }
}
