package com.flightmail.backend.domain;

import java.util.Optional;

/**
 * Closed set of email layouts the extraction engine knows how to read.
 * Every email is classified into exactly one of these.
 */
public enum ProviderFormat {

  VIETJET_AIR("VietJet Air", "VietJet Air"),
  TRIP_COM("Trip.com", null),
  BOOKING_COM("Booking.com", null),
  UNRECOGNIZED("Unrecognized", null);

  private final String displayName;
  private final String defaultAirline;

  ProviderFormat(String displayName, String defaultAirline) {
    this.displayName = displayName;
    this.defaultAirline = defaultAirline;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * Airline operating every flight of this provider, when the provider is an airline
   * rather than an agency.
   */
  public Optional<String> getDefaultAirline() {
    return Optional.ofNullable(defaultAirline);
  }

  public boolean isRecognized() {
    return this != UNRECOGNIZED;
  }
}
