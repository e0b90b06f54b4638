package com.flightmail.backend.domain;

/**
 * Fields a provider parser can pull out of one flight leg.
 */
public enum SegmentField {
  FLIGHT_NUMBER,
  ORIGIN,
  DESTINATION,
  DEPARTURE,
  ARRIVAL,
  AIRLINE,
  DURATION,
  CONFIRMATION_CODE
}
