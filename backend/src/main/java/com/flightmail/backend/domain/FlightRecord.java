package com.flightmail.backend.domain;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Canonical, fully normalized flight leg.
 *
 * Invariants enforced on construction:
 *  - origin and destination are 3-letter IATA codes and differ,
 *  - flight number has the airline-designator shape or is {@link #UNKNOWN_FLIGHT_NUMBER},
 *  - arrival is after departure when both are known,
 *  - at least one source email id is attached.
 */
public final class FlightRecord {

  public static final String UNKNOWN_FLIGHT_NUMBER = "UNKNOWN";
  public static final String UNKNOWN_AIRLINE = "Unknown Airline";

  public static final Pattern FLIGHT_NUMBER_SHAPE = Pattern.compile("^[A-Z]{1,3}\\d{1,4}[A-Z]?$");
  public static final Pattern IATA_SHAPE = Pattern.compile("^[A-Z]{3}$");

  private final String flightNumber;
  private final String origin;
  private final String destination;
  private final OffsetDateTime departure;
  private final OffsetDateTime arrival;
  private final String airline;
  private final Integer durationMinutes;
  private final String confirmationCode;
  private final SortedSet<String> sourceEmailIds;
  private final Instant latestSourceReceivedAt;

  public FlightRecord(String flightNumber,
      String origin,
      String destination,
      OffsetDateTime departure,
      OffsetDateTime arrival,
      String airline,
      Integer durationMinutes,
      String confirmationCode,
      Set<String> sourceEmailIds,
      Instant latestSourceReceivedAt) {

    this.flightNumber = Objects.requireNonNull(flightNumber, "flightNumber must not be null");
    this.origin = Objects.requireNonNull(origin, "origin must not be null");
    this.destination = Objects.requireNonNull(destination, "destination must not be null");
    this.airline = Objects.requireNonNull(airline, "airline must not be null");
    Objects.requireNonNull(sourceEmailIds, "sourceEmailIds must not be null");

    if (!UNKNOWN_FLIGHT_NUMBER.equals(flightNumber) && !FLIGHT_NUMBER_SHAPE.matcher(flightNumber).matches()) {
      throw new IllegalArgumentException("Invalid flight number: " + flightNumber);
    }
    if (!IATA_SHAPE.matcher(origin).matches() || !IATA_SHAPE.matcher(destination).matches()) {
      throw new IllegalArgumentException("Airport codes must be 3-letter IATA codes: " + origin + "/" + destination);
    }
    if (origin.equals(destination)) {
      throw new IllegalArgumentException("Origin and destination must differ: " + origin);
    }
    if (departure != null && arrival != null && !arrival.isAfter(departure)) {
      throw new IllegalArgumentException(
          "Arrival " + arrival + " must be after departure " + departure + " for " + flightNumber);
    }
    if (durationMinutes != null && durationMinutes <= 0) {
      throw new IllegalArgumentException("Duration must be positive: " + durationMinutes);
    }
    if (sourceEmailIds.isEmpty()) {
      throw new IllegalArgumentException("A flight record needs at least one source email id");
    }

    this.departure = departure;
    this.arrival = arrival;
    this.durationMinutes = durationMinutes;
    this.confirmationCode = confirmationCode;
    this.sourceEmailIds = Collections.unmodifiableSortedSet(new TreeSet<>(sourceEmailIds));
    this.latestSourceReceivedAt = latestSourceReceivedAt;
  }

  public String getFlightNumber() {
    return flightNumber;
  }

  public String getOrigin() {
    return origin;
  }

  public String getDestination() {
    return destination;
  }

  /**
   * Departure in the origin airport's local offset; null when it could not be resolved.
   */
  public OffsetDateTime getDeparture() {
    return departure;
  }

  /**
   * Arrival in the destination airport's local offset; null when unknown.
   */
  public OffsetDateTime getArrival() {
    return arrival;
  }

  public String getAirline() {
    return airline;
  }

  public Integer getDurationMinutes() {
    return durationMinutes;
  }

  public String getConfirmationCode() {
    return confirmationCode;
  }

  public SortedSet<String> getSourceEmailIds() {
    return sourceEmailIds;
  }

  public Instant getLatestSourceReceivedAt() {
    return latestSourceReceivedAt;
  }

  public Instant getDepartureInstant() {
    return departure != null ? departure.toInstant() : null;
  }

  public boolean isFlightNumberKnown() {
    return !UNKNOWN_FLIGHT_NUMBER.equals(flightNumber);
  }

  public boolean isAirlineKnown() {
    return !UNKNOWN_AIRLINE.equals(airline);
  }

  /**
   * Number of optional facts this record carries. Used to decide which of two
   * records describing the same flight is the better source.
   */
  public int getCompleteness() {
    int filled = 0;
    if (isFlightNumberKnown()) {
      filled++;
    }
    if (departure != null) {
      filled++;
    }
    if (arrival != null) {
      filled++;
    }
    if (isAirlineKnown()) {
      filled++;
    }
    if (durationMinutes != null) {
      filled++;
    }
    if (confirmationCode != null) {
      filled++;
    }
    return filled;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlightRecord other)) {
      return false;
    }
    return flightNumber.equals(other.flightNumber)
        && origin.equals(other.origin)
        && destination.equals(other.destination)
        && Objects.equals(departure, other.departure)
        && Objects.equals(arrival, other.arrival)
        && airline.equals(other.airline)
        && Objects.equals(durationMinutes, other.durationMinutes)
        && Objects.equals(confirmationCode, other.confirmationCode)
        && sourceEmailIds.equals(other.sourceEmailIds)
        && Objects.equals(latestSourceReceivedAt, other.latestSourceReceivedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(flightNumber, origin, destination, departure, arrival, airline,
        durationMinutes, confirmationCode, sourceEmailIds, latestSourceReceivedAt);
  }

  @Override
  public String toString() {
    return flightNumber + " " + origin + "->" + destination + " @ " + departure;
  }
}
