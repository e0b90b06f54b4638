package com.flightmail.backend.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Immutable, ordered result of one extraction run: deduplicated flight records
 * sorted by departure, records without a departure last.
 * An empty history is a valid result.
 */
public final class TravelHistory {

  private final List<FlightRecord> records;

  public TravelHistory(List<FlightRecord> records) {
    Objects.requireNonNull(records, "records must not be null");
    this.records = List.copyOf(records);
  }

  public static TravelHistory empty() {
    return new TravelHistory(List.of());
  }

  public List<FlightRecord> getRecords() {
    return records;
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public Stream<FlightRecord> stream() {
    return records.stream();
  }

  /**
   * Keep only records departing inside [from, to] (local departure date, both ends
   * inclusive). A null bound is open. Records without a departure cannot be placed in
   * a range and are dropped as soon as any bound is set.
   */
  public TravelHistory between(LocalDate from, LocalDate to) {
    if (from == null && to == null) {
      return this;
    }
    return new TravelHistory(records.stream()
        .filter(r -> r.getDeparture() != null)
        .filter(r -> from == null || !r.getDeparture().toLocalDate().isBefore(from))
        .filter(r -> to == null || !r.getDeparture().toLocalDate().isAfter(to))
        .toList());
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TravelHistory other && records.equals(other.records));
  }

  @Override
  public int hashCode() {
    return records.hashCode();
  }

  @Override
  public String toString() {
    return "TravelHistory" + records;
  }
}
