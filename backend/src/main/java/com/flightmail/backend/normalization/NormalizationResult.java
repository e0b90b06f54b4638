package com.flightmail.backend.normalization;

import com.flightmail.backend.domain.FlightRecord;
import com.flightmail.backend.domain.NormalizationFailure;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of normalizing one raw segment: exactly one of record or failure is present.
 */
public final class NormalizationResult {

  private final FlightRecord record;
  private final NormalizationFailure failure;

  private NormalizationResult(FlightRecord record, NormalizationFailure failure) {
    this.record = record;
    this.failure = failure;
  }

  public static NormalizationResult success(FlightRecord record) {
    return new NormalizationResult(Objects.requireNonNull(record, "record must not be null"), null);
  }

  public static NormalizationResult failure(NormalizationFailure failure) {
    return new NormalizationResult(null, Objects.requireNonNull(failure, "failure must not be null"));
  }

  public boolean isSuccess() {
    return record != null;
  }

  public Optional<FlightRecord> getRecord() {
    return Optional.ofNullable(record);
  }

  public Optional<NormalizationFailure> getFailure() {
    return Optional.ofNullable(failure);
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success[" + record + "]" : "Failure[" + failure + "]";
  }
}
