package com.flightmail.backend.domain;

import java.util.Objects;

/**
 * Explains why one raw segment could not become a {@link FlightRecord}.
 * Failures are collected next to the travel history; they never abort a run.
 */
public final class NormalizationFailure {

  private final FailureReason reason;
  private final SegmentField field;
  private final String rawValue;
  private final String sourceEmailId;

  public NormalizationFailure(FailureReason reason, SegmentField field, String rawValue, String sourceEmailId) {
    this.reason = Objects.requireNonNull(reason, "reason must not be null");
    this.field = Objects.requireNonNull(field, "field must not be null");
    this.rawValue = rawValue;
    this.sourceEmailId = Objects.requireNonNull(sourceEmailId, "sourceEmailId must not be null");
  }

  public static NormalizationFailure missingField(SegmentField field, String sourceEmailId) {
    return new NormalizationFailure(FailureReason.MISSING_FIELD, field, null, sourceEmailId);
  }

  public static NormalizationFailure invalidFormat(SegmentField field, String rawValue, String sourceEmailId) {
    return new NormalizationFailure(FailureReason.INVALID_FORMAT, field, rawValue, sourceEmailId);
  }

  public FailureReason getReason() {
    return reason;
  }

  public SegmentField getField() {
    return field;
  }

  /**
   * Offending raw value; null for {@link FailureReason#MISSING_FIELD}.
   */
  public String getRawValue() {
    return rawValue;
  }

  public String getSourceEmailId() {
    return sourceEmailId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NormalizationFailure other)) {
      return false;
    }
    return reason == other.reason
        && field == other.field
        && Objects.equals(rawValue, other.rawValue)
        && sourceEmailId.equals(other.sourceEmailId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reason, field, rawValue, sourceEmailId);
  }

  @Override
  public String toString() {
    return reason + "(" + field + (rawValue != null ? "='" + rawValue + "'" : "") + ") in " + sourceEmailId;
  }
}
