package com.flightmail.backend.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Un-interpreted substrings extracted for one flight leg of one email.
 * Any field may be absent: a missing value is a gap in the email, not an error.
 */
public final class RawSegment {

  private final Map<SegmentField, String> values;
  private final String sourceEmailId;
  private final Instant sourceReceivedAt;
  private final ProviderFormat sourceFormat;

  private RawSegment(Builder builder) {
    this.values = Collections.unmodifiableMap(new EnumMap<>(builder.values));
    this.sourceEmailId = builder.sourceEmailId;
    this.sourceReceivedAt = builder.sourceReceivedAt;
    this.sourceFormat = builder.sourceFormat;
  }

  public static Builder builder(RawEmail source, ProviderFormat format) {
    Objects.requireNonNull(source, "source must not be null");
    return new Builder(source.getId(), source.getReceivedAt(), format);
  }

  public Optional<String> get(SegmentField field) {
    return Optional.ofNullable(values.get(field));
  }

  public Optional<String> getFlightNumber() {
    return get(SegmentField.FLIGHT_NUMBER);
  }

  public Optional<String> getOrigin() {
    return get(SegmentField.ORIGIN);
  }

  public Optional<String> getDestination() {
    return get(SegmentField.DESTINATION);
  }

  public Optional<String> getDepartureRaw() {
    return get(SegmentField.DEPARTURE);
  }

  public Optional<String> getArrivalRaw() {
    return get(SegmentField.ARRIVAL);
  }

  public Optional<String> getAirlineRaw() {
    return get(SegmentField.AIRLINE);
  }

  public Optional<String> getDurationRaw() {
    return get(SegmentField.DURATION);
  }

  public Optional<String> getConfirmationCode() {
    return get(SegmentField.CONFIRMATION_CODE);
  }

  /**
   * Read-only view of every extracted field.
   */
  public Map<SegmentField, String> asMap() {
    return values;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public String getSourceEmailId() {
    return sourceEmailId;
  }

  public Instant getSourceReceivedAt() {
    return sourceReceivedAt;
  }

  public ProviderFormat getSourceFormat() {
    return sourceFormat;
  }

  @Override
  public String toString() {
    return "RawSegment[" + sourceEmailId + " " + values + "]";
  }

  public static final class Builder {

    private final Map<SegmentField, String> values = new EnumMap<>(SegmentField.class);
    private final String sourceEmailId;
    private final Instant sourceReceivedAt;
    private final ProviderFormat sourceFormat;

    private Builder(String sourceEmailId, Instant sourceReceivedAt, ProviderFormat sourceFormat) {
      this.sourceEmailId = sourceEmailId;
      this.sourceReceivedAt = sourceReceivedAt;
      this.sourceFormat = Objects.requireNonNull(sourceFormat, "sourceFormat must not be null");
    }

    /**
     * Set a field. Blank values are ignored so that callers can pass extractor
     * output through without checking it first.
     */
    public Builder set(SegmentField field, String value) {
      Objects.requireNonNull(field, "field must not be null");
      if (value != null && !value.isBlank()) {
        values.put(field, value.trim());
      }
      return this;
    }

    public Builder setAll(Map<SegmentField, String> fields) {
      fields.forEach(this::set);
      return this;
    }

    public RawSegment build() {
      return new RawSegment(this);
    }
  }
}
