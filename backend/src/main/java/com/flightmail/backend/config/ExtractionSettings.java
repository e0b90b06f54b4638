package com.flightmail.backend.config;

import com.flightmail.backend.domain.ProviderFormat;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Explicit configuration of one extraction run.
 *
 * Instances are immutable; use {@link #toBuilder()} to derive a variant (for example a
 * request that overrides only the target year). Nothing is checked on construction:
 * {@link #validate()} is called by the pipeline before it touches any email, so that a
 * half-configured default can still be created at startup.
 */
public final class ExtractionSettings {

  public static final int MIN_TARGET_YEAR = 1970;
  public static final int MAX_TARGET_YEAR = 2100;

  private final Integer targetYear;
  private final Set<ProviderFormat> knownProviders;
  private final ZoneId defaultZone;
  private final boolean parallel;
  private final LocalDate fromDate;
  private final LocalDate toDate;

  private ExtractionSettings(Builder builder) {
    this.targetYear = builder.targetYear;
    this.knownProviders = builder.knownProviders.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(builder.knownProviders));
    this.defaultZone = builder.defaultZone;
    this.parallel = builder.parallel;
    this.fromDate = builder.fromDate;
    this.toDate = builder.toDate;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .targetYear(targetYear)
        .knownProviders(knownProviders)
        .defaultZone(defaultZone)
        .parallel(parallel)
        .fromDate(fromDate)
        .toDate(toDate);
  }

  /**
   * @throws ConfigurationException when the settings cannot drive a run
   */
  public ExtractionSettings validate() {
    if (targetYear == null) {
      throw new ConfigurationException("targetYear is required to resolve year-less dates");
    }
    if (targetYear < MIN_TARGET_YEAR || targetYear > MAX_TARGET_YEAR) {
      throw new ConfigurationException("targetYear must be between " + MIN_TARGET_YEAR
          + " and " + MAX_TARGET_YEAR + ": " + targetYear);
    }
    if (knownProviders.isEmpty()) {
      throw new ConfigurationException("At least one known provider is required");
    }
    if (knownProviders.contains(ProviderFormat.UNRECOGNIZED)) {
      throw new ConfigurationException("UNRECOGNIZED is not a provider that can be enabled");
    }
    if (defaultZone == null) {
      throw new ConfigurationException("defaultZone must not be null");
    }
    if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
      throw new ConfigurationException("fromDate " + fromDate + " is after toDate " + toDate);
    }
    return this;
  }

  /**
   * Parses a comma separated provider list such as {@code "VIETJET_AIR, trip_com"}.
   * Blank entries are ignored.
   */
  public static Set<ProviderFormat> parseProviders(String csv) {
    EnumSet<ProviderFormat> result = EnumSet.noneOf(ProviderFormat.class);
    if (csv == null || csv.isBlank()) {
      return result;
    }
    for (String token : csv.split(",")) {
      String name = token.trim();
      if (name.isEmpty()) {
        continue;
      }
      try {
        result.add(ProviderFormat.valueOf(name.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException ex) {
        throw new ConfigurationException("Unknown provider '" + name + "', expected one of "
            + Arrays.toString(ProviderFormat.values()), ex);
      }
    }
    return result;
  }

  public static ZoneId parseZone(String zoneId) {
    if (zoneId == null || zoneId.isBlank()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(zoneId.trim());
    } catch (DateTimeException ex) {
      throw new ConfigurationException("Invalid default zone: " + zoneId, ex);
    }
  }

  public Integer getTargetYear() {
    return targetYear;
  }

  public Set<ProviderFormat> getKnownProviders() {
    return knownProviders;
  }

  public ZoneId getDefaultZone() {
    return defaultZone;
  }

  public boolean isParallel() {
    return parallel;
  }

  public LocalDate getFromDate() {
    return fromDate;
  }

  public LocalDate getToDate() {
    return toDate;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ExtractionSettings other)) {
      return false;
    }
    return parallel == other.parallel
        && Objects.equals(targetYear, other.targetYear)
        && knownProviders.equals(other.knownProviders)
        && Objects.equals(defaultZone, other.defaultZone)
        && Objects.equals(fromDate, other.fromDate)
        && Objects.equals(toDate, other.toDate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(targetYear, knownProviders, defaultZone, parallel, fromDate, toDate);
  }

  @Override
  public String toString() {
    return "ExtractionSettings{targetYear=" + targetYear
        + ", knownProviders=" + knownProviders
        + ", defaultZone=" + defaultZone
        + ", parallel=" + parallel
        + ", fromDate=" + fromDate
        + ", toDate=" + toDate + "}";
  }

  public static final class Builder {

    private Integer targetYear;
    private Set<ProviderFormat> knownProviders = EnumSet.of(
        ProviderFormat.VIETJET_AIR, ProviderFormat.TRIP_COM, ProviderFormat.BOOKING_COM);
    private ZoneId defaultZone = ZoneOffset.UTC;
    private boolean parallel;
    private LocalDate fromDate;
    private LocalDate toDate;

    private Builder() {
    }

    public Builder targetYear(Integer targetYear) {
      this.targetYear = targetYear;
      return this;
    }

    public Builder knownProviders(Set<ProviderFormat> knownProviders) {
      this.knownProviders = knownProviders == null ? Set.of() : Set.copyOf(knownProviders);
      return this;
    }

    public Builder defaultZone(ZoneId defaultZone) {
      this.defaultZone = defaultZone;
      return this;
    }

    public Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    public Builder fromDate(LocalDate fromDate) {
      this.fromDate = fromDate;
      return this;
    }

    public Builder toDate(LocalDate toDate) {
      this.toDate = toDate;
      return this;
    }

    public ExtractionSettings build() {
      return new ExtractionSettings(this);
    }
  }
}
