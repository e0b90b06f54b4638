package com.flightmail.backend.domain;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Objects;

public class Airport {

  private final String code;
  private final String name;
  private final String city;
  private final ZoneId timezone;

  public Airport(String code, String name, String city, ZoneId timezone) {
    this.code = Objects.requireNonNull(code, "code must not be null");
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.city = Objects.requireNonNull(city, "city must not be null");
    this.timezone = Objects.requireNonNull(timezone, "timezone must not be null");
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public String getCity() {
    return city;
  }

  public ZoneId getTimezone() {
    return timezone;
  }

  /**
   * Attach this airport's UTC offset, valid at that moment, to a wall-clock time
   * read from an email. Gaps and overlaps resolve the way {@link java.time.ZonedDateTime#of} does.
   */
  public OffsetDateTime atLocal(LocalDateTime localDateTime) {
    return localDateTime.atZone(timezone).toOffsetDateTime();
  }
}
