package com.flightmail.backend.domain;

import java.util.Objects;

/**
 * Airline keyed by its 2-character IATA designator (e.g. "VJ", "AA", "G3").
 */
public class Airline {

  private final String code;
  private final String name;

  public Airline(String code, String name) {
    this.code = Objects.requireNonNull(code, "code must not be null");
    this.name = Objects.requireNonNull(name, "name must not be null");
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return code + " " + name;
  }
}
