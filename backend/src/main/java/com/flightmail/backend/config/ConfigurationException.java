package com.flightmail.backend.config;

/**
 * Raised when a run is configured in a way the pipeline cannot work with
 * (no target year, no usable provider, bad zone id). Always thrown before any email
 * is processed.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
