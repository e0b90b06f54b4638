package com.flightmail.backend.domain;

public enum FailureReason {
  /** A mandatory field was not found in the email. */
  MISSING_FIELD,
  /** A field was found but does not have the expected shape. */
  INVALID_FORMAT
}
