package com.flightmail.backend.normalization;

import java.time.LocalDateTime;

/**
 * Wall-clock time read from an email, and whether the email stated the year or the
 * run's target year was filled in.
 */
public record ParsedDateTime(LocalDateTime value, boolean yearExplicit) {
}
