package com.flightmail.backend.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one extraction run: the merged history plus what could not be used.
 */
public final class ExtractionReport {

  private final TravelHistory history;
  private final List<NormalizationFailure> failures;
  private final int emailsProcessed;
  private final int unrecognizedEmails;
  private final int segmentsExtracted;

  public ExtractionReport(TravelHistory history,
      List<NormalizationFailure> failures,
      int emailsProcessed,
      int unrecognizedEmails,
      int segmentsExtracted) {
    this.history = Objects.requireNonNull(history, "history must not be null");
    this.failures = List.copyOf(Objects.requireNonNull(failures, "failures must not be null"));
    this.emailsProcessed = emailsProcessed;
    this.unrecognizedEmails = unrecognizedEmails;
    this.segmentsExtracted = segmentsExtracted;
  }

  public TravelHistory getHistory() {
    return history;
  }

  public List<NormalizationFailure> getFailures() {
    return failures;
  }

  public int getEmailsProcessed() {
    return emailsProcessed;
  }

  public int getUnrecognizedEmails() {
    return unrecognizedEmails;
  }

  public int getSegmentsExtracted() {
    return segmentsExtracted;
  }

  @Override
  public String toString() {
    return "ExtractionReport{records=" + history.size()
        + ", failures=" + failures.size()
        + ", emails=" + emailsProcessed
        + ", unrecognized=" + unrecognizedEmails
        + ", segments=" + segmentsExtracted + "}";
  }
}
