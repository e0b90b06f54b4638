package com.flightmail.backend.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One fetched email as handed over by the mail retrieval side.
 * Read-only for the extraction engine.
 */
public final class RawEmail {

  private final String id;
  private final String sender;
  private final String subject;
  private final String body;
  private final Instant receivedAt;

  public RawEmail(String id, String sender, String subject, String body, Instant receivedAt) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.sender = sender != null ? sender : "";
    this.subject = subject != null ? subject : "";
    this.body = body != null ? body : "";
    this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt must not be null");
  }

  public String getId() {
    return id;
  }

  public String getSender() {
    return sender;
  }

  public String getSubject() {
    return subject;
  }

  public String getBody() {
    return body;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }

  @Override
  public String toString() {
    return "RawEmail[" + id + ", from=" + sender + ", subject=" + subject + "]";
  }
}
