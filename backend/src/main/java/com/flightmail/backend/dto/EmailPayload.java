package com.flightmail.backend.dto;

/**
 * API request model for one raw email. {@code receivedAt} is an ISO-8601 instant,
 * e.g. "2024-05-01T10:15:30Z".
 */
public record EmailPayload(
    String id,
    String sender,
    String subject,
    String body,
    String receivedAt
) {
}
