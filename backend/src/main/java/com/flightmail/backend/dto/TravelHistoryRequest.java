package com.flightmail.backend.dto;

import java.util.List;

/**
 * API request model for a travel history run. Absent settings fall back to the
 * application defaults; {@code fromDate}/{@code toDate} are ISO dates (YYYY-MM-DD).
 */
public record TravelHistoryRequest(
    Integer targetYear,
    List<String> knownProviders,
    String fromDate,
    String toDate,
    List<EmailPayload> emails
) {
}
