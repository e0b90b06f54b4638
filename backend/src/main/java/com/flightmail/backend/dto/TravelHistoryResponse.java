package com.flightmail.backend.dto;

import java.util.List;

/**
 * API response model for a run: the flights in departure order plus the segments that
 * could not be turned into flights.
 */
public record TravelHistoryResponse(
    List<FlightRecordResponse> flights,
    List<NormalizationFailureResponse> failures,
    int emailsProcessed,
    int unrecognizedEmails,
    int segmentsExtracted
) {
}
