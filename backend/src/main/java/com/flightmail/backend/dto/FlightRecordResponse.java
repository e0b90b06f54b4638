package com.flightmail.backend.dto;

import java.util.List;

/**
 * API response model for one flight. Date-times are ISO-8601 with offset, in the local
 * time of the airport they refer to.
 */
public record FlightRecordResponse(
    String flightNumber,
    String origin,
    String destination,
    String departure,
    String arrival,
    String airline,
    Integer durationMinutes,
    String confirmationCode,
    List<String> sourceEmailIds
) {
}
