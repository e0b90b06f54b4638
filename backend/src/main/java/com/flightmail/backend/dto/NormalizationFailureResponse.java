package com.flightmail.backend.dto;

public record NormalizationFailureResponse(
    String reason,
    String field,
    String rawValue,
    String sourceEmailId
) {
}
