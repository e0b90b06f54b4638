package com.flightmail.backend.extraction;

/**
 * A substring isolated by an extractor, with its [start, end) position in the text
 * that was searched.
 */
public record TextMatch(String value, int start, int end) {
}
