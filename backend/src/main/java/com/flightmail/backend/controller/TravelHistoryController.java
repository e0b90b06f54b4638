package com.flightmail.backend.controller;

import com.flightmail.backend.config.ConfigurationException;
import com.flightmail.backend.config.ExtractionSettings;
import com.flightmail.backend.domain.ExtractionReport;
import com.flightmail.backend.domain.FlightRecord;
import com.flightmail.backend.domain.NormalizationFailure;
import com.flightmail.backend.domain.RawEmail;
import com.flightmail.backend.dto.EmailPayload;
import com.flightmail.backend.dto.FlightRecordResponse;
import com.flightmail.backend.dto.NormalizationFailureResponse;
import com.flightmail.backend.dto.TravelHistoryRequest;
import com.flightmail.backend.dto.TravelHistoryResponse;
import com.flightmail.backend.service.TravelHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * REST adapter over the extraction pipeline.
 *
 *  - POST /api/travel-history
 *      - targetYear: year substituted into dates that do not state one
 *      - knownProviders: optional subset of VIETJET_AIR, TRIP_COM, BOOKING_COM
 *      - fromDate / toDate: optional inclusive departure date range
 *      - emails: id, sender, subject, body, receivedAt
 *  - Returns the merged flights, the normalization failures and run counters.
 */
@RestController
@RequestMapping("/api")
public class TravelHistoryController {

  private static final Logger log = LoggerFactory.getLogger(TravelHistoryController.class);

  private static final DateTimeFormatter ISO_WITH_OFFSET = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

  private final TravelHistoryService travelHistoryService;
  private final ExtractionSettings defaultSettings;

  public TravelHistoryController(TravelHistoryService travelHistoryService,
      ExtractionSettings defaultSettings) {
    this.travelHistoryService = travelHistoryService;
    this.defaultSettings = defaultSettings;
  }

  @PostMapping("/travel-history")
  public TravelHistoryResponse buildHistory(@RequestBody TravelHistoryRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request body is required");
    }
    ExtractionSettings settings = toSettings(request);
    List<RawEmail> emails = request.emails() == null
        ? List.of()
        : request.emails().stream().map(this::toRawEmail).toList();

    log.info("Travel history request: {} emails, settings={}", emails.size(), settings);

    return toResponse(travelHistoryService.buildHistory(emails, settings));
  }

  // ---------------------------------------------------------------------------
  // Request mapping
  // ---------------------------------------------------------------------------

  private ExtractionSettings toSettings(TravelHistoryRequest request) {
    ExtractionSettings.Builder builder = defaultSettings.toBuilder();
    if (request.targetYear() != null) {
      builder.targetYear(request.targetYear());
    }
    if (request.knownProviders() != null) {
      builder.knownProviders(ExtractionSettings.parseProviders(String.join(",", request.knownProviders())));
    }
    if (request.fromDate() != null) {
      builder.fromDate(LocalDate.parse(request.fromDate()));
    }
    if (request.toDate() != null) {
      builder.toDate(LocalDate.parse(request.toDate()));
    }
    return builder.build();
  }

  private RawEmail toRawEmail(EmailPayload payload) {
    if (payload.id() == null || payload.id().isBlank()) {
      throw new IllegalArgumentException("Every email needs an id");
    }
    if (payload.receivedAt() == null) {
      throw new IllegalArgumentException("Email " + payload.id() + " has no receivedAt");
    }
    return new RawEmail(
        payload.id(),
        payload.sender(),
        payload.subject(),
        payload.body(),
        Instant.parse(payload.receivedAt())
    );
  }

  // ---------------------------------------------------------------------------
  // Mapping from domain ExtractionReport -> API TravelHistoryResponse
  // ---------------------------------------------------------------------------

  private TravelHistoryResponse toResponse(ExtractionReport report) {
    List<FlightRecordResponse> flights = report.getHistory().stream()
        .map(this::toFlightResponse)
        .toList();
    List<NormalizationFailureResponse> failures = report.getFailures().stream()
        .map(this::toFailureResponse)
        .toList();

    return new TravelHistoryResponse(
        flights,
        failures,
        report.getEmailsProcessed(),
        report.getUnrecognizedEmails(),
        report.getSegmentsExtracted()
    );
  }

  private FlightRecordResponse toFlightResponse(FlightRecord record) {
    return new FlightRecordResponse(
        record.getFlightNumber(),
        record.getOrigin(),
        record.getDestination(),
        format(record.getDeparture()),
        format(record.getArrival()),
        record.getAirline(),
        record.getDurationMinutes(),
        record.getConfirmationCode(),
        List.copyOf(record.getSourceEmailIds())
    );
  }

  private NormalizationFailureResponse toFailureResponse(NormalizationFailure failure) {
    return new NormalizationFailureResponse(
        failure.getReason().name(),
        failure.getField().name(),
        failure.getRawValue(),
        failure.getSourceEmailId()
    );
  }

  private static String format(OffsetDateTime dateTime) {
    return dateTime != null ? dateTime.format(ISO_WITH_OFFSET) : null;
  }

  // ---------------------------------------------------------------------------
  // Error handling for bad requests (missing target year, malformed dates, etc.)
  // ---------------------------------------------------------------------------

  @ExceptionHandler({
      ConfigurationException.class,
      IllegalArgumentException.class,
      DateTimeParseException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
    log.warn("Bad request: {}", ex.getMessage());
    return ResponseEntity
        .status(HttpStatus.BAD_REQUEST)
        .body(new ErrorResponse(ex.getMessage()));
  }

  /**
   * Minimal error response body.
   */
  record ErrorResponse(String message) {
  }
}
