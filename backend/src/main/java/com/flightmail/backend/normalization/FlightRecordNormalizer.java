package com.flightmail.backend.normalization;

import com.flightmail.backend.domain.Airline;
import com.flightmail.backend.domain.FlightRecord;
import com.flightmail.backend.domain.NormalizationFailure;
import com.flightmail.backend.domain.RawSegment;
import com.flightmail.backend.domain.SegmentField;
import com.flightmail.backend.infrastructure.dataset.AirlineRepositoryInMemory;
import com.flightmail.backend.infrastructure.dataset.AirportRepositoryInMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts raw extracted strings into a canonical {@link FlightRecord}.
 *
 * Mandatory fields are flight number, origin, destination and departure; a missing one
 * or a code with the wrong shape yields a {@link NormalizationFailure} instead of a
 * record. Arrival, duration, airline and booking reference are optional: when they
 * cannot be read they are logged and left out.
 *
 * Local times are given the UTC offset of the airport they refer to (origin for the
 * departure, destination for the arrival); airports missing from the reference data
 * fall back to the caller's default zone.
 */
@Component
public class FlightRecordNormalizer {

  private static final Logger log = LoggerFactory.getLogger(FlightRecordNormalizer.class);

  private static final List<SegmentField> MANDATORY_FIELDS = List.of(
      SegmentField.FLIGHT_NUMBER,
      SegmentField.ORIGIN,
      SegmentField.DESTINATION,
      SegmentField.DEPARTURE
  );

  private static final Pattern INNER_WHITESPACE = Pattern.compile("\\s+");

  private final AirportRepositoryInMemory airportRepository;
  private final AirlineRepositoryInMemory airlineRepository;

  public FlightRecordNormalizer(AirportRepositoryInMemory airportRepository,
      AirlineRepositoryInMemory airlineRepository) {
    this.airportRepository = airportRepository;
    this.airlineRepository = airlineRepository;
  }

  public NormalizationResult normalize(RawSegment segment, int hintYear) {
    return normalize(segment, hintYear, ZoneOffset.UTC);
  }

  public NormalizationResult normalize(RawSegment segment, int hintYear, ZoneId defaultZone) {
    Objects.requireNonNull(segment, "segment must not be null");
    Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    String emailId = segment.getSourceEmailId();

    // 1. Mandatory presence
    List<SegmentField> missingFields = MANDATORY_FIELDS.stream()
        .filter(field -> segment.get(field).isEmpty())
        .toList();
    if (!missingFields.isEmpty()) {
      return fail(NormalizationFailure.missingField(missingFields.get(0), emailId),
          "missing fields " + missingFields);
    }

    // 2. Codes
    String flightNumberRaw = segment.getFlightNumber().orElseThrow();
    String flightNumber = compact(flightNumberRaw);
    if (!FlightRecord.FLIGHT_NUMBER_SHAPE.matcher(flightNumber).matches()) {
      return fail(NormalizationFailure.invalidFormat(SegmentField.FLIGHT_NUMBER, flightNumberRaw, emailId),
          "malformed flight number");
    }

    String originRaw = segment.getOrigin().orElseThrow();
    String origin = compact(originRaw);
    if (!FlightRecord.IATA_SHAPE.matcher(origin).matches()) {
      return fail(NormalizationFailure.invalidFormat(SegmentField.ORIGIN, originRaw, emailId),
          "malformed origin airport code");
    }

    String destinationRaw = segment.getDestination().orElseThrow();
    String destination = compact(destinationRaw);
    if (!FlightRecord.IATA_SHAPE.matcher(destination).matches()) {
      return fail(NormalizationFailure.invalidFormat(SegmentField.DESTINATION, destinationRaw, emailId),
          "malformed destination airport code");
    }
    if (origin.equals(destination)) {
      return fail(NormalizationFailure.invalidFormat(SegmentField.DESTINATION, destinationRaw, emailId),
          "destination equals origin");
    }

    // 3. Times
    String departureRaw = segment.getDepartureRaw().orElseThrow();
    Optional<ParsedDateTime> departureLocal =
        DateTimeCandidates.parse(departureRaw, segment.getSourceFormat(), hintYear);
    if (departureLocal.isEmpty()) {
      return fail(NormalizationFailure.invalidFormat(SegmentField.DEPARTURE, departureRaw, emailId),
          "unparseable departure");
    }
    OffsetDateTime departure = atAirport(origin, departureLocal.get().value(), defaultZone);

    OffsetDateTime arrival = null;
    Optional<String> arrivalRaw = segment.getArrivalRaw();
    if (arrivalRaw.isPresent()) {
      Optional<ParsedDateTime> arrivalLocal =
          DateTimeCandidates.parse(arrivalRaw.get(), segment.getSourceFormat(), hintYear);
      if (arrivalLocal.isEmpty()) {
        log.warn("Ignoring unparseable arrival '{}' for {} in email {}", arrivalRaw.get(), flightNumber, emailId);
      } else {
        arrival = resolveArrival(destination, arrivalLocal.get(), departure, defaultZone);
        if (!arrival.isAfter(departure)) {
          return fail(NormalizationFailure.invalidFormat(SegmentField.ARRIVAL, arrivalRaw.get(), emailId),
              "arrival is not after departure " + departure);
        }
      }
    }

    // 4. Optional details
    Integer durationMinutes = segment.getDurationRaw()
        .map(raw -> DurationParser.parseMinutes(raw).orElseGet(() -> {
          log.warn("Ignoring unparseable duration '{}' for {} in email {}", raw, flightNumber, emailId);
          return null;
        }))
        .orElse(null);

    String airline = resolveAirline(segment, flightNumber);
    String confirmationCode = segment.getConfirmationCode()
        .map(code -> code.toUpperCase(Locale.ROOT))
        .orElse(null);

    FlightRecord record = new FlightRecord(
        flightNumber,
        origin,
        destination,
        departure,
        arrival,
        airline,
        durationMinutes,
        confirmationCode,
        Set.of(emailId),
        segment.getSourceReceivedAt()
    );
    log.debug("Normalized {} from email {}", record, emailId);
    return NormalizationResult.success(record);
  }

  /**
   * A year-less arrival that lands before the departure belongs to the next year
   * (a 31 Dec evening departure arriving on 1 Jan).
   */
  private OffsetDateTime resolveArrival(String destination,
      ParsedDateTime arrivalLocal,
      OffsetDateTime departure,
      ZoneId defaultZone) {
    OffsetDateTime arrival = atAirport(destination, arrivalLocal.value(), defaultZone);
    if (!arrivalLocal.yearExplicit() && !arrival.isAfter(departure)) {
      OffsetDateTime nextYear = atAirport(destination, arrivalLocal.value().plusYears(1), defaultZone);
      if (nextYear.isAfter(departure) && nextYear.minusDays(2).isBefore(departure)) {
        return nextYear;
      }
    }
    return arrival;
  }

  private String resolveAirline(RawSegment segment, String flightNumber) {
    Optional<String> extracted = segment.getAirlineRaw();
    if (extracted.isPresent()) {
      return extracted.get();
    }
    return airlineRepository.findByFlightNumber(flightNumber)
        .map(Airline::getName)
        .or(() -> segment.getSourceFormat().getDefaultAirline())
        .orElse(FlightRecord.UNKNOWN_AIRLINE);
  }

  private OffsetDateTime atAirport(String code, LocalDateTime local, ZoneId defaultZone) {
    return airportRepository.findByCode(code)
        .map(airport -> airport.atLocal(local))
        .orElseGet(() -> {
          log.debug("Airport {} not in reference data, using zone {}", code, defaultZone);
          return local.atZone(defaultZone).toOffsetDateTime();
        });
  }

  private NormalizationResult fail(NormalizationFailure failure, String detail) {
    log.warn("Dropping segment from email {}: {} ({})", failure.getSourceEmailId(), failure, detail);
    return NormalizationResult.failure(failure);
  }

  private static String compact(String raw) {
    return INNER_WHITESPACE.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
  }
}
