package com.flightmail.backend.algorithms;

import com.flightmail.backend.domain.FlightRecord;
import com.flightmail.backend.domain.TravelHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Function;

/**
 * Collapses flight records that describe the same physical flight and orders the
 * survivors into a {@link TravelHistory}.
 *
 * Two records are the same flight when flight number, origin, destination and the
 * departure instant (to the minute) agree. Within such a group the records are ranked:
 *  - more filled-in facts first,
 *  - then the more recently received source email,
 *  - then the greatest source email id.
 * Each field of the merged record comes from the best-ranked record that has it.
 *
 * Merging is idempotent: feeding the output back in yields the same history.
 */
@Component
public class FlightRecordMerger {

  private static final Logger log = LoggerFactory.getLogger(FlightRecordMerger.class);

  static final Comparator<FlightRecord> RANKING =
      Comparator.comparingInt(FlightRecord::getCompleteness).reversed()
          .thenComparing(FlightRecord::getLatestSourceReceivedAt,
              Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
          .thenComparing(r -> r.getSourceEmailIds().last(), Comparator.<String>reverseOrder());

  static final Comparator<FlightRecord> HISTORY_ORDER =
      Comparator.comparing(FlightRecord::getDepartureInstant, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
          .thenComparing(FlightRecord::getFlightNumber)
          .thenComparing(FlightRecord::getOrigin)
          .thenComparing(FlightRecord::getDestination);

  public TravelHistory merge(List<FlightRecord> records) {
    Objects.requireNonNull(records, "records must not be null");
    if (records.isEmpty()) {
      return TravelHistory.empty();
    }

    Map<DedupKey, List<FlightRecord>> groups = new LinkedHashMap<>();
    for (FlightRecord record : records) {
      groups.computeIfAbsent(DedupKey.of(record), k -> new ArrayList<>()).add(record);
    }

    List<FlightRecord> merged = new ArrayList<>(groups.size());
    for (List<FlightRecord> group : groups.values()) {
      merged.add(group.size() == 1 ? group.get(0) : mergeGroup(group));
    }
    merged.sort(HISTORY_ORDER);

    log.debug("Merged {} flight records into {}", records.size(), merged.size());
    return new TravelHistory(merged);
  }

  // ---------------------------------------------------------------------------
  // Field-by-field merge of one duplicate group
  // ---------------------------------------------------------------------------

  private FlightRecord mergeGroup(List<FlightRecord> group) {
    List<FlightRecord> ranked = new ArrayList<>(group);
    ranked.sort(RANKING);
    FlightRecord best = ranked.get(0);

    OffsetDateTime departure = firstPresent(ranked, FlightRecord::getDeparture);
    OffsetDateTime arrival = ranked.stream()
        .map(FlightRecord::getArrival)
        .filter(Objects::nonNull)
        .filter(a -> departure == null || a.isAfter(departure))
        .findFirst()
        .orElse(null);
    String airline = ranked.stream()
        .filter(FlightRecord::isAirlineKnown)
        .map(FlightRecord::getAirline)
        .findFirst()
        .orElse(FlightRecord.UNKNOWN_AIRLINE);

    Set<String> sourceIds = new TreeSet<>();
    Instant latestReceived = null;
    for (FlightRecord record : ranked) {
      sourceIds.addAll(record.getSourceEmailIds());
      Instant received = record.getLatestSourceReceivedAt();
      if (received != null && (latestReceived == null || received.isAfter(latestReceived))) {
        latestReceived = received;
      }
    }

    log.debug("Merging {} duplicates of {} from emails {}", group.size(), best, sourceIds);
    return new FlightRecord(
        best.getFlightNumber(),
        best.getOrigin(),
        best.getDestination(),
        departure,
        arrival,
        airline,
        firstPresent(ranked, FlightRecord::getDurationMinutes),
        firstPresent(ranked, FlightRecord::getConfirmationCode),
        sourceIds,
        latestReceived
    );
  }

  private static <T> T firstPresent(List<FlightRecord> ranked,
      Function<FlightRecord, T> getter) {
    for (FlightRecord record : ranked) {
      T value = getter.apply(record);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /**
   * Identity of a physical flight. The departure is compared as an instant truncated
   * to the minute so the same flight quoted with different offsets still matches.
   */
  record DedupKey(String flightNumber, String origin, String destination, Instant departureMinute) {

    static DedupKey of(FlightRecord record) {
      Instant departure = record.getDepartureInstant();
      return new DedupKey(
          record.getFlightNumber(),
          record.getOrigin(),
          record.getDestination(),
          departure != null ? departure.truncatedTo(ChronoUnit.MINUTES) : null
      );
    }
  }
}
