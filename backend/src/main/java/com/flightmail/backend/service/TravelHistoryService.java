package com.flightmail.backend.service;

import com.flightmail.backend.algorithms.FlightRecordMerger;
import com.flightmail.backend.config.ExtractionSettings;
import com.flightmail.backend.detection.FormatDetector;
import com.flightmail.backend.domain.ExtractionReport;
import com.flightmail.backend.domain.FlightRecord;
import com.flightmail.backend.domain.NormalizationFailure;
import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.domain.RawEmail;
import com.flightmail.backend.domain.RawSegment;
import com.flightmail.backend.domain.TravelHistory;
import com.flightmail.backend.normalization.FlightRecordNormalizer;
import com.flightmail.backend.normalization.NormalizationResult;
import com.flightmail.backend.parsers.ProviderParserRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Application service that runs the extraction pipeline over a batch of emails:
 *  - validates the run settings,
 *  - detects each email's provider and parses it into raw segments,
 *  - normalizes every segment, collecting failures instead of aborting,
 *  - merges the canonical records into one travel history.
 *
 * Per-email work is independent, so it may fan out on a parallel stream; the merge
 * waits for the whole batch. Results are collected in input order either way.
 */
@Service
public class TravelHistoryService {

  private static final Logger log = LoggerFactory.getLogger(TravelHistoryService.class);

  private final FormatDetector formatDetector;
  private final ProviderParserRegistry parserRegistry;
  private final FlightRecordNormalizer normalizer;
  private final FlightRecordMerger merger;
  private final ExtractionSettings defaultSettings;

  public TravelHistoryService(FormatDetector formatDetector,
      ProviderParserRegistry parserRegistry,
      FlightRecordNormalizer normalizer,
      FlightRecordMerger merger,
      ExtractionSettings defaultSettings) {
    this.formatDetector = formatDetector;
    this.parserRegistry = parserRegistry;
    this.normalizer = normalizer;
    this.merger = merger;
    this.defaultSettings = defaultSettings;
  }

  public ExtractionReport buildHistory(List<RawEmail> emails) {
    return buildHistory(emails, defaultSettings);
  }

  /**
   * Run the pipeline with explicit settings.
   *
   * @throws com.flightmail.backend.config.ConfigurationException before any email is
   *     read, when the settings are unusable
   */
  public ExtractionReport buildHistory(List<RawEmail> emails, ExtractionSettings settings) {
    Objects.requireNonNull(settings, "settings must not be null").validate();
    Objects.requireNonNull(emails, "emails must not be null");

    Stream<RawEmail> source = settings.isParallel() ? emails.parallelStream() : emails.stream();
    List<EmailOutcome> outcomes = source
        .map(email -> processEmail(email, settings))
        .toList();

    List<FlightRecord> records = new ArrayList<>();
    List<NormalizationFailure> failures = new ArrayList<>();
    int unrecognized = 0;
    int segments = 0;
    for (EmailOutcome outcome : outcomes) {
      records.addAll(outcome.records());
      failures.addAll(outcome.failures());
      segments += outcome.segmentCount();
      if (outcome.format() == ProviderFormat.UNRECOGNIZED) {
        unrecognized++;
      }
    }

    TravelHistory history = merger.merge(records)
        .between(settings.getFromDate(), settings.getToDate());

    ExtractionReport report = new ExtractionReport(
        history, failures, emails.size(), unrecognized, segments);
    log.info("Extraction finished for target year {}: {}", settings.getTargetYear(), report);
    return report;
  }

  // ---------------------------------------------------------------------------
  // Per-email stage: detect -> parse -> normalize
  // ---------------------------------------------------------------------------

  private EmailOutcome processEmail(RawEmail email, ExtractionSettings settings) {
    ProviderFormat format = formatDetector.detect(email, settings.getKnownProviders());
    List<RawSegment> segments = parserRegistry.parserFor(format).parse(email).toList();

    List<FlightRecord> records = new ArrayList<>();
    List<NormalizationFailure> failures = new ArrayList<>();
    for (RawSegment segment : segments) {
      NormalizationResult result =
          normalizer.normalize(segment, settings.getTargetYear(), settings.getDefaultZone());
      result.getRecord().ifPresent(records::add);
      result.getFailure().ifPresent(failures::add);
    }

    log.debug("Email {} ({}): {} segments, {} records, {} failures",
        email.getId(), format, segments.size(), records.size(), failures.size());
    return new EmailOutcome(format, segments.size(), records, failures);
  }

  private record EmailOutcome(ProviderFormat format,
      int segmentCount,
      List<FlightRecord> records,
      List<NormalizationFailure> failures) {
  }
}
