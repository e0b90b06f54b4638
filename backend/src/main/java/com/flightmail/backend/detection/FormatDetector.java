package com.flightmail.backend.detection;

import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.domain.RawEmail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Classifies an email into exactly one provider format.
 *
 * Evidence is weighed strongest first: every signature is tried on the sender
 * domain, then on the subject, then on the body, and the first hit wins. An agency
 * email that mentions the airline it sold is therefore still classified by who sent it.
 * Within one pass the signature list order breaks ties.
 */
@Component
public class FormatDetector {

  private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);

  static final List<ProviderSignature> DEFAULT_SIGNATURES = List.of(
      new ProviderSignature(
          ProviderFormat.VIETJET_AIR,
          List.of("vietjetair.com"),
          List.of("vietjet"),
          List.of("vietjetair.com")),
      new ProviderSignature(
          ProviderFormat.TRIP_COM,
          List.of("trip.com", "ctrip.com"),
          List.of("trip.com"),
          List.of("trip.com")),
      new ProviderSignature(
          ProviderFormat.BOOKING_COM,
          List.of("booking.com"),
          List.of("booking.com"),
          List.of("booking.com"))
  );

  private static final List<BiPredicate<ProviderSignature, RawEmail>> PASSES = List.of(
      ProviderSignature::matchesSender,
      ProviderSignature::matchesSubject,
      ProviderSignature::matchesBody
  );

  private final List<ProviderSignature> signatures;

  public FormatDetector() {
    this(DEFAULT_SIGNATURES);
  }

  public FormatDetector(List<ProviderSignature> signatures) {
    this.signatures = List.copyOf(Objects.requireNonNull(signatures, "signatures must not be null"));
  }

  public ProviderFormat detect(RawEmail email) {
    return detect(email, EnumSet.allOf(ProviderFormat.class));
  }

  /**
   * Classify against the enabled providers only; a disabled provider's emails come
   * back as {@link ProviderFormat#UNRECOGNIZED}.
   */
  public ProviderFormat detect(RawEmail email, Set<ProviderFormat> enabled) {
    Objects.requireNonNull(email, "email must not be null");

    for (BiPredicate<ProviderSignature, RawEmail> pass : PASSES) {
      for (ProviderSignature signature : signatures) {
        if (enabled.contains(signature.format()) && pass.test(signature, email)) {
          log.debug("Email {} detected as {}", email.getId(), signature.format());
          return signature.format();
        }
      }
    }

    log.debug("Email {} matches no known provider", email.getId());
    return ProviderFormat.UNRECOGNIZED;
  }
}
