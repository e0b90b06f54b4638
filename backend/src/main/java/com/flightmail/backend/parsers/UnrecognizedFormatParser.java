package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.domain.RawEmail;
import com.flightmail.backend.domain.RawSegment;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Target for emails no signature matched. Yields nothing; this is not an error.
 */
@Component
public class UnrecognizedFormatParser implements ProviderParser {

  @Override
  public ProviderFormat format() {
    return ProviderFormat.UNRECOGNIZED;
  }

  @Override
  public Stream<RawSegment> parse(RawEmail email) {
    return Stream.empty();
  }
}
