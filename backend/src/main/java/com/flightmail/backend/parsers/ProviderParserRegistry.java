package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.ProviderFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatch table from {@link ProviderFormat} to its parser. Built once from the
 * parser beans and checked to be exhaustive: every format, including
 * {@link ProviderFormat#UNRECOGNIZED}, has exactly one parser.
 */
@Component
public class ProviderParserRegistry {

  private static final Logger log = LoggerFactory.getLogger(ProviderParserRegistry.class);

  private final Map<ProviderFormat, ProviderParser> parsersByFormat;

  public ProviderParserRegistry(List<ProviderParser> parsers) {
    Objects.requireNonNull(parsers, "parsers must not be null");

    Map<ProviderFormat, ProviderParser> byFormat = new EnumMap<>(ProviderFormat.class);
    for (ProviderParser parser : parsers) {
      ProviderParser previous = byFormat.put(parser.format(), parser);
      if (previous != null) {
        throw new IllegalStateException("Two parsers registered for " + parser.format() + ": "
            + previous.getClass().getSimpleName() + " and " + parser.getClass().getSimpleName());
      }
    }

    List<ProviderFormat> missing = Arrays.stream(ProviderFormat.values())
        .filter(format -> !byFormat.containsKey(format))
        .toList();
    if (!missing.isEmpty()) {
      throw new IllegalStateException("No parser registered for " + missing);
    }

    this.parsersByFormat = Collections.unmodifiableMap(byFormat);
    log.info("Registered parsers for {}", parsersByFormat.keySet());
  }

  public ProviderParser parserFor(ProviderFormat format) {
    return parsersByFormat.get(Objects.requireNonNull(format, "format must not be null"));
  }
}
