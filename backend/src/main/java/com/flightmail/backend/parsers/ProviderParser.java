package com.flightmail.backend.parsers;

import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.domain.RawEmail;
import com.flightmail.backend.domain.RawSegment;

import java.util.stream.Stream;

/**
 * Turns an email of one known layout into raw flight legs.
 *
 * Implementations never throw on malformed content: fields that cannot be found are
 * left absent, and an email without usable legs yields an empty stream. The stream
 * is produced leg by leg and can be consumed once.
 */
public interface ProviderParser {

  ProviderFormat format();

  Stream<RawSegment> parse(RawEmail email);
}
