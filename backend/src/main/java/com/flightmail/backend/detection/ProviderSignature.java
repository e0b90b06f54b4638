package com.flightmail.backend.detection;

import com.flightmail.backend.domain.ProviderFormat;
import com.flightmail.backend.domain.RawEmail;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evidence that an email was produced by a given provider. All keywords and markers
 * are compared case-insensitively; sender domains match the exact domain or any of
 * its subdomains ("mail.trip.com" matches "trip.com", "strip.com" does not).
 */
public record ProviderSignature(ProviderFormat format,
                                List<String> senderDomains,
                                List<String> subjectKeywords,
                                List<String> bodyMarkers) {

  private static final Pattern SENDER_DOMAIN = Pattern.compile("@([A-Za-z0-9.-]+)");

  public ProviderSignature {
    Objects.requireNonNull(format, "format must not be null");
    if (!format.isRecognized()) {
      throw new IllegalArgumentException("A signature cannot describe " + format);
    }
    senderDomains = lowerCase(senderDomains);
    subjectKeywords = lowerCase(subjectKeywords);
    bodyMarkers = lowerCase(bodyMarkers);
  }

  public boolean matchesSender(RawEmail email) {
    String domain = senderDomain(email.getSender());
    if (domain.isEmpty()) {
      return false;
    }
    return senderDomains.stream().anyMatch(d -> domain.equals(d) || domain.endsWith("." + d));
  }

  public boolean matchesSubject(RawEmail email) {
    return containsAny(email.getSubject(), subjectKeywords);
  }

  public boolean matchesBody(RawEmail email) {
    return containsAny(email.getBody(), bodyMarkers);
  }

  static String senderDomain(String sender) {
    if (sender == null) {
      return "";
    }
    Matcher matcher = SENDER_DOMAIN.matcher(sender);
    String domain = "";
    while (matcher.find()) {
      domain = matcher.group(1);
    }
    return domain.toLowerCase(Locale.ROOT).replaceAll("\\.+$", "");
  }

  private static boolean containsAny(String text, List<String> needles) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    String haystack = text.toLowerCase(Locale.ROOT);
    return needles.stream().anyMatch(haystack::contains);
  }

  private static List<String> lowerCase(List<String> values) {
    return values == null ? List.of() : values.stream()
        .filter(v -> v != null && !v.isBlank())
        .map(v -> v.trim().toLowerCase(Locale.ROOT))
        .toList();
  }
}
