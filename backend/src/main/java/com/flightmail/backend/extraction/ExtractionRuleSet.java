package com.flightmail.backend.extraction;

import com.flightmail.backend.domain.SegmentField;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Declarative extraction table for one provider layout.
 *
 * Leg rules run against each segment window. Email rules run once per email, first
 * against the whole body and then against the subject, and describe facts shared by
 * every leg (booking reference). For each field the rules are tried in declaration
 * order and the first match wins.
 *
 * Patterns are compiled with {@link Pattern#MULTILINE} only; rules that need
 * case-insensitive labels scope it inline, e.g. {@code (?i:from)}, so that code
 * tokens such as {@code [A-Z]{3}} stay case-sensitive.
 */
public final class ExtractionRuleSet {

  private final List<ExtractionRule> legRules;
  private final List<ExtractionRule> emailRules;

  private ExtractionRuleSet(List<ExtractionRule> legRules, List<ExtractionRule> emailRules) {
    this.legRules = List.copyOf(legRules);
    this.emailRules = List.copyOf(emailRules);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<SegmentField, TextMatch> extractLeg(SegmentWindow window) {
    return apply(legRules, window);
  }

  public Map<SegmentField, TextMatch> extractEmail(String body, String subject) {
    Map<SegmentField, TextMatch> fromBody = apply(emailRules, SegmentWindow.of(body));
    Map<SegmentField, TextMatch> fromSubject = apply(emailRules, SegmentWindow.of(subject));
    fromSubject.forEach(fromBody::putIfAbsent);
    return fromBody;
  }

  private static Map<SegmentField, TextMatch> apply(List<ExtractionRule> rules, SegmentWindow window) {
    Map<SegmentField, TextMatch> result = new EnumMap<>(SegmentField.class);
    for (ExtractionRule rule : rules) {
      if (result.containsKey(rule.field())) {
        continue;
      }
      Optional<TextMatch> match = FieldExtractor.findFirst(window, rule.pattern(), rule.group());
      match.ifPresent(m -> result.put(rule.field(), m));
    }
    return result;
  }

  public static final class Builder {

    private final List<ExtractionRule> legRules = new ArrayList<>();
    private final List<ExtractionRule> emailRules = new ArrayList<>();

    private Builder() {
    }

    public Builder leg(SegmentField field, String regex) {
      legRules.add(new ExtractionRule(field, compile(regex), 1));
      return this;
    }

    /**
     * One anchor that captures two fields at once, e.g. an "SFO - JFK" route line.
     * Both fields get a rule on the same pattern so they always come from the same match.
     */
    public Builder leg(SegmentField first, SegmentField second, String regex) {
      Pattern pattern = compile(regex);
      legRules.add(new ExtractionRule(first, pattern, 1));
      legRules.add(new ExtractionRule(second, pattern, 2));
      return this;
    }

    public Builder email(SegmentField field, String regex) {
      emailRules.add(new ExtractionRule(field, compile(regex), 1));
      return this;
    }

    public ExtractionRuleSet build() {
      return new ExtractionRuleSet(legRules, emailRules);
    }

    private static Pattern compile(String regex) {
      return Pattern.compile(regex, Pattern.MULTILINE);
    }
  }
}
