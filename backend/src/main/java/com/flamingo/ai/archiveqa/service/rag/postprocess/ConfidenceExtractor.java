package com.flamingo.ai.archiveqa.service.rag.postprocess;

import com.flamingo.ai.archiveqa.service.rag.model.ConfidenceAssessment;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Reads the model's self-reported confidence line, or estimates confidence from the answer's
 * wording when the line is missing.
 */
@Component
public class ConfidenceExtractor {

  /** Tolerates a leading emoji code and bold markers around the label. */
  static final Pattern CONFIDENCE_LINE =
      Pattern.compile(
          ":?\\w*:?\\s*\\*?\\*?Confidence:\\s*(\\d+)%\\s*\\*?\\*?\\s*[-–]\\s*(.+?)(?:\\n|$)",
          Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

  static final Pattern EMOJI_CODE = Pattern.compile(":[\\w_]+:");

  private static final String MISSING_EXPLANATION = "No explanation given";

  /** Wording buckets, checked in order; the first bucket with a matching phrase wins. */
  static final List<HeuristicRule> HEURISTIC_RULES =
      List.of(
          new HeuristicRule(
              List.of("couldn't find", "don't have", "no information"),
              new ConfidenceAssessment(10, "No relevant information found")),
          new HeuristicRule(
              List.of("not sure", "unclear", "uncertain"),
              new ConfidenceAssessment(30, "Limited or unclear information")),
          new HeuristicRule(
              List.of("might", "possibly", "seems"),
              new ConfidenceAssessment(55, "Some relevant information but not definitive")));

  static final ConfidenceAssessment DEFAULT_ASSESSMENT =
      new ConfidenceAssessment(65, "Relevant information found");

  /** Parses the first {@code Confidence: N% - explanation} line, clamping N to [0, 100]. */
  public Optional<ConfidenceAssessment> extract(String answer) {
    Matcher matcher = CONFIDENCE_LINE.matcher(answer);
    if (!matcher.find()) {
      return Optional.empty();
    }
    String explanation = EMOJI_CODE.matcher(matcher.group(2).strip()).replaceAll("").strip();
    return Optional.of(
        new ConfidenceAssessment(
            parsePercent(matcher.group(1)),
            explanation.isEmpty() ? MISSING_EXPLANATION : explanation));
  }

  /** Estimates confidence from hedging phrases in the answer. */
  public ConfidenceAssessment assess(String answer) {
    String lower = answer.toLowerCase(Locale.ROOT);
    for (HeuristicRule rule : HEURISTIC_RULES) {
      if (rule.phrases().stream().anyMatch(lower::contains)) {
        return rule.assessment();
      }
    }
    return DEFAULT_ASSESSMENT;
  }

  /** Extracted confidence when present, otherwise the wording estimate. */
  public ConfidenceAssessment extractOrAssess(String answer) {
    return extract(answer).orElseGet(() -> assess(answer));
  }

  private static int parsePercent(String digits) {
    // \d+ may exceed int range; anything past three digits is over 100 anyway
    String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
    return trimmed.length() > 3 ? 100 : Integer.parseInt(trimmed);
  }

  record HeuristicRule(List<String> phrases, ConfidenceAssessment assessment) {}
}
