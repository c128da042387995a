package com.flamingo.ai.archiveqa.service.rag.postprocess;

import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Normalizes model output for chat display. Transforms run in list order; later steps assume the
 * earlier ones already ran.
 */
@Component
@Slf4j
public class AnswerTextCleaner {

  /**
   * Removes every confidence line and trims the result. Post: no {@code Confidence: N% - ...} line
   * remains.
   */
  static final TextTransform STRIP_CONFIDENCE_LINE =
      TextTransform.of(
          "strip-confidence-line",
          text -> ConfidenceExtractor.CONFIDENCE_LINE.matcher(text).replaceAll("").strip());

  /**
   * Removes a "Related Links:" heading and the paragraph under it, up to the next blank line or the
   * end of the text.
   */
  static final TextTransform STRIP_RELATED_LINKS_SECTION =
      TextTransform.replaceAll(
          "strip-related-links-section",
          Pattern.compile(
              ":?\\w*:?\\s*\\*{0,2}Related Links?:?\\*{0,2}\\s*\\n.*?(?=\\n\\n|\\z)",
              Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
          "");

  /** Same as the related links step, for "Sources:" sections. */
  static final TextTransform STRIP_SOURCES_SECTION =
      TextTransform.replaceAll(
          "strip-sources-section",
          Pattern.compile(
              ":?\\w*:?\\s*\\*{0,2}Sources?:?\\*{0,2}\\s*\\n.*?(?=\\n\\n|\\z)",
              Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
          "");

  /** Removes citation lines shaped like {@code [1] #standup - alice: _quote_}. */
  static final TextTransform STRIP_NUMBERED_CITATIONS =
      TextTransform.replaceAll(
          "strip-numbered-citations",
          Pattern.compile("\\[\\d+\\]\\s+#[\\w-]+\\s+-\\s+[^:]*:\\s+_[^_]+_\\n?"),
          "");

  /** Removes {@code :emoji:} shortcodes. */
  static final TextTransform STRIP_EMOJI_CODES =
      TextTransform.replaceAll("strip-emoji-codes", ConfidenceExtractor.EMOJI_CODE, "");

  /** Post: no {@code **bold**} spans remain; they are {@code *bold*}. */
  static final TextTransform SLACK_BOLD =
      TextTransform.replaceAll("slack-bold", Pattern.compile("\\*\\*([^*]+?)\\*\\*"), "*$1*");

  /** Post: at most one blank line in a row, no leading or trailing whitespace. */
  static final TextTransform COLLAPSE_BLANK_LINES =
      TextTransform.of(
          "collapse-blank-lines", text -> text.replaceAll("\\n{3,}", "\n\n").strip());

  static final List<TextTransform> TRANSFORMS =
      List.of(
          STRIP_CONFIDENCE_LINE,
          STRIP_RELATED_LINKS_SECTION,
          STRIP_SOURCES_SECTION,
          STRIP_NUMBERED_CITATIONS,
          STRIP_EMOJI_CODES,
          SLACK_BOLD,
          COLLAPSE_BLANK_LINES);

  public String clean(String answer) {
    String text = answer;
    for (TextTransform transform : TRANSFORMS) {
      text = transform.apply(text);
    }
    log.debug("Cleaned answer: {} -> {} chars", answer.length(), text.length());
    return text;
  }
}
