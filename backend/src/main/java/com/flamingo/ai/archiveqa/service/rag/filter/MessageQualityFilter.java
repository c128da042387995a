package com.flamingo.ai.archiveqa.service.rag.filter;

import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drops retrieved messages that carry no answerable content: platform notifications, messages that
 * are mostly mentions, and very short messages.
 *
 * <p>The output is always an order-preserving subsequence of the input.
 */
@Component
@Slf4j
public class MessageQualityFilter {

  static final int MIN_TEXT_LENGTH = 10;
  static final double MAX_MENTION_RATIO = 0.5;

  static final List<String> SKIP_PATTERNS =
      List.of(
          "has joined the channel",
          "has left the channel",
          "set the channel topic",
          "set the channel description",
          "uploaded a file",
          "renamed the channel",
          "archived the channel",
          "pinned a message");

  public List<Candidate> filter(List<Candidate> candidates, int limit) {
    List<Candidate> accepted = new ArrayList<>(Math.min(candidates.size(), Math.max(limit, 0)));
    for (Candidate candidate : candidates) {
      if (accepted.size() >= limit) {
        break;
      }
      if (isSubstantive(candidate.text())) {
        accepted.add(candidate);
      }
    }
    log.debug("Quality filter kept {} of {} candidates", accepted.size(), candidates.size());
    return accepted;
  }

  boolean isSubstantive(String text) {
    if (text.strip().length() < MIN_TEXT_LENGTH) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String pattern : SKIP_PATTERNS) {
      if (lower.contains(pattern)) {
        return false;
      }
    }
    return mentionRatio(text) <= MAX_MENTION_RATIO;
  }

  private static double mentionRatio(String text) {
    String[] words = text.strip().split("\\s+");
    int wordCount = Math.max(words.length, 1);
    int mentions = 0;
    int from = 0;
    while ((from = text.indexOf("<@", from)) >= 0) {
      mentions++;
      from += 2;
    }
    return (double) mentions / wordCount;
  }
}
