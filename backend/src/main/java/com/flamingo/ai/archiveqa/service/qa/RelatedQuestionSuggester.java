package com.flamingo.ai.archiveqa.service.qa;

import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import java.util.List;
import org.springframework.stereotype.Component;

/** Proposes follow-up questions once the archive is known to cover a topic. */
@Component
public class RelatedQuestionSuggester {

  static final List<String> SUGGESTIONS =
      List.of(
          "Who is the expert on this topic?",
          "When was this last discussed?",
          "Are there any related GitHub PRs?");

  public List<String> suggest(List<Candidate> relatedMessages, int count) {
    if (relatedMessages.isEmpty() || count <= 0) {
      return List.of();
    }
    return SUGGESTIONS.subList(0, Math.min(count, SUGGESTIONS.size()));
  }
}
