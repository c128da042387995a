package com.flamingo.ai.archiveqa.service.rag.postprocess;

import com.flamingo.ai.archiveqa.service.rag.generation.RawAnswer;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.ConfidenceAssessment;
import com.flamingo.ai.archiveqa.service.rag.model.GeneratedAnswer;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns raw generator output into the answer shown to users.
 *
 * <p>Model answers get the full treatment: confidence extraction, cleanup, link extraction and the
 * evidence section. Fallback answers keep their preset confidence and text but still get links and
 * evidence. Error answers are passed through untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerPostProcessor {

  private final ConfidenceExtractor confidenceExtractor;
  private final AnswerTextCleaner textCleaner;
  private final ProjectLinkExtractor linkExtractor;
  private final EvidenceFormatter evidenceFormatter;

  public GeneratedAnswer postprocess(RawAnswer raw, List<Candidate> messages) {
    return switch (raw.outcome()) {
      case MODEL -> postprocess(raw.text(), messages);
      case FALLBACK ->
          new GeneratedAnswer(
              evidenceFormatter.format(raw.text(), messages),
              raw.text(),
              raw.presetConfidence(),
              linkExtractor.extract(messages));
      case ERROR -> new GeneratedAnswer(raw.text(), raw.text(), raw.presetConfidence(), List.of());
    };
  }

  /** Post-processes text produced by the completion model. */
  public GeneratedAnswer postprocess(String rawText, List<Candidate> messages) {
    ConfidenceAssessment confidence = confidenceExtractor.extractOrAssess(rawText);
    String cleaned = textCleaner.clean(rawText);
    log.debug(
        "Answer confidence {}% ({}), {} chars after cleanup",
        confidence.confidence(),
        confidence.explanation(),
        cleaned.length());
    return new GeneratedAnswer(
        evidenceFormatter.format(cleaned, messages),
        cleaned,
        confidence,
        linkExtractor.extract(messages));
  }
}
