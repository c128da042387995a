package com.flamingo.ai.archiveqa.service.rag.model;

import java.util.List;

/**
 * Post-processed answer: cleaned text with evidence, confidence and extracted links.
 *
 * <p>{@code plainText} is the answer before the evidence section was appended. It is what a
 * conversation records as the assistant turn.
 */
public record GeneratedAnswer(
    String text,
    String plainText,
    int confidence,
    String confidenceExplanation,
    List<ExtractedLink> links) {

  public GeneratedAnswer {
    links = links != null ? List.copyOf(links) : List.of();
  }

  public GeneratedAnswer(
      String text, String plainText, ConfidenceAssessment assessment, List<ExtractedLink> links) {
    this(text, plainText, assessment.confidence(), assessment.explanation(), links);
  }
}
