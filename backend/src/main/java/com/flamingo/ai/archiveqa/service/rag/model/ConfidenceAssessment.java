package com.flamingo.ai.archiveqa.service.rag.model;

/** Confidence in [0, 100] with a non-empty explanation. */
public record ConfidenceAssessment(int confidence, String explanation) {

  public ConfidenceAssessment {
    confidence = Math.max(0, Math.min(100, confidence));
    if (explanation == null || explanation.isBlank()) {
      throw new IllegalArgumentException("Confidence explanation must not be empty");
    }
  }
}
