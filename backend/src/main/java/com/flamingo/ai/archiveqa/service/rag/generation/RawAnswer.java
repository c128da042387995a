package com.flamingo.ai.archiveqa.service.rag.generation;

import com.flamingo.ai.archiveqa.service.rag.model.ConfidenceAssessment;

/**
 * Answer text before post-processing.
 *
 * @param model the model name, or {@code mock} for the fallback path
 * @param presetConfidence confidence fixed by the generator, null when it must be read from the
 *     text
 */
public record RawAnswer(
    String text, String model, GenerationOutcome outcome, ConfidenceAssessment presetConfidence) {}
