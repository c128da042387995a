package com.flamingo.ai.archiveqa.service.rag.generation;

import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.CandidateMetadata;
import com.flamingo.ai.archiveqa.service.rag.model.ConfidenceAssessment;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces the raw answer for a question and its assembled context. Never throws: a missing model
 * yields a deterministic fallback answer and a failed call yields an error answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerGenerator {

  static final String FALLBACK_MODEL = "mock";
  static final int FALLBACK_CONFIDENCE = 50;
  static final String FALLBACK_EXPLANATION = "Mock mode - medium confidence estimate";
  private static final int FALLBACK_QUOTE_LENGTH = 200;

  private final CompletionCapability completionCapability;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.generation", description = "Time to generate an answer")
  public RawAnswer generate(String question, String context, List<Candidate> messages) {
    Optional<CompletionClient> client = completionCapability.client();
    if (client.isEmpty()) {
      meterRegistry.counter("qa.generation.fallback").increment();
      return fallbackAnswer(messages);
    }

    CompletionClient completionClient = client.get();
    try {
      String text =
          completionClient.complete(
              AnswerPrompts.SYSTEM_PROMPT, AnswerPrompts.userPrompt(question, context));
      log.debug(
          "Completion returned {} chars from {}", text.length(), completionClient.modelName());
      return new RawAnswer(text, completionClient.modelName(), GenerationOutcome.MODEL, null);
    } catch (RuntimeException e) {
      log.error("Failed to generate answer: {}", e.getMessage(), e);
      meterRegistry.counter("qa.generation.errors").increment();
      return errorAnswer(e, completionClient.modelName());
    }
  }

  private RawAnswer fallbackAnswer(List<Candidate> messages) {
    ConfidenceAssessment confidence =
        new ConfidenceAssessment(FALLBACK_CONFIDENCE, FALLBACK_EXPLANATION);
    if (messages.isEmpty()) {
      return new RawAnswer(
          "I couldn't find relevant information to answer this question.",
          FALLBACK_MODEL,
          GenerationOutcome.FALLBACK,
          confidence);
    }
    Candidate top = messages.get(0);
    CandidateMetadata metadata = top.metadata();
    String user = metadata.userName() != null ? metadata.userName() : "someone";
    String channel = metadata.channelName() != null ? metadata.channelName() : "unknown";
    String quote =
        top.text().length() > FALLBACK_QUOTE_LENGTH
            ? top.text().substring(0, FALLBACK_QUOTE_LENGTH)
            : top.text();
    String text =
        "Hey! Based on what I saw, " + user + " mentioned this in #" + channel + ". " + quote;
    return new RawAnswer(text, FALLBACK_MODEL, GenerationOutcome.FALLBACK, confidence);
  }

  private static RawAnswer errorAnswer(RuntimeException e, String model) {
    String error = describe(e);
    return new RawAnswer(
        "I found relevant messages but encountered an error generating an answer: " + error,
        model,
        GenerationOutcome.ERROR,
        new ConfidenceAssessment(0, "Error: " + error));
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null && !e.getMessage().isBlank()
        ? e.getMessage()
        : e.getClass().getSimpleName();
  }
}
