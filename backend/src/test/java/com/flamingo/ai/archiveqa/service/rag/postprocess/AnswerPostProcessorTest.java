package com.flamingo.ai.archiveqa.service.rag.postprocess;

import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.archiveqa.config.RagConfig;
import com.flamingo.ai.archiveqa.service.rag.generation.GenerationOutcome;
import com.flamingo.ai.archiveqa.service.rag.generation.RawAnswer;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.ConfidenceAssessment;
import com.flamingo.ai.archiveqa.service.rag.model.ExtractedLink;
import com.flamingo.ai.archiveqa.service.rag.model.GeneratedAnswer;
import com.flamingo.ai.archiveqa.service.rag.model.LinkKind;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AnswerPostProcessor Tests")
class AnswerPostProcessorTest {

  private static final List<Candidate> MESSAGES =
      List.of(candidate("widget lives at https://github.com/acme/widget", "engineering", "alice"));

  private AnswerPostProcessor postProcessor;

  @BeforeEach
  void setUp() {
    postProcessor =
        new AnswerPostProcessor(
            new ConfidenceExtractor(),
            new AnswerTextCleaner(),
            new ProjectLinkExtractor(),
            new EvidenceFormatter(
                new FriendlyTimestampFormatter(ZoneOffset.UTC), new RagConfig()));
  }

  @Test
  @DisplayName("Should extract confidence, clean text and append evidence for model answers")
  void shouldPostprocessModelAnswer() {
    RawAnswer raw =
        new RawAnswer(
            "Alice owns the widget. :rocket:\nConfidence: 85% - stated directly",
            "gpt-4o-mini",
            GenerationOutcome.MODEL,
            null);

    GeneratedAnswer answer = postProcessor.postprocess(raw, MESSAGES);

    assertThat(answer.confidence()).isEqualTo(85);
    assertThat(answer.confidenceExplanation()).isEqualTo("stated directly");
    assertThat(answer.text())
        .startsWith("Alice owns the widget.\n\nWhat I found:\n• alice's update in #engineering")
        .doesNotContain("Confidence")
        .doesNotContain(":rocket:");
    assertThat(answer.plainText()).isEqualTo("Alice owns the widget.");
    assertThat(answer.links())
        .containsExactly(
            new ExtractedLink(LinkKind.GITHUB, "https://github.com/acme/widget", "engineering"));
  }

  @Test
  @DisplayName("Should fall back to heuristic confidence when the model states none")
  void shouldUseHeuristicConfidence() {
    GeneratedAnswer answer = postProcessor.postprocess("It seems Alice owns it.", MESSAGES);

    assertThat(answer.confidence()).isEqualTo(55);
    assertThat(answer.text()).startsWith("It seems Alice owns it.\n\nWhat I found:");
  }

  @Test
  @DisplayName("Should keep fallback text and preset confidence but add evidence and links")
  void shouldPostprocessFallbackAnswer() {
    String text = "Hey! Based on what I saw, alice mentioned this in #engineering. **widget**";
    RawAnswer raw =
        new RawAnswer(
            text,
            "mock",
            GenerationOutcome.FALLBACK,
            new ConfidenceAssessment(50, "Mock mode - medium confidence estimate"));

    GeneratedAnswer answer = postProcessor.postprocess(raw, MESSAGES);

    assertThat(answer.text()).startsWith(text + "\n\nWhat I found:");
    assertThat(answer.plainText()).isEqualTo(text);
    assertThat(answer.confidence()).isEqualTo(50);
    assertThat(answer.confidenceExplanation())
        .isEqualTo("Mock mode - medium confidence estimate");
    assertThat(answer.links()).hasSize(1);
  }

  @Test
  @DisplayName("Should pass error answers through untouched")
  void shouldPassErrorAnswerThrough() {
    String text = "I found relevant messages but encountered an error generating an answer: boom";
    RawAnswer raw =
        new RawAnswer(
            text,
            "gpt-4o-mini",
            GenerationOutcome.ERROR,
            new ConfidenceAssessment(0, "Error: boom"));

    GeneratedAnswer answer = postProcessor.postprocess(raw, MESSAGES);

    assertThat(answer.text()).isEqualTo(text);
    assertThat(answer.plainText()).isEqualTo(text);
    assertThat(answer.confidence()).isZero();
    assertThat(answer.confidenceExplanation()).isEqualTo("Error: boom");
    assertThat(answer.links()).isEmpty();
  }
}
