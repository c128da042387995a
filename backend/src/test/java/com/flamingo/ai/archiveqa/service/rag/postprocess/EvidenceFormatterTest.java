package com.flamingo.ai.archiveqa.service.rag.postprocess;

import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.candidate;
import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.withMetadata;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.archiveqa.config.RagConfig;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.CandidateMetadata;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EvidenceFormatter Tests")
class EvidenceFormatterTest {

  private EvidenceFormatter formatter;

  @BeforeEach
  void setUp() {
    formatter =
        new EvidenceFormatter(new FriendlyTimestampFormatter(ZoneOffset.UTC), new RagConfig());
  }

  @Test
  @DisplayName("Should append a bullet per message under the header")
  void shouldAppendEvidence() {
    String text =
        formatter.format(
            "Deploys are green.",
            List.of(
                candidate("Deploy is done", "engineering", "alice"),
                candidate("  Rollback not needed  ", "ops", "bob")));

    assertThat(text)
        .isEqualTo(
            "Deploys are green."
                + "\n\nWhat I found:"
                + "\n• alice's update in #engineering (Dec 15, 2pm): \"Deploy is done\""
                + "\n• bob's update in #ops (Dec 15, 2pm): \"Rollback not needed\"");
  }

  @Test
  @DisplayName("Should quote at most three messages and count the rest")
  void shouldLimitEntries() {
    List<Candidate> messages =
        List.of(
            candidate("first message"),
            candidate("second message"),
            candidate("third message"),
            candidate("fourth message"),
            candidate("fifth message"));

    String text = formatter.format("Answer.", messages);

    assertThat(text).contains("third message").doesNotContain("fourth message");
    assertThat(text).endsWith("\"third message\"\n\n...and 2 more");
  }

  @Test
  @DisplayName("Should truncate long quotes to 150 characters")
  void shouldTruncateLongQuotes() {
    String text = formatter.format("Answer.", List.of(candidate("x".repeat(200))));

    assertThat(text).endsWith(": \"" + "x".repeat(147) + "...\"");
  }

  @Test
  @DisplayName("Should keep quotes of exactly 150 characters")
  void shouldKeepQuoteAtLimit() {
    String text = formatter.format("Answer.", List.of(candidate("y".repeat(150))));

    assertThat(text).endsWith(": \"" + "y".repeat(150) + "\"");
  }

  @Test
  @DisplayName("Should render missing metadata as unknown and recently")
  void shouldRenderMissingMetadata() {
    String text =
        formatter.format(
            "Answer.", List.of(withMetadata("hi", 0.1, CandidateMetadata.builder().build())));

    assertThat(text).endsWith("\n• unknown's update in #unknown (recently): \"hi\"");
  }

  @Test
  @DisplayName("Should leave the answer untouched when there are no messages")
  void shouldSkipEmptyEvidence() {
    assertThat(formatter.format("Answer.", List.of())).isEqualTo("Answer.");
  }

  @Test
  @DisplayName("Should produce identical output for identical input")
  void shouldBeDeterministic() {
    List<Candidate> messages = List.of(candidate("same input"), candidate("other input"));

    assertThat(formatter.format("Answer.", messages))
        .isEqualTo(formatter.format("Answer.", messages));
  }
}
