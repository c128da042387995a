package com.flamingo.ai.archiveqa.service.rag.postprocess;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.archiveqa.service.rag.model.ConfidenceAssessment;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ConfidenceExtractor Tests")
class ConfidenceExtractorTest {

  private final ConfidenceExtractor extractor = new ConfidenceExtractor();

  @Nested
  @DisplayName("Extraction")
  class Extraction {

    @Test
    @DisplayName("Should read a plain confidence line")
    void shouldReadPlainLine() {
      ConfidenceAssessment result =
          extractor
              .extract("The fix ships Friday.\nConfidence: 85% - Directly stated by the owner")
              .orElseThrow();

      assertThat(result.confidence()).isEqualTo(85);
      assertThat(result.explanation()).isEqualTo("Directly stated by the owner");
    }

    @ParameterizedTest
    @ValueSource(
        strings = {
          "Answer.\n:bar_chart: Confidence: 70% - two messages agree",
          "Answer.\n**Confidence: 70%** - two messages agree",
          "Answer.\nconfidence: 70% – two messages agree",
          "Answer.\nConfidence:70%-two messages agree :thumbsup:"
        })
    void shouldTolerateDecorations(String answer) {
      ConfidenceAssessment result = extractor.extract(answer).orElseThrow();

      assertThat(result.confidence()).isEqualTo(70);
      assertThat(result.explanation()).isEqualTo("two messages agree");
    }

    @Test
    @DisplayName("Should clamp values above 100")
    void shouldClamp() {
      assertThat(extractor.extract("Confidence: 250% - very sure").orElseThrow().confidence())
          .isEqualTo(100);
      assertThat(
              extractor
                  .extract("Confidence: 99999999999999% - very sure")
                  .orElseThrow()
                  .confidence())
          .isEqualTo(100);
    }

    @Test
    @DisplayName("Should return empty when there is no confidence line")
    void shouldReturnEmptyWithoutLine() {
      assertThat(extractor.extract("The fix ships Friday.")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Heuristic")
  class Heuristic {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(
        delimiter = '|',
        quoteCharacter = '"',
        value = {
          "I couldn't find anything about that | 10",
          "I don't have recent info on this in the Slack history | 10",
          "There is no information on the launch | 10",
          "I'm not sure who owns it | 30",
          "The timeline is unclear | 30",
          "Ownership is uncertain | 30",
          "It might be Bob | 55",
          "Possibly next week | 55",
          "It seems the deploy failed | 55",
          "Alice owns the widget service | 65"
        })
    void shouldBucketByWording(String answer, int expected) {
      assertThat(extractor.assess(answer).confidence()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Earlier buckets win over later ones")
    void earlierBucketsWin() {
      assertThat(extractor.assess("It might be that I couldn't find it").confidence())
          .isEqualTo(10);
      assertThat(extractor.assess("It seems unclear").confidence()).isEqualTo(30);
    }

    @Test
    @DisplayName("Only the four documented values are produced")
    void producesOnlyDocumentedValues() {
      Set<Integer> values =
          Set.of(
              extractor.assess("couldn't find").confidence(),
              extractor.assess("not sure").confidence(),
              extractor.assess("might").confidence(),
              extractor.assess("anything else").confidence());

      assertThat(values).containsExactlyInAnyOrder(10, 30, 55, 65);
      assertThat(extractor.assess("anything").explanation())
          .isEqualTo("Relevant information found");
    }

    @Test
    @DisplayName("Extracted confidence takes precedence over wording")
    void extractionTakesPrecedence() {
      ConfidenceAssessment result =
          extractor.extractOrAssess("I'm not sure.\nConfidence: 90% - explicit in thread");

      assertThat(result.confidence()).isEqualTo(90);
    }
  }
}
