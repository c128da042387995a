package com.flamingo.ai.archiveqa.service.rag.postprocess;

import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.candidate;
import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.withMetadata;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.archiveqa.service.rag.model.CandidateMetadata;
import com.flamingo.ai.archiveqa.service.rag.model.ExtractedLink;
import com.flamingo.ai.archiveqa.service.rag.model.LinkKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProjectLinkExtractor Tests")
class ProjectLinkExtractorTest {

  private final ProjectLinkExtractor extractor = new ProjectLinkExtractor();

  @Test
  @DisplayName("Should report a repeated GitHub link once")
  void shouldDeduplicateRepeatedLink() {
    List<ExtractedLink> links =
        extractor.extract(
            List.of(
                candidate(
                    "https://github.com/acme/widget and also https://github.com/acme/widget again",
                    "engineering",
                    "alice")));

    assertThat(links)
        .containsExactly(
            new ExtractedLink(LinkKind.GITHUB, "https://github.com/acme/widget", "engineering"));
  }

  @Test
  @DisplayName("Should tag a link with the channel of its first occurrence")
  void shouldKeepFirstChannel() {
    List<ExtractedLink> links =
        extractor.extract(
            List.of(
                candidate("repo: https://github.com/acme/widget", "engineering", "alice"),
                candidate("mirror of https://github.com/acme/widget", "random", "bob")));

    assertThat(links).hasSize(1);
    assertThat(links.get(0).sourceChannel()).isEqualTo("engineering");
  }

  @Test
  @DisplayName("Should list GitHub links before documentation links within a message")
  void shouldOrderGithubFirst() {
    List<ExtractedLink> links =
        extractor.extract(
            List.of(
                candidate(
                    "docs at https://docs.acme.dev/guide,"
                        + " code at https://github.com/acme/widget.")));

    assertThat(links)
        .extracting(ExtractedLink::kind, ExtractedLink::url)
        .containsExactly(
            tuple(LinkKind.GITHUB, "https://github.com/acme/widget"),
            tuple(LinkKind.DOCUMENTATION, "https://docs.acme.dev/guide"));
  }

  @Test
  @DisplayName("Should recognise hosted documentation sites")
  void shouldRecogniseHostedDocs() {
    List<ExtractedLink> links =
        extractor.extract(
            List.of(
                candidate("See https://widget.readthedocs.io/en/latest/."),
                candidate("Pages: https://acme.github.io/widget/")));

    assertThat(links)
        .extracting(ExtractedLink::url)
        .containsExactly(
            "https://widget.readthedocs.io/en/latest/", "https://acme.github.io/widget/");
    assertThat(links).allMatch(link -> link.kind() == LinkKind.DOCUMENTATION);
  }

  @Test
  @DisplayName("Should use unknown when the message has no channel")
  void shouldUseUnknownChannel() {
    List<ExtractedLink> links =
        extractor.extract(
            List.of(
                withMetadata(
                    "https://github.com/acme/widget", 0.1, CandidateMetadata.builder().build())));

    assertThat(links.get(0).sourceChannel()).isEqualTo("unknown");
  }

  @Test
  @DisplayName("Should return nothing for messages without project links")
  void shouldReturnEmpty() {
    assertThat(extractor.extract(List.of(candidate("see https://example.com/page")))).isEmpty();
    assertThat(extractor.extract(List.of())).isEmpty();
  }

  @Test
  @DisplayName("Should strip trailing punctuation from matched URLs")
  void shouldStripTrailingPunctuation() {
    assertThat(ProjectLinkExtractor.stripTrailingPunctuation("https://x.io/a)."))
        .isEqualTo("https://x.io/a");
    assertThat(ProjectLinkExtractor.stripTrailingPunctuation("https://x.io/a"))
        .isEqualTo("https://x.io/a");
  }
}
