package com.flamingo.ai.archiveqa.service.rag.retrieval;

import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.SCOPE;
import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.archiveqa.exception.SearchException;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.QueryIntent;
import com.flamingo.ai.archiveqa.service.rag.model.Question;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalService Tests")
class RetrievalServiceTest {

  @Mock private MessageRetriever messageRetriever;

  private RetrievalService retrievalService;

  @BeforeEach
  void setUp() {
    retrievalService = new RetrievalService(messageRetriever);
  }

  @Test
  @DisplayName("Should over-fetch three times the context size with the detected filters")
  void shouldOverFetch() {
    List<Candidate> candidates = List.of(candidate("the deploy is done"));
    when(messageRetriever.search(SCOPE, "deploy status", 30, "engineering", 7))
        .thenReturn(candidates);

    List<Candidate> result =
        retrievalService.retrieve(
            Question.of(SCOPE, "deploy status"), new QueryIntent(7, "engineering"));

    assertThat(result).isSameAs(candidates);
  }

  @Test
  @DisplayName("Should request exactly the given count when asked to")
  void shouldUseExplicitCount() {
    when(messageRetriever.search(SCOPE, "q", 20, null, null)).thenReturn(List.of());

    retrievalService.retrieve(Question.of(SCOPE, "q"), QueryIntent.none(), 20);

    verify(messageRetriever).search(SCOPE, "q", 20, null, null);
  }

  @Test
  @DisplayName("Should rethrow search failures unchanged")
  void shouldRethrowSearchException() {
    SearchException failure = new SearchException("vectorSearch failed", null);
    when(messageRetriever.search(any(), anyString(), anyInt(), any(), any())).thenThrow(failure);

    assertThatThrownBy(
            () -> retrievalService.retrieve(Question.of(SCOPE, "q"), QueryIntent.none()))
        .isSameAs(failure);
  }

  @Test
  @DisplayName("Should wrap unexpected failures in a search exception")
  void shouldWrapUnexpectedFailure() {
    IllegalStateException cause = new IllegalStateException("connection reset");
    when(messageRetriever.search(any(), anyString(), anyInt(), any(), any())).thenThrow(cause);

    assertThatThrownBy(
            () -> retrievalService.retrieve(Question.of(SCOPE, "q"), QueryIntent.none()))
        .isInstanceOf(SearchException.class)
        .hasMessage("Retrieval failed")
        .hasCause(cause);
  }
}
