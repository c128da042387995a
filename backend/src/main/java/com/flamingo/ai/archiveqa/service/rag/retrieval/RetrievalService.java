package com.flamingo.ai.archiveqa.service.rag.retrieval;

import com.flamingo.ai.archiveqa.exception.SearchException;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.QueryIntent;
import com.flamingo.ai.archiveqa.service.rag.model.Question;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fetches candidates for a question. Over-fetches so the quality filter still has enough messages
 * left after dropping noise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalService {

  static final int OVER_FETCH_FACTOR = 3;

  private final MessageRetriever messageRetriever;

  @Timed(value = "rag.retrieval", description = "Time to retrieve candidate messages")
  public List<Candidate> retrieve(Question question, QueryIntent intent) {
    return retrieve(question, intent, question.maxContextMessages() * OVER_FETCH_FACTOR);
  }

  /** Retrieves exactly {@code nResults} candidates at most, without over-fetching. */
  public List<Candidate> retrieve(Question question, QueryIntent intent, int nResults) {
    log.debug(
        "Retrieving {} candidates for workspace {} (channel={}, daysBack={})",
        nResults,
        question.scope().workspaceId(),
        intent.channelFilter(),
        intent.daysBack());
    try {
      return messageRetriever.search(
          question.scope(), question.text(), nResults, intent.channelFilter(), intent.daysBack());
    } catch (SearchException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Retrieval failed: {}", e.getMessage(), e);
      throw new SearchException("Retrieval failed", e);
    }
  }
}
