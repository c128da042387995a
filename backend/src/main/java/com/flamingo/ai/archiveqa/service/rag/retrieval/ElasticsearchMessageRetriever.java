package com.flamingo.ai.archiveqa.service.rag.retrieval;

import com.flamingo.ai.archiveqa.elasticsearch.ArchiveSearchCriteria;
import com.flamingo.ai.archiveqa.elasticsearch.ArchivedMessage;
import com.flamingo.ai.archiveqa.elasticsearch.ArchivedMessageIndexService;
import com.flamingo.ai.archiveqa.service.rag.model.Candidate;
import com.flamingo.ai.archiveqa.service.rag.model.CandidateMetadata;
import com.flamingo.ai.archiveqa.service.rag.model.WorkspaceScope;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link MessageRetriever} backed by the Elasticsearch archive index. Uses kNN search when the
 * query can be embedded and BM25 keyword search otherwise.
 */
@Component
@Slf4j
public class ElasticsearchMessageRetriever implements MessageRetriever {

  private final ArchivedMessageIndexService indexService;
  private final QueryEmbeddingService queryEmbeddingService;
  private final Clock clock;

  @Autowired
  public ElasticsearchMessageRetriever(
      ArchivedMessageIndexService indexService, QueryEmbeddingService queryEmbeddingService) {
    this(indexService, queryEmbeddingService, Clock.systemUTC());
  }

  @VisibleForTesting
  ElasticsearchMessageRetriever(
      ArchivedMessageIndexService indexService,
      QueryEmbeddingService queryEmbeddingService,
      Clock clock) {
    this.indexService = indexService;
    this.queryEmbeddingService = queryEmbeddingService;
    this.clock = clock;
  }

  @Override
  public List<Candidate> search(
      WorkspaceScope scope, String query, int nResults, String channelFilter, Integer daysBack) {
    Long createdAfter =
        daysBack != null ? clock.millis() - Duration.ofDays(daysBack).toMillis() : null;
    ArchiveSearchCriteria criteria =
        new ArchiveSearchCriteria(scope.workspaceId(), channelFilter, createdAfter);

    List<Float> embedding = queryEmbeddingService.embedQuery(query);
    List<ArchivedMessage> hits;
    DoubleUnaryOperator toDistance;
    if (embedding.isEmpty()) {
      log.debug("Query embedding unavailable, using keyword search");
      hits = indexService.keywordSearch(criteria, query, nResults);
      toDistance = ElasticsearchMessageRetriever::bm25Distance;
    } else {
      hits = indexService.vectorSearch(criteria, embedding, nResults);
      toDistance = ElasticsearchMessageRetriever::cosineDistance;
    }

    List<Candidate> candidates = new ArrayList<>(hits.size());
    for (ArchivedMessage hit : hits) {
      double score = hit.getRelevanceScore() != null ? hit.getRelevanceScore() : 0.0;
      candidates.add(
          new Candidate(hit.getText(), toDistance.applyAsDouble(score), toMetadata(hit)));
    }
    candidates.sort(Comparator.comparingDouble(Candidate::distance));
    return candidates;
  }

  /** kNN cosine scores are {@code (1 + cos) / 2}; cosine distance is {@code 1 - cos}. */
  @VisibleForTesting
  static double cosineDistance(double score) {
    return 2 * (1 - score);
  }

  /** Maps an unbounded BM25 score into (0, 1], higher scores giving smaller distances. */
  @VisibleForTesting
  static double bm25Distance(double score) {
    return 1 / (1 + score);
  }

  private static CandidateMetadata toMetadata(ArchivedMessage hit) {
    return CandidateMetadata.builder()
        .channelId(hit.getChannelId())
        .channelName(hit.getChannelName())
        .userId(hit.getUserId())
        .userName(hit.getUserName())
        .timestamp(hit.getTimestamp())
        .build();
  }
}
