package com.flamingo.ai.archiveqa.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.archiveqa.exception.SearchException;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Read access to the message archive index.
 *
 * <p>Searches have no fallback: a failed search surfaces as {@link SearchException} so callers
 * never mistake an outage for an empty archive.
 */
@Service
@Slf4j
public class ArchivedMessageIndexService {

  private static final String METRIC_PREFIX = "archive_message";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;

  public ArchivedMessageIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      @Value("${elasticsearch.index.name:slack-messages}") String indexName) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
  }

  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @Retry(name = "elasticsearch")
  public List<ArchivedMessage> vectorSearch(
      ArchiveSearchCriteria criteria, List<Float> queryEmbedding, int topK) {
    log.debug(
        "vectorSearch workspace={} channel={} topK={} embedding size={}",
        criteria.workspaceId(),
        criteria.channelName(),
        topK,
        queryEmbedding.size());
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(queryEmbedding)
                                .k(topK)
                                .numCandidates(topK * 2)
                                .filter(buildFilters(criteria)))
                    .size(topK));
    return execute("vectorSearch", request);
  }

  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @Retry(name = "elasticsearch")
  public List<ArchivedMessage> keywordSearch(
      ArchiveSearchCriteria criteria, String query, int topK) {
    log.debug(
        "keywordSearch workspace={} channel={} query='{}' topK={}",
        criteria.workspaceId(),
        criteria.channelName(),
        query,
        topK);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.filter(buildFilters(criteria))
                                        .must(m -> m.match(mt -> mt.field("text").query(query)))))
                    .size(topK));
    return execute("keywordSearch", request);
  }

  List<Query> buildFilters(ArchiveSearchCriteria criteria) {
    List<Query> filters = new ArrayList<>();
    filters.add(
        Query.of(q -> q.term(t -> t.field("workspaceId").value(criteria.workspaceId()))));
    if (criteria.channelName() != null) {
      filters.add(
          Query.of(q -> q.term(t -> t.field("channelName").value(criteria.channelName()))));
    }
    if (criteria.createdAfterEpochMillis() != null) {
      double cutoff = criteria.createdAfterEpochMillis();
      filters.add(
          Query.of(q -> q.range(r -> r.number(n -> n.field("createdAt").gte(cutoff)))));
    }
    return filters;
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private List<ArchivedMessage> execute(String searchType, SearchRequest request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<ArchivedMessage> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Map<String, Object> source = hit.source();
        if (source == null) {
          continue;
        }
        ArchivedMessage message = convertFromDocument(hit.id(), source);
        if (hit.score() != null) {
          message.setRelevanceScore(hit.score());
        }
        results.add(message);
      }
      log.info("[{}] index={} returned={}", searchType, indexName, results.size());
      meterRegistry.counter(METRIC_PREFIX + "." + searchType).increment();
      return results;
    } catch (IOException e) {
      log.error("{} failed for {}: {}", searchType, indexName, e.getMessage(), e);
      meterRegistry.counter(METRIC_PREFIX + "." + searchType + ".errors").increment();
      throw new SearchException(searchType + " failed", e);
    }
  }

  private ArchivedMessage convertFromDocument(String id, Map<String, Object> source) {
    Object createdAt = source.get("createdAt");
    return ArchivedMessage.builder()
        .id(id)
        .workspaceId(asString(source.get("workspaceId")))
        .channelId(asString(source.get("channelId")))
        .channelName(asString(source.get("channelName")))
        .userId(asString(source.get("userId")))
        .userName(asString(source.get("userName")))
        .text(asString(source.get("text")))
        .timestamp(asString(source.get("timestamp")))
        .createdAt(createdAt instanceof Number n ? n.longValue() : null)
        .build();
  }

  private static String asString(Object value) {
    return value != null ? value.toString() : null;
  }
}
