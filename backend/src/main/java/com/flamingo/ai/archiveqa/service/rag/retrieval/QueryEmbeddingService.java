package com.flamingo.ai.archiveqa.service.rag.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Embeds search queries with the configured embedding model.
 *
 * <p>An empty vector means no embedding is available (no model configured, or the model failed)
 * and callers switch to keyword search.
 */
@Service
@Slf4j
public class QueryEmbeddingService {

  // Questions are short; anything longer is almost certainly pasted content.
  private static final int MAX_QUERY_CHARS = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  public QueryEmbeddingService(
      ObjectProvider<EmbeddingModel> embeddingModel, MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel.getIfAvailable();
    this.meterRegistry = meterRegistry;
  }

  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String query) {
    if (embeddingModel == null) {
      log.debug("No embedding model configured, using keyword retrieval");
      return List.of();
    }
    String text = query.length() > MAX_QUERY_CHARS ? query.substring(0, MAX_QUERY_CHARS) : query;
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(text);
      meterRegistry.counter("embedding.requests.success").increment();
      float[] vector = response.content().vector();
      List<Float> result = new ArrayList<>(vector.length);
      for (float f : vector) {
        result.add(f);
      }
      return result;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed, falling back to keyword search: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
