package com.flamingo.ai.archiveqa.service.rag.model;

/** Time window and channel constraints read from the question text. Null means unconstrained. */
public record QueryIntent(Integer daysBack, String channelFilter) {

  public static QueryIntent none() {
    return new QueryIntent(null, null);
  }
}
