package com.flamingo.ai.archiveqa.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chat message stored in the archive index with its vector embedding.
 *
 * <p>Documents are written by the ingestion side; this service only reads them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchivedMessage {

  private String id;
  private String workspaceId;
  private String channelId;
  private String channelName;
  private String userId;
  private String userName;
  private String text;

  /** Raw chat-platform timestamp, e.g. {@code 1702650000.123456}. */
  private String timestamp;

  /** Message creation time in epoch millis, used for time-window filtering. */
  private Long createdAt;

  private List<Float> embedding;

  // Relevance score from search results (set by search methods)
  @Builder.Default private Double relevanceScore = 0.0;
}
