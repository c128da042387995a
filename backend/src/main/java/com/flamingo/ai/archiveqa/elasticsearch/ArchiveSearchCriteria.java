package com.flamingo.ai.archiveqa.elasticsearch;

/**
 * Filters applied to every archive search.
 *
 * @param workspaceId required tenant filter
 * @param channelName exact channel name, or null for all channels
 * @param createdAfterEpochMillis lower bound on message creation time, or null for full history
 */
public record ArchiveSearchCriteria(
    String workspaceId, String channelName, Long createdAfterEpochMillis) {

  public ArchiveSearchCriteria {
    if (workspaceId == null || workspaceId.isBlank()) {
      throw new IllegalArgumentException("workspaceId filter is required for archive search");
    }
  }
}
