package com.flamingo.ai.archiveqa.service.rag.model;

import lombok.Builder;

/**
 * Archive metadata attached to a retrieved message.
 *
 * @param timestamp raw archive timestamp, either chat-platform epoch seconds with a fraction
 *     ({@code 1702650000.123456}) or ISO-8601
 */
@Builder
public record CandidateMetadata(
    String channelId, String channelName, String userId, String userName, String timestamp) {}
