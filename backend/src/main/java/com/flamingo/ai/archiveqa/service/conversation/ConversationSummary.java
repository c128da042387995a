package com.flamingo.ai.archiveqa.service.conversation;

import java.time.LocalDateTime;

/** A conversation and the time of its most recent turn. */
public record ConversationSummary(String threadTs, String channelId, LocalDateTime lastUpdated) {}
