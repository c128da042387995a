package com.flamingo.ai.archiveqa.service.rag.model;

import lombok.Builder;

/** Numbered reference to an archive message used to answer. */
@Builder
public record SourceCitation(
    int referenceNumber,
    String text,
    String channel,
    String user,
    String timestamp,
    double distance) {}
