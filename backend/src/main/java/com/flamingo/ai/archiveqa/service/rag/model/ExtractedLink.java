package com.flamingo.ai.archiveqa.service.rag.model;

/** A project link found in the text of a retrieved message. */
public record ExtractedLink(LinkKind kind, String url, String sourceChannel) {}
